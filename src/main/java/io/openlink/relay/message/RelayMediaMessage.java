/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2024-2030 The OpenLink Developers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.openlink.relay.message;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A media chunk for one target. Arrives either as JSON with a base64 payload or as a binary frame
 * {@code [1 byte id length][id, UTF-8][media bytes]}.
 */
@Getter
public class RelayMediaMessage extends RelayMessage {

    public static final int MAX_TARGET_ID_LENGTH = 255;

    private final String targetId;
    private final byte[] payload;

    public RelayMediaMessage(ObjectNode raw) throws MessageException {
        super(MessageType.RELAY_MEDIA, raw);
        this.targetId = text(raw, "targetId");
        if (targetId == null) {
            throw new MessageException("Missing targetId in relay-media");
        }
        String encoded = text(raw, "payload");
        if (encoded == null || !Base64.isBase64(encoded)) {
            throw new MessageException("relay-media payload must be base64");
        }
        this.payload = Base64.decodeBase64(encoded);
    }

    /**
     * Parse a binary frame.
     */
    public RelayMediaMessage(byte[] frame) throws MessageException {
        super(MessageType.RELAY_MEDIA, null);
        if (frame == null || frame.length < 1) {
            throw new MessageException("Empty media frame");
        }
        int idLength = frame[0] & 0xff;
        if (idLength == 0 || frame.length < 1 + idLength) {
            throw new MessageException("Truncated media frame header");
        }
        this.targetId = new String(frame, 1, idLength, StandardCharsets.UTF_8);
        this.payload = Arrays.copyOfRange(frame, 1 + idLength, frame.length);
    }

    /**
     * Encode a binary frame addressed to {@code targetId}.
     */
    public static byte[] encodeFrame(String targetId, byte[] media) {
        byte[] id = targetId.getBytes(StandardCharsets.UTF_8);
        if (id.length == 0 || id.length > MAX_TARGET_ID_LENGTH) {
            throw new IllegalArgumentException("Invalid target id length: " + id.length);
        }
        byte[] frame = new byte[1 + id.length + media.length];
        frame[0] = (byte) id.length;
        System.arraycopy(id, 0, frame, 1, id.length);
        System.arraycopy(media, 0, frame, 1 + id.length, media.length);
        return frame;
    }

    @Override
    public String toString() {
        return "RelayMediaMessage [targetId=" + targetId + ", bytes=" + payload.length + "]";
    }
}
