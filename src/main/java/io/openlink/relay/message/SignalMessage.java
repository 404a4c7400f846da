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

/**
 * WebRTC signaling. The whole object is forwarded, so it is kept as received.
 */
@Getter
public class SignalMessage extends RelayMessage {

    private final String sessionId;
    private final String targetId;

    public SignalMessage(ObjectNode raw) throws MessageException {
        super(MessageType.SIGNAL, raw);
        this.sessionId = text(raw, "sessionId");
        this.targetId = text(raw, "targetId");
        if (sessionId == null) {
            throw new MessageException("Missing sessionId in signal");
        }
    }

    /**
     * Copy of the original object with {@code senderId} added.
     */
    public ObjectNode forwardFrom(String senderId) {
        ObjectNode copy = raw.deepCopy();
        copy.put("senderId", senderId);
        return copy;
    }
}
