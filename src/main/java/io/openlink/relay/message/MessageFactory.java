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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class MessageFactory {

    private final ObjectMapper mapper;

    public MessageFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Decode a text frame.
     *
     * @param text
     *            The frame content
     * @return The decoded message, or NULL if the message type is unknown
     * @throws MessageException
     *             when the frame is not a JSON object or required fields are missing
     */
    public RelayMessage create(String text) throws MessageException {
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MessageException("Malformed JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MessageException("Message is not a JSON object");
        }
        ObjectNode raw = (ObjectNode) node;

        MessageType type = MessageType.of(raw.path("type").asText(null));
        if (type == null) {
            return null;
        }

        return switch (type) {
            case AUTHENTICATE -> new AuthenticateMessage(raw);
            case CREATE_SESSION -> new CreateSessionMessage(raw);
            case JOIN_SESSION -> new JoinSessionMessage(raw);
            case LEAVE_SESSION -> new LeaveSessionMessage(raw);
            case SIGNAL -> new SignalMessage(raw);
            case RELAY_DATA -> new RelayDataMessage(raw);
            case RELAY_MEDIA -> new RelayMediaMessage(raw);
            case BROADCAST -> new BroadcastMessage(raw);
        };
    }

    /**
     * Decode a binary frame, which is always a media chunk.
     */
    public RelayMediaMessage create(byte[] frame) throws MessageException {
        return new RelayMediaMessage(frame);
    }
}
