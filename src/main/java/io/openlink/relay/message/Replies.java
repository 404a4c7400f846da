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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;

/**
 * Outbound messages sent by the relay.
 */
public final class Replies {

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private Replies() {
    }

    private static ObjectNode of(String type) {
        ObjectNode node = nodes.objectNode();
        node.put("type", type);
        return node;
    }

    public static ObjectNode connected(String clientId) {
        return of("connected").put("clientId", clientId);
    }

    public static ObjectNode authRequired(String clientId, String accessMode, String serverName) {
        ObjectNode node = of("auth-required").put("clientId", clientId).put("accessMode", accessMode);
        node.put("serverName", serverName);
        return node;
    }

    public static ObjectNode authSuccess(String clientId) {
        return of("auth-success").put("clientId", clientId);
    }

    public static ObjectNode authFailed(String error) {
        return of("auth-failed").put("error", error);
    }

    public static ObjectNode authTimeout() {
        return of("auth-timeout").put("error", "Authentication timeout");
    }

    public static ObjectNode error(String error) {
        return of("error").put("error", error);
    }

    public static ObjectNode error(String error, String sessionId) {
        return error(error).put("sessionId", sessionId);
    }

    public static ObjectNode sessionCreated(String sessionId) {
        return of("session-created").put("sessionId", sessionId).put("isHost", true);
    }

    public static ObjectNode sessionJoined(String sessionId, String host, Collection<String> participants) {
        ObjectNode node = of("session-joined").put("sessionId", sessionId).put("host", host);
        ArrayNode list = node.putArray("participants");
        participants.forEach(list::add);
        return node;
    }

    public static ObjectNode peerJoined(String sessionId, String peerId) {
        return of("peer-joined").put("sessionId", sessionId).put("peerId", peerId);
    }

    public static ObjectNode peerLeft(String sessionId, String peerId) {
        return of("peer-left").put("sessionId", sessionId).put("peerId", peerId);
    }

    public static ObjectNode relayData(String senderId, JsonNode payload) {
        ObjectNode node = of("relay-data").put("senderId", senderId);
        node.set("payload", payload);
        return node;
    }

    public static ObjectNode broadcast(String senderId, JsonNode payload) {
        ObjectNode node = of("broadcast").put("senderId", senderId);
        node.set("payload", payload);
        return node;
    }
}
