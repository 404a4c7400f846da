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

import java.util.HashMap;
import java.util.Map;

/**
 * Inbound message types accepted by the relay.
 */
public enum MessageType {

    AUTHENTICATE("authenticate"),
    CREATE_SESSION("create-session"),
    JOIN_SESSION("join-session"),
    LEAVE_SESSION("leave-session"),
    SIGNAL("signal"),
    RELAY_DATA("relay-data"),
    RELAY_MEDIA("relay-media"),
    BROADCAST("broadcast");

    private static final Map<String, MessageType> map = new HashMap<>();

    static {
        for (MessageType t : MessageType.values()) {
            map.put(t.wireName, t);
        }
    }

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the type, or null if {@code wireName} is unknown
     */
    public static MessageType of(String wireName) {
        return wireName == null ? null : map.get(wireName);
    }

    public String getWireName() {
        return wireName;
    }
}
