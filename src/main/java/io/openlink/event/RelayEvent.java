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
package io.openlink.event;

import com.google.common.collect.ImmutableMap;
import lombok.Getter;

import java.util.Map;

/**
 * Notification published by the relay and the server directory.
 */
@Getter
public class RelayEvent {

    public enum Type {
        SERVER_STARTED,
        SERVER_STOPPED,
        CLIENT_CONNECTED,
        CLIENT_AUTHENTICATED,
        CLIENT_DISCONNECTED,
        SESSION_CREATED,
        SESSION_CLOSED,
        HEALTH_CHANGED
    }

    private final Type type;
    private final Map<String, Object> payload;
    private final long timestamp;

    public RelayEvent(Type type, Map<String, Object> payload, long timestamp) {
        this.type = type;
        this.payload = payload == null ? ImmutableMap.of() : ImmutableMap.copyOf(payload);
        this.timestamp = timestamp;
    }

    public Object get(String key) {
        return payload.get(key);
    }

    @Override
    public String toString() {
        return "RelayEvent [type=" + type + ", payload=" + payload + "]";
    }
}
