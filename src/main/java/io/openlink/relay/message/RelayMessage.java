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
 * Base of all decoded inbound messages. {@code raw} is the JSON object as received, or null for
 * binary frames.
 */
@Getter
public abstract class RelayMessage {

    protected final MessageType type;
    protected final ObjectNode raw;

    protected RelayMessage(MessageType type, ObjectNode raw) {
        this.type = type;
        this.raw = raw;
    }

    protected static String text(ObjectNode raw, String field) {
        if (raw == null || !raw.hasNonNull(field)) {
            return null;
        }
        String value = raw.get(field).asText();
        return value.isEmpty() ? null : value;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [type=" + type.getWireName() + "]";
    }
}
