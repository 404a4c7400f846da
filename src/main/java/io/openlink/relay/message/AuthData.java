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
import lombok.Getter;

/**
 * Credentials carried by an {@code authenticate} message. Any field may be absent.
 */
@Getter
public class AuthData {

    public static final AuthData EMPTY = new AuthData(null, null, null, null);

    private final String pin;
    private final String password;
    private final String totpCode;
    private final String connectionPin;

    public AuthData(String pin, String password, String totpCode, String connectionPin) {
        this.pin = pin;
        this.password = password;
        this.totpCode = totpCode;
        this.connectionPin = connectionPin;
    }

    static AuthData from(JsonNode node) {
        if (node == null || !node.isObject()) {
            return EMPTY;
        }
        return new AuthData(field(node, "pin"), field(node, "password"), field(node, "totpCode"),
                field(node, "connectionPin"));
    }

    private static String field(JsonNode node, String name) {
        JsonNode v = node.get(name);
        return v == null || v.isNull() ? null : v.asText();
    }

    @Override
    public String toString() {
        // never log credential values
        return "AuthData [pin=" + (pin != null) + ", password=" + (password != null)
                + ", totpCode=" + (totpCode != null) + ", connectionPin=" + (connectionPin != null) + "]";
    }
}
