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
package io.openlink.relay.auth;

import io.openlink.core.OperationResult;

/**
 * Outcome of a client credential check.
 */
public class AuthResult extends OperationResult {

    public static final String IP_BLOCKED = "IP blocked";
    public static final String IP_NOT_WHITELISTED = "IP not whitelisted";
    public static final String INVALID_PIN = "Invalid PIN";
    public static final String INVALID_PASSWORD = "Invalid password";
    public static final String INVALID_2FA_CODE = "Invalid 2FA code";
    public static final String PIN_EXPIRED = "PIN has expired";

    private static final AuthResult ALLOWED = new AuthResult(true, null);

    private AuthResult(boolean success, String error) {
        super(success, error);
    }

    public static AuthResult allow() {
        return ALLOWED;
    }

    public static AuthResult deny(String reason) {
        return new AuthResult(false, reason);
    }
}
