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
import lombok.Getter;

@Getter
public class ConnectionPinResult extends OperationResult {

    private final String pin;
    private final long expiry;
    private final boolean oneTime;

    private ConnectionPinResult(boolean success, String error, String pin, long expiry, boolean oneTime) {
        super(success, error);
        this.pin = pin;
        this.expiry = expiry;
        this.oneTime = oneTime;
    }

    public static ConnectionPinResult set(String pin, long expiry, boolean oneTime) {
        return new ConnectionPinResult(true, null, pin, expiry, oneTime);
    }

    public static ConnectionPinResult rejected(String error) {
        return new ConnectionPinResult(false, error, null, 0, false);
    }
}
