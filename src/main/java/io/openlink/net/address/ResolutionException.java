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
package io.openlink.net.address;

import lombok.Getter;

/**
 * A Web3 domain could not be turned into a relay endpoint. Callers may retry with the literal address.
 */
@Getter
public class ResolutionException extends Exception {

    public enum Reason {
        DOMAIN_NOT_FOUND,
        NETWORK_ERROR,
        INVALID_RESPONSE
    }

    private final Reason reason;
    private final String domain;

    public ResolutionException(Reason reason, String domain, String message) {
        super(message);
        this.reason = reason;
        this.domain = domain;
    }

    public ResolutionException(Reason reason, String domain, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.domain = domain;
    }
}
