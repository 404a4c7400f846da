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
package io.openlink.trust;

import lombok.Getter;

/**
 * Ban status of a host. When the registry cannot be reached the host is reported as not banned
 * and {@link #isUnknown()} is set.
 */
@Getter
public class BanStatus {

    private final boolean banned;
    private final boolean unknown;
    private final String reason;
    private final Long expiresAt;
    private final String error;

    private BanStatus(boolean banned, boolean unknown, String reason, Long expiresAt, String error) {
        this.banned = banned;
        this.unknown = unknown;
        this.reason = reason;
        this.expiresAt = expiresAt;
        this.error = error;
    }

    static BanStatus of(boolean banned, String reason, Long expiresAt) {
        return new BanStatus(banned, false, reason, expiresAt, null);
    }

    static BanStatus unknown(String error) {
        return new BanStatus(false, true, null, null, error);
    }

    @Override
    public String toString() {
        return unknown ? "BanStatus [unknown: " + error + "]" : "BanStatus [banned=" + banned + "]";
    }
}
