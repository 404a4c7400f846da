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
package io.openlink.net.directory;

import lombok.Getter;

/**
 * Outcome of a single health probe.
 */
@Getter
public class HealthResult {

    private final HealthStatus status;
    private final Long latency;
    private final String error;

    private HealthResult(HealthStatus status, Long latency, String error) {
        this.status = status;
        this.latency = latency;
        this.error = error;
    }

    public static HealthResult online(long latency) {
        return new HealthResult(HealthStatus.ONLINE, latency, null);
    }

    public static HealthResult degraded(long latency) {
        return new HealthResult(HealthStatus.DEGRADED, latency, null);
    }

    public static HealthResult offline() {
        return new HealthResult(HealthStatus.OFFLINE, null, null);
    }

    public static HealthResult timeout() {
        return new HealthResult(HealthStatus.TIMEOUT, null, null);
    }

    public static HealthResult error(String error) {
        return new HealthResult(HealthStatus.ERROR, null, error);
    }

    public boolean isOnline() {
        return status == HealthStatus.ONLINE;
    }

    @Override
    public String toString() {
        return "HealthResult [status=" + status + ", latency=" + latency + "]";
    }
}
