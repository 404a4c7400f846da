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
package io.openlink.relay;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class RelayStats {

    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong totalSessions = new AtomicLong();
    private final AtomicLong bytesRelayed = new AtomicLong();
    private volatile Long startTime;

    public void onConnection() {
        totalConnections.incrementAndGet();
    }

    public void onSession() {
        totalSessions.incrementAndGet();
    }

    public void onRelayed(long bytes) {
        bytesRelayed.addAndGet(bytes);
    }

    public void markStarted(long time) {
        startTime = time;
    }

    public long getTotalConnections() {
        return totalConnections.get();
    }

    public long getTotalSessions() {
        return totalSessions.get();
    }

    public long getBytesRelayed() {
        return bytesRelayed.get();
    }

    public Long getStartTime() {
        return startTime;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalConnections", getTotalConnections());
        map.put("totalSessions", getTotalSessions());
        map.put("bytesRelayed", getBytesRelayed());
        map.put("startTime", startTime);
        return map;
    }
}
