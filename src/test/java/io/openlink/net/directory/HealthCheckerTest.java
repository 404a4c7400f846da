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

import io.openlink.net.http.HttpFetcher;
import io.openlink.net.http.HttpResult;
import org.junit.Before;
import org.junit.Test;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class HealthCheckerTest {

    private HttpFetcher http;
    private Clock clock;
    private HealthChecker checker;

    @Before
    public void setUp() {
        http = mock(HttpFetcher.class);
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(1_000L, 1_040L);
        checker = new HealthChecker(http, Duration.ofSeconds(5), clock);
    }

    @Test
    public void testToHealthUrl() throws Exception {
        assertEquals("https://a.example.com:8443/health", HealthChecker.toHealthUrl("wss://a.example.com:8443/relay"));
        assertEquals("http://localhost:8765/health", HealthChecker.toHealthUrl("ws://localhost:8765"));
        assertEquals("https://b.example.com/health", HealthChecker.toHealthUrl("https://b.example.com"));
    }

    @Test
    public void testOnline() throws Exception {
        when(http.get(eq("https://a.example.com/health"), anyMap(), any(Duration.class)))
                .thenReturn(new HttpResult(200, "{\"status\":\"healthy\"}"));

        HealthResult result = checker.check("wss://a.example.com");
        assertEquals(HealthStatus.ONLINE, result.getStatus());
        assertEquals("latency", Long.valueOf(40), result.getLatency());
        assertTrue(result.isOnline());
    }

    @Test
    public void testDegraded() throws Exception {
        when(http.get(any(), anyMap(), any(Duration.class))).thenReturn(new HttpResult(503, ""));

        HealthResult result = checker.check("wss://a.example.com");
        assertEquals(HealthStatus.DEGRADED, result.getStatus());
        assertFalse(result.isOnline());
    }

    @Test
    public void testTimeout() throws Exception {
        when(http.get(any(), anyMap(), any(Duration.class))).thenThrow(new HttpTimeoutException("timed out"));

        HealthResult result = checker.check("wss://a.example.com");
        assertEquals(HealthStatus.TIMEOUT, result.getStatus());
        assertNull(result.getLatency());
    }

    @Test
    public void testOffline() throws Exception {
        when(http.get(any(), anyMap(), any(Duration.class))).thenThrow(new ConnectException("refused"));

        assertEquals(HealthStatus.OFFLINE, checker.check("ws://localhost:8765").getStatus());
    }

    @Test
    public void testInvalidUrl() {
        HealthResult result = checker.check("ftp://files.example.com");
        assertEquals(HealthStatus.ERROR, result.getStatus());
        assertEquals(HealthStatus.ERROR, checker.check("not a url").getStatus());
        verifyNoInteractions(http);
    }
}
