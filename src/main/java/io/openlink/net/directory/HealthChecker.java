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

import com.google.common.collect.ImmutableMap;
import io.openlink.net.http.HttpFetcher;
import io.openlink.net.http.HttpResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Probes {@code /health} of a relay. ws/wss URLs are probed over http/https respectively.
 * <p>
 * Probing is a reachability check only; the fetcher given here is expected to accept
 * self-signed certificates. No failure is ever thrown, every outcome is a {@link HealthResult}.
 */
@Slf4j
public class HealthChecker {

    private final HttpFetcher http;
    private final Duration timeout;
    private final Clock clock;

    public HealthChecker(HttpFetcher http, Duration timeout, Clock clock) {
        this.http = http;
        this.timeout = timeout;
        this.clock = clock;
    }

    public HealthResult check(String serverUrl) {
        String healthUrl;
        try {
            healthUrl = toHealthUrl(serverUrl);
        } catch (URISyntaxException | IllegalArgumentException e) {
            return HealthResult.error("Invalid server URL: " + serverUrl);
        }

        long start = clock.millis();
        try {
            HttpResult result = http.get(healthUrl, ImmutableMap.of(), timeout);
            long latency = Math.max(0, clock.millis() - start);
            return result.isOk() ? HealthResult.online(latency) : HealthResult.degraded(latency);
        } catch (HttpTimeoutException e) {
            return HealthResult.timeout();
        } catch (IOException e) {
            log.debug("Health check failed for {}: {}", serverUrl, e.getMessage());
            return HealthResult.offline();
        } catch (RuntimeException e) {
            log.debug("Health check error for {}", serverUrl, e);
            return HealthResult.error(e.getMessage());
        }
    }

    static String toHealthUrl(String serverUrl) throws URISyntaxException {
        URI uri = new URI(serverUrl.trim());
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String httpScheme = switch (scheme) {
            case "wss", "https" -> "https";
            case "ws", "http" -> "http";
            default -> throw new IllegalArgumentException("Unsupported scheme: " + scheme);
        };
        if (uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("Missing host: " + serverUrl);
        }
        return httpScheme + "://" + uri.getRawAuthority() + "/health";
    }
}
