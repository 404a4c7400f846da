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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import io.openlink.config.spec.RelaySpec;
import io.openlink.core.OperationResult;
import io.openlink.event.EventBus;
import io.openlink.event.RelayEvent;
import io.openlink.net.http.HttpFetcher;
import io.openlink.net.http.HttpResult;
import io.openlink.relay.auth.AccessController;
import io.openlink.relay.netty.RelayServer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Control surface of the relay host used by the application shell.
 */
@Slf4j
public class RelayHost {

    private static final Duration REGISTER_TIMEOUT = Duration.ofSeconds(10);

    private final RelaySpec spec;
    @Getter
    private final AccessController access;
    @Getter
    private final RelayEngine engine;
    @Getter
    private final ShareableLinks links;
    private final HttpFetcher http;
    private final ObjectMapper mapper;
    private final EventBus events;
    private final Clock clock;

    private RelayServer server;
    private InetSocketAddress boundAddress;

    public RelayHost(RelaySpec spec, AccessController access, RelayEngine engine, ShareableLinks links,
                     HttpFetcher http, ObjectMapper mapper, EventBus events, Clock clock) {
        this.spec = spec;
        this.access = access;
        this.engine = engine;
        this.links = links;
        this.http = http;
        this.mapper = mapper;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Start listening. Calling it while running returns the current address.
     */
    public synchronized InetSocketAddress start(int port, String bindHost) {
        if (server != null) {
            return boundAddress;
        }
        if (access.claimPublicWarning()) {
            log.warn("Relay is running in PUBLIC mode: anyone can connect and relay traffic through it. "
                    + "Set a PIN, a password or two-factor access to make it private.");
        }

        String host = StringUtils.defaultIfBlank(bindHost, spec.getRelayHost());
        RelayServer s = new RelayServer(spec, engine, mapper);
        boundAddress = s.start(host, port);
        server = s;
        engine.getStats().markStarted(clock.millis());
        events.publish(RelayEvent.Type.SERVER_STARTED, ImmutableMap.of(
                "host", host, "port", boundAddress.getPort()));
        return boundAddress;
    }

    public InetSocketAddress start() {
        return start(spec.getRelayPort(), spec.getRelayHost());
    }

    /**
     * Stop listening, close every connection and drop all sessions.
     */
    public synchronized void stop() {
        if (server == null) {
            return;
        }
        engine.shutdown();
        server.stop();
        server = null;
        boundAddress = null;
        events.publish(RelayEvent.Type.SERVER_STOPPED, ImmutableMap.of());
        log.info("Relay server stopped");
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    public void configure(RelayOptions options) {
        if (options.getHostName() != null) {
            access.setHostName(options.getHostName());
        }
        if (options.getMaxConnections() != null) {
            access.setMaxConnections(options.getMaxConnections());
        }
        if (options.getPublicServer() != null) {
            if (options.getPublicServer()) {
                access.setPublic();
            } else {
                access.setPrivate();
            }
        }
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", isRunning());
        status.put("sessions", engine.getSessionCount());
        status.put("connections", engine.getConnectionCount());
        status.put("isPublic", access.isPublic());
        status.put("accessMode", access.getAccessMode().getWireName());
        status.put("hostName", access.getHostName());
        status.put("stats", engine.getStats().toMap());
        return status;
    }

    public Map<String, Object> getConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("isPublic", access.isPublic());
        config.put("accessMode", access.getAccessMode().getWireName());
        config.put("hostName", access.getHostName());
        config.put("maxConnections", access.getMaxConnections());
        config.put("twoFactorEnabled", access.isTwoFactorEnabled());
        config.put("hasPin", access.hasPin());
        config.put("hasPassword", access.hasPassword());
        return config;
    }

    public ShareableLink generateShareableUrl(String sessionId, String preferredDomain) {
        return links.generate(sessionId, preferredDomain);
    }

    /**
     * Announce this host to the public directory. Only allowed while the host is public.
     */
    public OperationResult registerPublic(String url, String region) {
        if (!access.isPublic()) {
            return OperationResult.fail("Not configured as public");
        }
        if (StringUtils.isBlank(url)) {
            return OperationResult.fail("Public URL is required");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", StringUtils.defaultIfBlank(access.getHostName(), url));
        body.put("url", url);
        body.put("features", spec.getRelayFeatures());
        body.put("region", region);
        try {
            HttpResult result = http.postJson(spec.getRegisterUrl(), mapper.writeValueAsString(body), REGISTER_TIMEOUT);
            if (!result.isOk()) {
                return OperationResult.fail("Registry returned HTTP " + result.getStatus());
            }
            log.info("Registered {} with the public directory", url);
            return OperationResult.ok();
        } catch (IOException e) {
            log.warn("Failed to register as public host: {}", e.getMessage());
            return OperationResult.fail(e.getMessage());
        }
    }
}
