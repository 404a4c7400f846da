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
package io.openlink.relay.netty;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openlink.config.Config;
import io.openlink.event.EventBus;
import io.openlink.net.directory.HealthChecker;
import io.openlink.net.directory.HealthStatus;
import io.openlink.net.http.DefaultHttpFetcher;
import io.openlink.relay.RelayEngine;
import io.openlink.relay.RelayStats;
import io.openlink.relay.SessionIdGenerator;
import io.openlink.relay.auth.AccessController;
import io.openlink.store.MemoryKeyValueStore;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

/**
 * Runs the relay on a loopback port and talks to it over HTTP and WebSocket.
 */
public class RelayServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ScheduledExecutorService exec;
    private RelayEngine engine;
    private RelayServer server;
    private int port;

    @Before
    public void setUp() {
        exec = new ScheduledThreadPoolExecutor(1, new BasicThreadFactory.Builder()
                .namingPattern("RelayServerTest-thread-%d")
                .daemon(true)
                .build());
        AccessController access = new AccessController(new MemoryKeyValueStore());
        engine = new RelayEngine(access, mapper, new SessionIdGenerator(), exec, new EventBus(), new RelayStats(),
                Clock.systemUTC(), 30_000L);
        server = new RelayServer(Config.defaults(), engine, mapper);
        InetSocketAddress bound = server.start("127.0.0.1", 0);
        port = bound.getPort();
    }

    @After
    public void tearDown() {
        engine.shutdown();
        server.stop();
        exec.shutdownNow();
    }

    @Test
    public void testHealthProbe() {
        assertTrue(server.isRunning());
        HealthChecker checker = new HealthChecker(DefaultHttpFetcher.strict(), Duration.ofSeconds(5), Clock.systemUTC());

        assertEquals(HealthStatus.ONLINE, checker.check("ws://127.0.0.1:" + port).getStatus());
    }

    @Test
    public void testWebSocketSession() throws Exception {
        Client host = new Client();
        Client guest = new Client();
        try {
            JsonNode hello = host.next();
            assertEquals("connected", hello.path("type").asText());
            assertEquals("connected", guest.next().path("type").asText());

            host.send("{\"type\":\"create-session\",\"sessionId\":\"room-1\"}");
            assertEquals("session-created", host.next().path("type").asText());

            guest.send("{\"type\":\"join-session\",\"sessionId\":\"room-1\"}");
            JsonNode joined = guest.next();
            assertEquals("session-joined", joined.path("type").asText());
            assertEquals(hello.path("clientId").asText(), joined.path("host").asText());
            assertEquals("peer-joined", host.next().path("type").asText());

            guest.send("{\"type\":\"signal\",\"sessionId\":\"room-1\",\"sdp\":\"offer\"}");
            JsonNode signal = host.next();
            assertEquals("offer", signal.path("sdp").asText());
            assertNotNull(signal.get("senderId"));
        } finally {
            host.close();
            guest.close();
        }
    }

    @Test
    public void testStop() {
        server.stop();
        assertFalse(server.isRunning());
    }

    private class Client implements WebSocket.Listener {

        private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();
        private final WebSocket socket;

        Client() throws Exception {
            socket = HttpClient.newHttpClient().newWebSocketBuilder()
                    .buildAsync(URI.create("ws://127.0.0.1:" + port + "/"), this)
                    .get(5, TimeUnit.SECONDS);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                received.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        void send(String text) throws Exception {
            socket.sendText(text, true).get(5, TimeUnit.SECONDS);
        }

        JsonNode next() throws Exception {
            String text = received.poll(5, TimeUnit.SECONDS);
            assertNotNull("no message within 5s", text);
            return mapper.readTree(text);
        }

        void close() {
            socket.abort();
        }
    }
}
