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
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.openlink.config.Config;
import io.openlink.relay.RelayEngine;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class RelayHttpHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private EmbeddedChannel channel;

    @Before
    public void setUp() {
        RelayEngine engine = mock(RelayEngine.class);
        when(engine.getSessionCount()).thenReturn(2);
        when(engine.getConnectionCount()).thenReturn(5);
        channel = new EmbeddedChannel(new RelayHttpHandler(Config.defaults(), engine, mapper));
    }

    @After
    public void tearDown() {
        channel.finishAndReleaseAll();
    }

    private FullHttpResponse get(String uri) {
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri));
        return channel.readOutbound();
    }

    private JsonNode body(FullHttpResponse response) throws Exception {
        try {
            return mapper.readTree(response.content().toString(StandardCharsets.UTF_8));
        } finally {
            response.release();
        }
    }

    @Test
    public void testHealth() throws Exception {
        FullHttpResponse response = get("/health");

        assertEquals(HttpResponseStatus.OK, response.status());
        assertEquals("application/json", response.headers().get(HttpHeaderNames.CONTENT_TYPE));
        assertEquals("*", response.headers().get(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN));
        JsonNode json = body(response);
        assertEquals("healthy", json.path("status").asText());
        assertEquals(2, json.path("sessions").asInt());
        assertEquals(5, json.path("connections").asInt());
        assertTrue(json.path("uptime").isNumber());
        assertTrue("keep-alive requests stay open", channel.isOpen());
    }

    @Test
    public void testStatus() throws Exception {
        JsonNode json = body(get("/api/status?verbose=1"));

        assertEquals("openlink-relay", json.path("type").asText());
        assertEquals("1.0.0", json.path("version").asText());
        assertEquals("signaling", json.path("features").get(0).asText());
        assertEquals(2, json.path("sessions").asInt());
    }

    @Test
    public void testUnknownPath() {
        FullHttpResponse response = get("/admin");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("Not found", response.content().toString(StandardCharsets.UTF_8));
        response.release();
    }

    @Test
    public void testPostIsNotServed() {
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/health"));
        FullHttpResponse response = channel.readOutbound();

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        response.release();
    }

    @Test
    public void testUpgradeIsPassedOn() {
        FullHttpRequest upgrade = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/");
        upgrade.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.UPGRADE);
        upgrade.headers().set(HttpHeaderNames.UPGRADE, "WebSocket");

        channel.writeInbound(upgrade);

        assertNull("no HTTP response", channel.readOutbound());
        FullHttpRequest passed = channel.readInbound();
        assertSame(upgrade, passed);
        assertEquals(1, passed.refCnt());
        passed.release();
    }

    @Test
    public void testConnectionCloseIsHonoured() {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/health");
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);

        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        response.release();

        assertFalse(channel.isOpen());
    }
}
