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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.openlink.event.EventBus;
import io.openlink.event.RelayEvent;
import io.openlink.relay.auth.AccessController;
import io.openlink.relay.message.RelayMediaMessage;
import io.openlink.store.MemoryKeyValueStore;
import org.apache.commons.codec.binary.Base64;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class RelayEngineTest {

    private static final long AUTH_TIMEOUT = 30_000L;

    private AccessController access;
    private ScheduledExecutorService scheduler;
    private RelayStats stats;
    private List<RelayEvent> events;
    private RelayEngine engine;

    @Before
    public void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        access = new AccessController(new MemoryKeyValueStore(), clock, new SecureRandom());
        scheduler = mock(ScheduledExecutorService.class);
        stats = new RelayStats();
        events = Collections.synchronizedList(new ArrayList<>());
        EventBus bus = new EventBus(clock);
        bus.subscribe(events::add);
        engine = new RelayEngine(access, new ObjectMapper(), new SessionIdGenerator(), scheduler, bus, stats,
                clock, AUTH_TIMEOUT);
    }

    private RelayConnection open(FakeTransport transport) {
        RelayConnection conn = engine.onOpen(transport);
        assertNotNull(conn);
        return conn;
    }

    private String createSession(RelayConnection host, FakeTransport hostTransport, String requestedId) {
        String msg = requestedId == null
                ? "{\"type\":\"create-session\"}"
                : "{\"type\":\"create-session\",\"sessionId\":\"" + requestedId + "\"}";
        engine.onText(host, msg);
        JsonNode reply = hostTransport.last();
        assertEquals("session-created", reply.path("type").asText());
        return reply.path("sessionId").asText();
    }

    private void join(RelayConnection conn, String sessionId) {
        engine.onText(conn, "{\"type\":\"join-session\",\"sessionId\":\"" + sessionId + "\"}");
    }

    private List<RelayEvent.Type> eventTypes() {
        List<RelayEvent.Type> types = new ArrayList<>();
        events.forEach(e -> types.add(e.getType()));
        return types;
    }

    @Test
    public void testPublicConnectionIsAuthenticatedImmediately() {
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);

        assertTrue(conn.isAuthenticated());
        assertTrue(conn.getId().startsWith("c_"));
        JsonNode reply = t.last();
        assertEquals("connected", reply.path("type").asText());
        assertEquals(conn.getId(), reply.path("clientId").asText());
        assertEquals(1, engine.getConnectionCount());
        assertEquals(1, stats.getTotalConnections());
        assertTrue(eventTypes().contains(RelayEvent.Type.CLIENT_AUTHENTICATED));
        verifyNoInteractions(scheduler);
    }

    @Test
    public void testPinAuthentication() {
        access.setPinCode("1234");
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);

        JsonNode required = t.last();
        assertEquals("auth-required", required.path("type").asText());
        assertEquals("pin", required.path("accessMode").asText());
        assertEquals(conn.getId(), required.path("clientId").asText());
        assertEquals(ConnectionState.AUTHENTICATING, conn.getState());

        engine.onText(conn, "{\"type\":\"create-session\"}");
        assertEquals("error", t.last().path("type").asText());
        assertEquals(RelayEngine.NOT_AUTHENTICATED, t.last().path("error").asText());
        assertEquals(0, engine.getSessionCount());

        engine.onText(conn, "{\"type\":\"authenticate\",\"auth\":{\"pin\":\"4321\"}}");
        assertEquals("auth-failed", t.last().path("type").asText());
        assertEquals("Invalid PIN", t.last().path("error").asText());
        assertTrue("a failed attempt keeps the connection", conn.isOpen());

        engine.onText(conn, "{\"type\":\"authenticate\",\"auth\":{\"pin\":\"1234\"}}");
        assertEquals("auth-success", t.last().path("type").asText());
        assertTrue(conn.isAuthenticated());

        createSession(conn, t, null);
        assertEquals(1, engine.getSessionCount());
    }

    @Test
    public void testAuthTimeoutClosesConnection() {
        access.setPinCode("1234");
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);

        ArgumentCaptor<Runnable> timeout = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timeout.capture(), eq(AUTH_TIMEOUT), eq(TimeUnit.MILLISECONDS));
        timeout.getValue().run();

        assertEquals("auth-timeout", t.last().path("type").asText());
        assertEquals("Authentication timeout", t.last().path("error").asText());
        assertFalse(t.isOpen());
        assertEquals(ConnectionState.CLOSED, conn.getState());
        assertEquals(0, engine.getConnectionCount());
        assertTrue(eventTypes().contains(RelayEvent.Type.CLIENT_DISCONNECTED));
    }

    @Test
    public void testAuthTimeoutAfterAuthenticationIsIgnored() {
        access.setPinCode("1234");
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);
        engine.onText(conn, "{\"type\":\"authenticate\",\"auth\":{\"pin\":\"1234\"}}");

        ArgumentCaptor<Runnable> timeout = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timeout.capture(), eq(AUTH_TIMEOUT), eq(TimeUnit.MILLISECONDS));
        timeout.getValue().run();

        assertEquals("auth-success", t.last().path("type").asText());
        assertTrue(t.isOpen());
        assertEquals(1, engine.getConnectionCount());
    }

    @Test
    public void testAuthenticateDuringTimeoutIsRejected() {
        access.setPinCode("4321");
        RelayConnection[] holder = new RelayConnection[1];
        FakeTransport t = new FakeTransport("10.0.0.1") {
            @Override
            public synchronized void sendText(String text) {
                super.sendText(text);
                if (text.contains("auth-timeout")) {
                    engine.onText(holder[0], "{\"type\":\"authenticate\",\"auth\":{\"pin\":\"4321\"}}");
                }
            }
        };
        holder[0] = open(t);

        ArgumentCaptor<Runnable> timeout = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timeout.capture(), eq(AUTH_TIMEOUT), eq(TimeUnit.MILLISECONDS));
        timeout.getValue().run();

        assertEquals(List.of("auth-required", "auth-timeout"), t.types());
        assertFalse(t.isOpen());
        assertEquals(ConnectionState.CLOSED, holder[0].getState());
        assertFalse(eventTypes().contains(RelayEvent.Type.CLIENT_AUTHENTICATED));
        assertEquals(0, engine.getConnectionCount());
    }

    @Test
    public void testRepeatedAuthenticateKeepsConnection() {
        access.setPinCode("1234");
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);

        engine.onText(conn, "{\"type\":\"authenticate\",\"auth\":{\"pin\":\"1234\"}}");
        engine.onText(conn, "{\"type\":\"authenticate\",\"auth\":{\"pin\":\"1234\"}}");

        assertEquals(List.of("auth-required", "auth-success", "auth-success"), t.types());
        assertTrue(conn.isAuthenticated());
        assertEquals(1, eventTypes().stream().filter(e -> e == RelayEvent.Type.CLIENT_AUTHENTICATED).count());
    }

    @Test
    public void testConnectionPinInPublicMode() {
        access.setConnectionPin("8080", false, 0);
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);

        assertEquals("auth-required", t.last().path("type").asText());
        assertEquals("public", t.last().path("accessMode").asText());

        engine.onText(conn, "{\"type\":\"authenticate\",\"auth\":{\"connectionPin\":\"8080\"}}");
        assertEquals("auth-success", t.last().path("type").asText());
    }

    @Test
    public void testServerFull() {
        access.setMaxConnections(1);
        open(new FakeTransport("10.0.0.1"));

        FakeTransport refused = new FakeTransport("10.0.0.2");
        assertNull(engine.onOpen(refused));
        assertEquals("error", refused.last().path("type").asText());
        assertEquals(RelayEngine.SERVER_FULL, refused.last().path("error").asText());
        assertFalse(refused.isOpen());
        assertEquals(1, engine.getConnectionCount());
    }

    @Test
    public void testConnectionLimitUnderConcurrentAccepts() throws Exception {
        access.setMaxConnections(5);
        int clients = 20;
        CountDownLatch ready = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(clients);
        AtomicInteger accepted = new AtomicInteger();
        for (int i = 0; i < clients; i++) {
            FakeTransport t = new FakeTransport("10.0.1." + i);
            Thread thread = new Thread(() -> {
                try {
                    ready.await();
                    if (engine.onOpen(t) != null) {
                        accepted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            thread.start();
        }
        ready.countDown();

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(5, accepted.get());
        assertEquals(5, engine.getConnectionCount());
    }

    @Test
    public void testSessionLifecycle() {
        FakeTransport hostT = new FakeTransport("10.0.0.1");
        FakeTransport guestT = new FakeTransport("10.0.0.2");
        RelayConnection host = open(hostT);
        RelayConnection guest = open(guestT);

        String sessionId = createSession(host, hostT, null);
        assertTrue(sessionId.length() >= 20 && sessionId.length() <= 24);
        assertTrue(hostT.last().path("isHost").asBoolean());

        join(guest, sessionId);
        JsonNode joined = guestT.last();
        assertEquals("session-joined", joined.path("type").asText());
        assertEquals(sessionId, joined.path("sessionId").asText());
        assertEquals(host.getId(), joined.path("host").asText());
        assertEquals(2, joined.path("participants").size());
        assertEquals(host.getId(), joined.path("participants").get(0).asText());
        assertEquals(guest.getId(), joined.path("participants").get(1).asText());

        JsonNode peerJoined = hostT.last();
        assertEquals("peer-joined", peerJoined.path("type").asText());
        assertEquals(guest.getId(), peerJoined.path("peerId").asText());

        engine.onText(guest, "{\"type\":\"leave-session\",\"sessionId\":\"" + sessionId + "\"}");
        assertEquals("peer-left", hostT.last().path("type").asText());
        assertEquals(guest.getId(), hostT.last().path("peerId").asText());
        assertEquals(1, engine.getSessionCount());

        engine.onText(host, "{\"type\":\"leave-session\",\"sessionId\":\"" + sessionId + "\"}");
        assertEquals("empty sessions are removed", 0, engine.getSessionCount());
        assertTrue(eventTypes().contains(RelayEvent.Type.SESSION_CLOSED));
        assertEquals(1, stats.getTotalSessions());
    }

    @Test
    public void testRejoinDoesNotNotifyPeersAgain() {
        FakeTransport hostT = new FakeTransport("10.0.0.1");
        FakeTransport guestT = new FakeTransport("10.0.0.2");
        RelayConnection host = open(hostT);
        RelayConnection guest = open(guestT);
        String sessionId = createSession(host, hostT, "room-1");

        join(guest, sessionId);
        hostT.clear();
        join(guest, sessionId);

        assertEquals("session-joined", guestT.last().path("type").asText());
        assertTrue(hostT.messages().isEmpty());
    }

    @Test
    public void testJoinUnknownSession() {
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);

        join(conn, "missing");

        assertEquals("error", t.last().path("type").asText());
        assertEquals(RelayEngine.SESSION_NOT_FOUND, t.last().path("error").asText());
        assertEquals("missing", t.last().path("sessionId").asText());
        assertEquals(0, engine.getSessionCount());
    }

    @Test
    public void testRequestedSessionIdMustBeFree() {
        FakeTransport aT = new FakeTransport("10.0.0.1");
        FakeTransport bT = new FakeTransport("10.0.0.2");
        RelayConnection a = open(aT);
        RelayConnection b = open(bT);

        assertEquals("room-1", createSession(a, aT, "room-1"));
        engine.onText(b, "{\"type\":\"create-session\",\"sessionId\":\"room-1\"}");

        assertEquals(RelayEngine.SESSION_EXISTS, bT.last().path("error").asText());
        assertEquals("room-1", bT.last().path("sessionId").asText());
        assertEquals(1, engine.getSessionCount());
    }

    @Test
    public void testSignalRouting() {
        FakeTransport hostT = new FakeTransport("10.0.0.1");
        FakeTransport aT = new FakeTransport("10.0.0.2");
        FakeTransport bT = new FakeTransport("10.0.0.3");
        RelayConnection host = open(hostT);
        RelayConnection a = open(aT);
        RelayConnection b = open(bT);
        String sessionId = createSession(host, hostT, "room-1");
        join(a, sessionId);
        join(b, sessionId);
        hostT.clear();
        aT.clear();
        bT.clear();

        engine.onText(a, "{\"type\":\"signal\",\"sessionId\":\"room-1\",\"targetId\":\"" + host.getId()
                + "\",\"sdp\":\"offer\"}");
        JsonNode signal = hostT.last();
        assertEquals("signal", signal.path("type").asText());
        assertEquals(a.getId(), signal.path("senderId").asText());
        assertEquals("offer", signal.path("sdp").asText());
        assertTrue("only the target receives it", bT.messages().isEmpty());

        hostT.clear();
        engine.onText(host, "{\"type\":\"signal\",\"sessionId\":\"room-1\",\"candidate\":\"c1\"}");
        assertEquals("c1", aT.last().path("candidate").asText());
        assertEquals("c1", bT.last().path("candidate").asText());
        assertTrue("not echoed to the sender", hostT.messages().isEmpty());
    }

    @Test
    public void testSignalFromOutsiderIsDropped() {
        FakeTransport hostT = new FakeTransport("10.0.0.1");
        FakeTransport outsiderT = new FakeTransport("10.0.0.2");
        RelayConnection host = open(hostT);
        RelayConnection outsider = open(outsiderT);
        createSession(host, hostT, "room-1");
        hostT.clear();

        engine.onText(outsider, "{\"type\":\"signal\",\"sessionId\":\"room-1\",\"targetId\":\"" + host.getId() + "\"}");
        engine.onText(outsider, "{\"type\":\"broadcast\",\"sessionId\":\"room-1\",\"payload\":1}");

        assertTrue(hostT.messages().isEmpty());
    }

    @Test
    public void testRelayData() {
        FakeTransport aT = new FakeTransport("10.0.0.1");
        FakeTransport bT = new FakeTransport("10.0.0.2");
        RelayConnection a = open(aT);
        RelayConnection b = open(bT);

        engine.onText(a, "{\"type\":\"relay-data\",\"targetId\":\"" + b.getId() + "\",\"payload\":{\"chat\":\"hi\"}}");

        JsonNode data = bT.last();
        assertEquals("relay-data", data.path("type").asText());
        assertEquals(a.getId(), data.path("senderId").asText());
        assertEquals("hi", data.path("payload").path("chat").asText());
        assertTrue(stats.getBytesRelayed() > 0);
    }

    @Test
    public void testRelayMedia() {
        FakeTransport aT = new FakeTransport("10.0.0.1");
        FakeTransport bT = new FakeTransport("10.0.0.2");
        RelayConnection a = open(aT);
        RelayConnection b = open(bT);
        byte[] media = "frame-bytes".getBytes(StandardCharsets.UTF_8);

        engine.onText(a, "{\"type\":\"relay-media\",\"targetId\":\"" + b.getId() + "\",\"payload\":\""
                + Base64.encodeBase64String(media) + "\"}");
        engine.onBinary(a, RelayMediaMessage.encodeFrame(b.getId(), media));

        List<byte[]> received = bT.binaries();
        assertEquals(2, received.size());
        assertArrayEquals(media, received.get(0));
        assertArrayEquals(media, received.get(1));
        assertEquals(2L * media.length, stats.getBytesRelayed());
    }

    @Test
    public void testMediaToClosedTargetIsDropped() {
        FakeTransport aT = new FakeTransport("10.0.0.1");
        FakeTransport bT = new FakeTransport("10.0.0.2");
        RelayConnection a = open(aT);
        RelayConnection b = open(bT);
        bT.close();

        engine.onBinary(a, RelayMediaMessage.encodeFrame(b.getId(), new byte[]{1, 2, 3}));
        engine.onBinary(a, new byte[]{9});

        assertTrue(bT.binaries().isEmpty());
        assertEquals(0, stats.getBytesRelayed());
    }

    @Test
    public void testBinaryRequiresAuthentication() {
        access.setPinCode("1234");
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);

        engine.onBinary(conn, RelayMediaMessage.encodeFrame("c_x", new byte[]{1}));

        assertEquals(RelayEngine.NOT_AUTHENTICATED, t.last().path("error").asText());
    }

    @Test
    public void testBroadcast() {
        FakeTransport hostT = new FakeTransport("10.0.0.1");
        FakeTransport aT = new FakeTransport("10.0.0.2");
        RelayConnection host = open(hostT);
        RelayConnection a = open(aT);
        createSession(host, hostT, "room-1");
        join(a, "room-1");
        hostT.clear();

        engine.onText(host, "{\"type\":\"broadcast\",\"sessionId\":\"room-1\",\"payload\":{\"n\":1}}");

        assertEquals("broadcast", aT.last().path("type").asText());
        assertEquals(host.getId(), aT.last().path("senderId").asText());
        assertEquals(1, aT.last().path("payload").path("n").asInt());
        assertTrue(hostT.messages().isEmpty());
    }

    @Test
    public void testMalformedAndUnknownMessagesAreIgnored() {
        FakeTransport t = new FakeTransport("10.0.0.1");
        RelayConnection conn = open(t);
        t.clear();

        engine.onText(conn, "{not json");
        engine.onText(conn, "[1,2,3]");
        engine.onText(conn, "{\"type\":\"dance\"}");
        engine.onText(conn, "{\"type\":\"join-session\"}");

        assertTrue(t.messages().isEmpty());
        assertTrue(conn.isOpen());
    }

    @Test
    public void testDisconnectLeavesSessions() {
        FakeTransport hostT = new FakeTransport("10.0.0.1");
        FakeTransport guestT = new FakeTransport("10.0.0.2");
        RelayConnection host = open(hostT);
        RelayConnection guest = open(guestT);
        createSession(host, hostT, "room-1");
        join(guest, "room-1");

        engine.onClose(host);
        engine.onClose(host);

        assertEquals("peer-left", guestT.last().path("type").asText());
        assertEquals(host.getId(), guestT.last().path("peerId").asText());
        assertEquals(1, engine.getConnectionCount());
        assertEquals("the guest keeps the session alive", 1, engine.getSessionCount());

        engine.onClose(guest);
        assertEquals(0, engine.getConnectionCount());
        assertEquals(0, engine.getSessionCount());

        long disconnects = events.stream().filter(e -> e.getType() == RelayEvent.Type.CLIENT_DISCONNECTED).count();
        assertEquals(2, disconnects);
    }

    @Test
    public void testShutdownClosesEverything() {
        FakeTransport hostT = new FakeTransport("10.0.0.1");
        RelayConnection host = open(hostT);
        createSession(host, hostT, "room-1");

        engine.shutdown();

        assertFalse(hostT.isOpen());
        assertEquals(0, engine.getConnectionCount());
        assertEquals(0, engine.getSessionCount());
    }
}
