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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import io.openlink.event.EventBus;
import io.openlink.event.RelayEvent;
import io.openlink.relay.auth.AccessController;
import io.openlink.relay.auth.AuthResult;
import io.openlink.relay.message.AuthenticateMessage;
import io.openlink.relay.message.BroadcastMessage;
import io.openlink.relay.message.CreateSessionMessage;
import io.openlink.relay.message.JoinSessionMessage;
import io.openlink.relay.message.LeaveSessionMessage;
import io.openlink.relay.message.MessageException;
import io.openlink.relay.message.MessageFactory;
import io.openlink.relay.message.RelayDataMessage;
import io.openlink.relay.message.RelayMediaMessage;
import io.openlink.relay.message.RelayMessage;
import io.openlink.relay.message.Replies;
import io.openlink.relay.message.SignalMessage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Transport independent relay logic: authentication, sessions and message forwarding.
 * <p>
 * All entry points may be called concurrently from different connection threads.
 */
@Slf4j
public class RelayEngine {

    public static final String NOT_AUTHENTICATED = "Not authenticated";
    public static final String SESSION_NOT_FOUND = "Session not found";
    public static final String SESSION_EXISTS = "Session already exists";
    public static final String SERVER_FULL = "Server full";

    private static final int MAX_ID_ATTEMPTS = 8;

    private final AccessController access;
    @Getter
    private final ConnectionManager connections;
    @Getter
    private final SessionManager sessions;
    private final MessageFactory factory;
    private final ObjectMapper mapper;
    private final SessionIdGenerator ids;
    private final ScheduledExecutorService scheduler;
    private final EventBus events;
    @Getter
    private final RelayStats stats;
    private final Clock clock;
    private final long authTimeoutMillis;

    public RelayEngine(AccessController access, ObjectMapper mapper, SessionIdGenerator ids,
                       ScheduledExecutorService scheduler, EventBus events, RelayStats stats,
                       Clock clock, long authTimeoutMillis) {
        this.access = access;
        this.connections = new ConnectionManager();
        this.sessions = new SessionManager();
        this.factory = new MessageFactory(mapper);
        this.mapper = mapper;
        this.ids = ids;
        this.scheduler = scheduler;
        this.events = events;
        this.stats = stats;
        this.clock = clock;
        this.authTimeoutMillis = authTimeoutMillis;
    }

    // ------------------------------------------------------------- lifecycle

    /**
     * Register a new client.
     *
     * @return the connection, or null if the client was refused
     */
    public RelayConnection onOpen(Transport transport) {
        RelayConnection conn = new RelayConnection(ids.nextClientId(), transport, clock.millis());
        int limit = access.getMaxConnections();
        if (!connections.addIfBelow(conn, limit)) {
            log.warn("Refusing connection from {}, limit of {} reached", transport.getRemoteIp(), limit);
            sendTo(transport, Replies.error(SERVER_FULL));
            transport.close();
            return null;
        }
        stats.onConnection();
        events.publish(RelayEvent.Type.CLIENT_CONNECTED, ImmutableMap.of(
                "clientId", conn.getId(), "ip", String.valueOf(conn.getRemoteIp())));

        if (!access.requiresAuthentication(conn.getRemoteIp())) {
            conn.transition(ConnectionState.AUTHENTICATED);
            events.publish(RelayEvent.Type.CLIENT_AUTHENTICATED, ImmutableMap.of("clientId", conn.getId()));
            sendTo(transport, Replies.connected(conn.getId()));
            return conn;
        }

        conn.transition(ConnectionState.AUTHENTICATING);
        try {
            conn.setAuthTimeout(scheduler.schedule(() -> onAuthTimeout(conn), authTimeoutMillis,
                    TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.warn("Cannot arm authentication timeout for {}", conn.getId(), e);
        }
        sendTo(transport, Replies.authRequired(conn.getId(), access.getAccessMode().getWireName(),
                access.getHostName()));
        return conn;
    }

    void onAuthTimeout(RelayConnection conn) {
        try {
            if (!conn.expire()) {
                return;
            }
            log.info("Authentication timeout for {} ({})", conn.getId(), conn.getRemoteIp());
            sendTo(conn.getTransport(), Replies.authTimeout());
            conn.getTransport().close();
            release(conn);
        } catch (Exception e) {
            log.error("Failed to expire connection {}", conn.getId(), e);
        }
    }

    /**
     * Forget a client: cancel its timeout and leave every session it joined. Idempotent.
     */
    public void onClose(RelayConnection conn) {
        if (conn == null || !conn.markClosed()) {
            return;
        }
        release(conn);
    }

    private void release(RelayConnection conn) {
        conn.cancelAuthTimeout();
        for (String sessionId : new ArrayList<>(conn.getSessionIds())) {
            leave(conn, sessionId);
        }
        connections.remove(conn);
        events.publish(RelayEvent.Type.CLIENT_DISCONNECTED, ImmutableMap.of("clientId", conn.getId()));
    }

    /**
     * Close every connection and drop all sessions.
     */
    public void shutdown() {
        for (RelayConnection conn : connections.getConnections()) {
            conn.cancelAuthTimeout();
            conn.markClosed();
        }
        connections.closeAll();
        sessions.clear();
    }

    // -------------------------------------------------------------- inbound

    public void onText(RelayConnection conn, String text) {
        if (conn == null || !conn.isOpen()) {
            return;
        }

        RelayMessage msg;
        try {
            msg = factory.create(text);
        } catch (MessageException e) {
            log.debug("Ignoring malformed message from {}: {}", conn.getId(), e.getMessage());
            return;
        }

        if (msg instanceof AuthenticateMessage) {
            onAuthenticate(conn, (AuthenticateMessage) msg);
            return;
        }
        if (!conn.isAuthenticated()) {
            send(conn, Replies.error(NOT_AUTHENTICATED));
            return;
        }
        if (msg == null) {
            log.debug("Unknown message type from {}: {}", conn.getId(), abbreviate(text));
            return;
        }

        switch (msg.getType()) {
            case CREATE_SESSION -> onCreateSession(conn, (CreateSessionMessage) msg);
            case JOIN_SESSION -> onJoinSession(conn, (JoinSessionMessage) msg);
            case LEAVE_SESSION -> leave(conn, ((LeaveSessionMessage) msg).getSessionId());
            case SIGNAL -> onSignal(conn, (SignalMessage) msg);
            case RELAY_DATA -> onRelayData(conn, (RelayDataMessage) msg);
            case RELAY_MEDIA -> onRelayMedia(conn, (RelayMediaMessage) msg);
            case BROADCAST -> onBroadcast(conn, (BroadcastMessage) msg);
            default -> log.debug("Unhandled message {} from {}", msg, conn.getId());
        }
    }

    public void onBinary(RelayConnection conn, byte[] frame) {
        if (conn == null || !conn.isOpen()) {
            return;
        }
        if (!conn.isAuthenticated()) {
            send(conn, Replies.error(NOT_AUTHENTICATED));
            return;
        }
        try {
            onRelayMedia(conn, factory.create(frame));
        } catch (MessageException e) {
            log.debug("Ignoring malformed media frame from {}: {}", conn.getId(), e.getMessage());
        }
    }

    protected void onAuthenticate(RelayConnection conn, AuthenticateMessage msg) {
        AuthResult result = access.verify(msg.getAuth(), conn.getRemoteIp());
        if (!result.isSuccess()) {
            log.info("Authentication failed for {} ({}): {}", conn.getId(), conn.getRemoteIp(), result.getError());
            send(conn, Replies.authFailed(result.getError()));
            return;
        }
        if (conn.authenticate()) {
            conn.cancelAuthTimeout();
            events.publish(RelayEvent.Type.CLIENT_AUTHENTICATED, ImmutableMap.of("clientId", conn.getId()));
            send(conn, Replies.authSuccess(conn.getId()));
        } else if (conn.isAuthenticated()) {
            send(conn, Replies.authSuccess(conn.getId()));
        }
    }

    protected void onCreateSession(RelayConnection conn, CreateSessionMessage msg) {
        long now = clock.millis();
        RelaySession session;
        if (msg.getSessionId() != null) {
            session = sessions.create(msg.getSessionId(), conn.getId(), now);
            if (session == null) {
                send(conn, Replies.error(SESSION_EXISTS, msg.getSessionId()));
                return;
            }
        } else {
            session = null;
            for (int i = 0; i < MAX_ID_ATTEMPTS && session == null; i++) {
                session = sessions.create(ids.nextSessionId(), conn.getId(), now);
            }
            if (session == null) {
                log.error("Could not allocate a session id for {}", conn.getId());
                send(conn, Replies.error("Could not create session"));
                return;
            }
        }

        conn.getSessionIds().add(session.getId());
        stats.onSession();
        events.publish(RelayEvent.Type.SESSION_CREATED, ImmutableMap.of(
                "sessionId", session.getId(), "hostId", conn.getId()));
        send(conn, Replies.sessionCreated(session.getId()));
    }

    protected void onJoinSession(RelayConnection conn, JoinSessionMessage msg) {
        String sessionId = msg.getSessionId();
        RelaySession session = sessions.get(sessionId);
        RelaySession.JoinOutcome outcome = session == null
                ? RelaySession.JoinOutcome.CLOSED
                : session.join(conn.getId());
        if (outcome == RelaySession.JoinOutcome.CLOSED) {
            send(conn, Replies.error(SESSION_NOT_FOUND, sessionId));
            return;
        }

        conn.getSessionIds().add(sessionId);
        List<String> participants = session.getParticipants();
        send(conn, Replies.sessionJoined(sessionId, session.getHostId(), participants));

        if (outcome == RelaySession.JoinOutcome.JOINED) {
            ObjectNode joined = Replies.peerJoined(sessionId, conn.getId());
            for (String pid : participants) {
                if (!pid.equals(conn.getId())) {
                    send(pid, joined);
                }
            }
        }
    }

    protected void leave(RelayConnection conn, String sessionId) {
        conn.getSessionIds().remove(sessionId);
        RelaySession session = sessions.get(sessionId);
        if (session == null || !session.leave(conn.getId())) {
            return;
        }

        ObjectNode left = Replies.peerLeft(sessionId, conn.getId());
        for (String pid : session.getParticipants()) {
            send(pid, left);
        }
        if (sessions.removeIfClosed(session)) {
            events.publish(RelayEvent.Type.SESSION_CLOSED, ImmutableMap.of("sessionId", sessionId));
        }
    }

    protected void onSignal(RelayConnection conn, SignalMessage msg) {
        RelaySession session = sessions.get(msg.getSessionId());
        if (session == null || !session.contains(conn.getId())) {
            log.debug("Dropping signal from {} for session {}", conn.getId(), msg.getSessionId());
            return;
        }

        ObjectNode forward = msg.forwardFrom(conn.getId());
        String target = msg.getTargetId();
        if (target != null && session.contains(target)) {
            relay(target, forward);
            return;
        }
        for (String pid : session.getParticipants()) {
            if (!pid.equals(conn.getId())) {
                relay(pid, forward);
            }
        }
    }

    protected void onRelayData(RelayConnection conn, RelayDataMessage msg) {
        relay(msg.getTargetId(), Replies.relayData(conn.getId(), msg.getPayload()));
    }

    protected void onRelayMedia(RelayConnection conn, RelayMediaMessage msg) {
        RelayConnection target = connections.get(msg.getTargetId());
        if (target == null || !target.isOpen()) {
            return;
        }
        target.getTransport().sendBinary(msg.getPayload());
        stats.onRelayed(msg.getPayload().length);
    }

    protected void onBroadcast(RelayConnection conn, BroadcastMessage msg) {
        RelaySession session = sessions.get(msg.getSessionId());
        if (session == null || !session.contains(conn.getId())) {
            return;
        }
        ObjectNode broadcast = Replies.broadcast(conn.getId(), msg.getPayload());
        for (String pid : session.getParticipants()) {
            if (!pid.equals(conn.getId())) {
                relay(pid, broadcast);
            }
        }
    }

    // ------------------------------------------------------------- outbound

    private void relay(String clientId, ObjectNode message) {
        int bytes = send(clientId, message);
        if (bytes > 0) {
            stats.onRelayed(bytes);
        }
    }

    private int send(String clientId, ObjectNode message) {
        RelayConnection conn = connections.get(clientId);
        return conn == null ? 0 : send(conn, message);
    }

    private int send(RelayConnection conn, ObjectNode message) {
        if (!conn.isOpen()) {
            return 0;
        }
        return sendTo(conn.getTransport(), message);
    }

    private int sendTo(Transport transport, ObjectNode message) {
        try {
            String text = mapper.writeValueAsString(message);
            transport.sendText(text);
            return text.getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            log.error("Failed to encode {}", message.path("type").asText(), e);
            return 0;
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 128 ? text : text.substring(0, 128) + "...";
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public int getSessionCount() {
        return sessions.size();
    }
}
