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

import lombok.Getter;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A connected client.
 */
public class RelayConnection {

    @Getter
    private final String id;
    @Getter
    private final Transport transport;
    @Getter
    private final long connectedAt;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final Set<String> sessionIds = ConcurrentHashMap.newKeySet();
    private volatile ScheduledFuture<?> authTimeout;

    public RelayConnection(String id, Transport transport, long connectedAt) {
        this.id = id;
        this.transport = transport;
        this.connectedAt = connectedAt;
    }

    public String getRemoteIp() {
        return transport.getRemoteIp();
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isAuthenticated() {
        return state.get() == ConnectionState.AUTHENTICATED;
    }

    public boolean isOpen() {
        return state.get() != ConnectionState.CLOSED && transport.isOpen();
    }

    /**
     * Move to {@code next} unless the connection is already closed.
     */
    boolean transition(ConnectionState next) {
        ConnectionState current;
        do {
            current = state.get();
            if (current == ConnectionState.CLOSED) {
                return false;
            }
        } while (!state.compareAndSet(current, next));
        return true;
    }

    /**
     * Complete a pending authentication.
     *
     * @return false unless the connection was still waiting for credentials
     */
    boolean authenticate() {
        return state.compareAndSet(ConnectionState.AUTHENTICATING, ConnectionState.AUTHENTICATED);
    }

    /**
     * Close a connection whose credentials never arrived.
     *
     * @return false if it authenticated or closed in the meantime
     */
    boolean expire() {
        return state.compareAndSet(ConnectionState.AUTHENTICATING, ConnectionState.CLOSED);
    }

    /**
     * @return false if the connection was closed already
     */
    boolean markClosed() {
        return state.getAndSet(ConnectionState.CLOSED) != ConnectionState.CLOSED;
    }

    void setAuthTimeout(ScheduledFuture<?> authTimeout) {
        this.authTimeout = authTimeout;
    }

    void cancelAuthTimeout() {
        ScheduledFuture<?> f = authTimeout;
        if (f != null) {
            f.cancel(false);
            authTimeout = null;
        }
    }

    Set<String> getSessionIds() {
        return sessionIds;
    }

    @Override
    public String toString() {
        return "RelayConnection [id=" + id + ", ip=" + getRemoteIp() + ", state=" + state.get() + "]";
    }
}
