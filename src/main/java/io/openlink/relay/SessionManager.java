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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class SessionManager {

    private final ConcurrentHashMap<String, RelaySession> sessions = new ConcurrentHashMap<>();

    /**
     * Register a new session.
     *
     * @return the session, or null if {@code id} is taken
     */
    public RelaySession create(String id, String hostId, long createdAt) {
        RelaySession session = new RelaySession(id, hostId, createdAt);
        if (sessions.putIfAbsent(id, session) != null) {
            return null;
        }
        log.debug("Session created: id = {}, host = {}", id, hostId);
        return session;
    }

    public RelaySession get(String id) {
        return id == null ? null : sessions.get(id);
    }

    public boolean contains(String id) {
        return sessions.containsKey(id);
    }

    /**
     * Drop {@code session} if it is closed and still registered.
     */
    public boolean removeIfClosed(RelaySession session) {
        if (session.isClosed() && sessions.remove(session.getId(), session)) {
            log.debug("Session removed: id = {}", session.getId());
            return true;
        }
        return false;
    }

    public int size() {
        return sessions.size();
    }

    public List<RelaySession> getSessions() {
        return new ArrayList<>(sessions.values());
    }

    public void clear() {
        sessions.clear();
    }
}
