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
public class ConnectionManager {

    protected final ConcurrentHashMap<String, RelayConnection> connections = new ConcurrentHashMap<>();

    public void add(RelayConnection conn) {
        log.debug("Connection added: id = {}, ip = {}", conn.getId(), conn.getRemoteIp());
        connections.put(conn.getId(), conn);
    }

    /**
     * Add {@code conn} unless {@code limit} connections are registered already.
     */
    public synchronized boolean addIfBelow(RelayConnection conn, int limit) {
        if (connections.size() >= limit) {
            return false;
        }
        add(conn);
        return true;
    }

    public void remove(RelayConnection conn) {
        log.debug("Connection removed: id = {}, ip = {}", conn.getId(), conn.getRemoteIp());
        connections.remove(conn.getId(), conn);
    }

    public RelayConnection get(String id) {
        return id == null ? null : connections.get(id);
    }

    public int size() {
        return connections.size();
    }

    public List<RelayConnection> getConnections() {
        return new ArrayList<>(connections.values());
    }

    /**
     * Close all open connections.
     */
    public void closeAll() {
        for (RelayConnection conn : connections.values()) {
            try {
                conn.getTransport().close();
            } catch (Exception e) {
                log.warn("Failed to close connection: {}", conn.getId(), e);
            }
        }
        connections.clear();
    }
}
