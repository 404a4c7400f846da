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

import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * A relay session: the host that created it and the ordered list of participants.
 * <p>
 * Participants are only changed under this object's monitor. Once the last participant leaves
 * the session is closed and rejects further joins.
 */
public class RelaySession {

    public enum JoinOutcome {
        JOINED,
        ALREADY_PRESENT,
        CLOSED
    }

    @Getter
    private final String id;
    @Getter
    private final String hostId;
    @Getter
    private final long createdAt;

    private final List<String> participants = new ArrayList<>();
    private boolean closed;

    public RelaySession(String id, String hostId, long createdAt) {
        this.id = id;
        this.hostId = hostId;
        this.createdAt = createdAt;
        this.participants.add(hostId);
    }

    public synchronized JoinOutcome join(String clientId) {
        if (closed) {
            return JoinOutcome.CLOSED;
        }
        if (participants.contains(clientId)) {
            return JoinOutcome.ALREADY_PRESENT;
        }
        participants.add(clientId);
        return JoinOutcome.JOINED;
    }

    /**
     * @return true if {@code clientId} was a participant
     */
    public synchronized boolean leave(String clientId) {
        boolean removed = participants.remove(clientId);
        if (participants.isEmpty()) {
            closed = true;
        }
        return removed;
    }

    public synchronized boolean contains(String clientId) {
        return participants.contains(clientId);
    }

    public synchronized List<String> getParticipants() {
        return ImmutableList.copyOf(participants);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "RelaySession [id=" + id + ", host=" + hostId + ", participants=" + getParticipants() + "]";
    }
}
