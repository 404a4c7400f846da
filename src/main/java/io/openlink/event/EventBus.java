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
package io.openlink.event;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Outbound event channel the application shell subscribes to.
 * <p>
 * Delivery is synchronous on the publishing thread; a failing listener is logged and skipped.
 */
@Slf4j
public class EventBus {

    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public EventBus(Clock clock) {
        this.clock = clock;
    }

    public EventBus() {
        this(Clock.systemUTC());
    }

    /**
     * Subscribe to the given event types, or to all of them when none is given.
     */
    public Subscription subscribe(RelayEventListener listener, RelayEvent.Type... types) {
        Set<RelayEvent.Type> filter = types.length == 0
                ? EnumSet.allOf(RelayEvent.Type.class)
                : EnumSet.of(types[0], types);
        Subscription subscription = new Subscription(listener, filter);
        subscriptions.add(subscription);
        return subscription;
    }

    public void publish(RelayEvent.Type type, Map<String, Object> payload) {
        RelayEvent event = new RelayEvent(type, payload, clock.millis());
        for (Subscription s : subscriptions) {
            if (!s.types.contains(type)) {
                continue;
            }
            try {
                s.listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Event listener failed on {}", event, e);
            }
        }
    }

    public int size() {
        return subscriptions.size();
    }

    public class Subscription implements AutoCloseable {

        private final RelayEventListener listener;
        private final Set<RelayEvent.Type> types;

        private Subscription(RelayEventListener listener, Set<RelayEvent.Type> types) {
            this.listener = listener;
            this.types = types;
        }

        public void unsubscribe() {
            subscriptions.remove(this);
        }

        @Override
        public void close() {
            unsubscribe();
        }
    }
}
