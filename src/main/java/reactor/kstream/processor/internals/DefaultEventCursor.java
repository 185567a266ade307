/*
 * Copyright (c) 2023 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.kstream.processor.internals;

import reactor.core.Exceptions;
import reactor.kstream.Event;
import reactor.kstream.processor.AckMode;
import reactor.kstream.processor.EventCursor;
import reactor.kstream.processor.errors.StaleAcknowledgmentException;

import java.util.NoSuchElementException;

/**
 * Single event cursor. The current event is completed (acknowledged in auto-ack mode)
 * when the next event is requested or the cursor is closed, never when it is yielded.
 */
final class DefaultEventCursor<K, V> implements EventCursor<K, V>, ActiveCursor<K, V> {

    private final StreamSession<K, V> session;

    private final ChannelReader<K, V> reader;

    private final AckMode ackMode;

    private Delivery<K, V> current;

    private boolean rejected;

    private volatile boolean closed;

    private volatile boolean aborted;

    private volatile Thread owner;

    DefaultEventCursor(StreamSession<K, V> session, AckMode ackMode) {
        this.session = session;
        this.reader = session.reader();
        this.ackMode = ackMode;
        this.owner = Thread.currentThread();
    }

    @Override
    public boolean hasNext() {
        if (closed)
            return false;
        completeCurrent();
        try {
            return reader.hasNext();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw Exceptions.propagate(e);
        }
    }

    @Override
    public Event<K, V> next() {
        if (closed)
            throw new NoSuchElementException("Cursor is closed");
        owner = Thread.currentThread();
        completeCurrent();
        Delivery<K, V> delivery;
        try {
            delivery = reader.next();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw Exceptions.propagate(e);
        }
        if (delivery == null)
            throw new NoSuchElementException("Channel exhausted");
        current = delivery;
        rejected = false;
        return delivery.event();
    }

    private void completeCurrent() {
        if (current != null && ackMode == AckMode.AUTO_ACK && !rejected && !aborted)
            current.acknowledge();
    }

    @Override
    public Event<K, V> currentEvent() {
        Delivery<K, V> delivery = current;
        return delivery == null ? null : delivery.event();
    }

    @Override
    public void ack(Event<K, V> event) {
        Delivery<K, V> delivery = current;
        if (closed || delivery == null || !delivery.matches(event))
            throw new StaleAcknowledgmentException("Event " + event + " is not the current event " + delivery);
        delivery.acknowledge();
    }

    @Override
    public boolean isOwnedBy(Thread thread) {
        return owner == thread;
    }

    @Override
    public void reject() {
        rejected = true;
    }

    @Override
    public void close() {
        if (closed)
            return;
        try {
            completeCurrent();
        } finally {
            closed = true;
            session.release(this);
        }
    }

    @Override
    public void abort() {
        aborted = true;
        closed = true;
        session.release(this);
    }

    @Override
    public String toString() {
        return "EventCursor(" + session.streamId() + ", " + ackMode + ", current=" + current + ")";
    }
}
