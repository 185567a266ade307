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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.scheduler.Scheduler;
import reactor.kstream.Event;
import reactor.kstream.processor.AckMode;
import reactor.kstream.processor.BatchCursor;
import reactor.kstream.processor.errors.StaleAcknowledgmentException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Batch cursor backed by a background filler. The filler pulls deliveries from the
 * channel reader into the filling buffer while the application processes the previous
 * batch. The filling buffer is sealed and handed out when it holds <code>size</code>
 * deliveries or when the window started by its first delivery has elapsed. The filler
 * pauses while the filling buffer is full.
 * <p>
 * Acknowledgment of a batch is deferred until the application moves past it, so the
 * filler pulling newer events never makes an unprocessed event committable.
 */
final class BufferedBatchCursor<K, V> implements BatchCursor<K, V>, ActiveCursor<K, V> {

    private static final Logger log = LoggerFactory.getLogger(BufferedBatchCursor.class);

    private final StreamSession<K, V> session;

    private final ChannelReader<K, V> reader;

    private final AckMode ackMode;

    private final int size;

    private final long windowNanos;

    private final Duration closeTimeout;

    private volatile Scheduler fillerScheduler;

    private final CountDownLatch fillerDone = new CountDownLatch(1);

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition changed = lock.newCondition();

    private final Condition notFull = lock.newCondition();

    // guarded by lock
    private List<Delivery<K, V>> filling;

    private long firstArrivalNanos;

    private boolean upstreamDone;

    private Throwable failure;

    private volatile boolean closed;

    private volatile boolean aborted;

    private volatile Thread fillerThread;

    private volatile Thread owner;

    // application thread only
    private List<Delivery<K, V>> ready;

    private List<Delivery<K, V>> current = Collections.emptyList();

    private List<Event<K, V>> currentBatch = Collections.emptyList();

    private boolean rejected;

    BufferedBatchCursor(StreamSession<K, V> session, AckMode ackMode, int size, Duration within) {
        this.session = session;
        this.reader = session.reader();
        this.ackMode = ackMode;
        this.size = size;
        this.windowNanos = within.toNanos();
        this.closeTimeout = session.options().closeTimeout();
        this.filling = new ArrayList<>(size);
        this.owner = Thread.currentThread();
    }

    void start() {
        fillerScheduler = StreamSchedulers.newFiller(session.streamId());
        fillerScheduler.schedule(this::fill);
    }

    private void fill() {
        fillerThread = Thread.currentThread();
        try {
            while (!closed) {
                lock.lock();
                try {
                    while (filling.size() >= size && !closed)
                        notFull.await();
                } finally {
                    lock.unlock();
                }
                if (closed)
                    break;
                Delivery<K, V> delivery = reader.next();
                lock.lock();
                try {
                    if (delivery == null) {
                        upstreamDone = true;
                        changed.signalAll();
                        break;
                    }
                    if (filling.isEmpty())
                        firstArrivalNanos = System.nanoTime();
                    filling.add(delivery);
                    changed.signalAll();
                } finally {
                    lock.unlock();
                }
            }
        } catch (InterruptedException e) {
            log.debug("Filler of {} interrupted", session.streamId());
        } catch (Throwable t) {
            log.debug("Filler of {} failed", session.streamId(), t);
            lock.lock();
            try {
                failure = t;
                upstreamDone = true;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        } finally {
            fillerThread = null;
            fillerDone.countDown();
        }
    }

    @Override
    public boolean hasNext() {
        if (closed)
            return false;
        completeCurrent();
        if (ready == null)
            ready = awaitBatch();
        return ready != null;
    }

    @Override
    public List<Event<K, V>> next() {
        if (!hasNext())
            throw new NoSuchElementException(closed ? "Cursor is closed" : "Channel exhausted");
        owner = Thread.currentThread();
        List<Delivery<K, V>> batch = ready;
        ready = null;
        List<Event<K, V>> events = new ArrayList<>(batch.size());
        for (Delivery<K, V> delivery : batch)
            events.add(delivery.event());
        current = batch;
        currentBatch = Collections.unmodifiableList(events);
        rejected = false;
        return currentBatch;
    }

    /**
     * Blocks until a batch is ready. A partial batch is returned immediately once the
     * channel is exhausted; a filler failure is thrown after the deliveries buffered
     * before it have been handed out.
     * @return next batch, or <code>null</code> if there is none
     */
    private List<Delivery<K, V>> awaitBatch() {
        lock.lock();
        try {
            while (true) {
                if (closed)
                    return null;
                if (!filling.isEmpty()) {
                    if (filling.size() >= size || upstreamDone)
                        return seal();
                    long remaining = windowNanos - (System.nanoTime() - firstArrivalNanos);
                    if (remaining <= 0)
                        return seal();
                    changed.awaitNanos(remaining);
                } else if (upstreamDone) {
                    if (failure != null)
                        throw Exceptions.propagate(failure);
                    return null;
                } else {
                    changed.await();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw Exceptions.propagate(e);
        } finally {
            lock.unlock();
        }
    }

    private List<Delivery<K, V>> seal() {
        List<Delivery<K, V>> batch = filling;
        filling = new ArrayList<>(size);
        notFull.signalAll();
        return batch;
    }

    private void completeCurrent() {
        if (ackMode != AckMode.AUTO_ACK || rejected || aborted)
            return;
        for (Delivery<K, V> delivery : current)
            delivery.acknowledge();
    }

    @Override
    public List<Event<K, V>> currentBatch() {
        return currentBatch;
    }

    @Override
    public Event<K, V> currentEvent() {
        return null;
    }

    @Override
    public void ack(Event<K, V> event) {
        if (!closed) {
            for (Delivery<K, V> delivery : current) {
                if (delivery.matches(event)) {
                    delivery.acknowledge();
                    return;
                }
            }
        }
        throw new StaleAcknowledgmentException("Event " + event + " is not a member of the current batch " + currentBatch);
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
            if (stopFiller())
                handBack();
            else
                session.readerLost("the filler of " + this + " did not terminate within " + closeTimeout);
            session.release(this);
        }
    }

    @Override
    public void abort() {
        aborted = true;
        closed = true;
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        stopFiller();
        session.release(this);
    }

    /**
     * Stops the filler and waits for it to terminate.
     * @return true if the filler terminated within the close timeout
     */
    private boolean stopFiller() {
        lock.lock();
        try {
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
        Scheduler scheduler = fillerScheduler;
        if (scheduler == null)
            return true;
        Thread thread = fillerThread;
        if (thread != null)
            thread.interrupt();
        try {
            if (!fillerDone.await(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Filler of {} did not terminate within {}, buffered events are dropped",
                    session.streamId(), closeTimeout);
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the filler of {}", session.streamId());
            return false;
        } finally {
            scheduler.dispose();
        }
    }

    // deliveries recorded by the filler but never yielded go back to the reader, oldest first
    private void handBack() {
        List<Delivery<K, V>> unconsumed = new ArrayList<>();
        if (ready != null)
            unconsumed.addAll(ready);
        ready = null;
        lock.lock();
        try {
            unconsumed.addAll(filling);
            filling = new ArrayList<>(0);
        } finally {
            lock.unlock();
        }
        if (!unconsumed.isEmpty()) {
            log.debug("Handing back {} buffered events of {}", unconsumed.size(), session.streamId());
            reader.pushBack(unconsumed);
        }
    }

    @Override
    public String toString() {
        return "BatchCursor(" + session.streamId() + ", " + ackMode + ", size=" + size + ", window="
            + Duration.ofNanos(windowNanos) + ")";
    }
}
