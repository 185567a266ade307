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
import org.slf4j.event.Level;
import reactor.core.scheduler.Scheduler;
import reactor.kstream.Channel;
import reactor.kstream.Committer;
import reactor.kstream.Event;
import reactor.kstream.processor.LoggingStreamListener;
import reactor.kstream.processor.StreamListener;
import reactor.kstream.processor.StreamOptions;
import reactor.kstream.processor.errors.StaleAcknowledgmentException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State shared by a stream and its {@link reactor.kstream.processor.EventStream#noack()} views:
 * the channel reader, the coordinator and the single open cursor.
 */
final class StreamSession<K, V> {

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private final Channel<K, V> channel;

    private final StreamOptions options;

    private final Scheduler commitScheduler;

    private final AckCoordinator coordinator;

    private final ChannelReader<K, V> reader;

    private final AtomicReference<ActiveCursor<K, V>> active = new AtomicReference<>();

    private final AtomicBoolean started = new AtomicBoolean();

    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile String readerLostReason;

    StreamSession(Channel<K, V> channel, Committer committer, StreamOptions options) {
        this.channel = channel;
        this.options = options;
        StreamListener listener = options.listeners().isEmpty()
            ? new LoggingStreamListener(Level.DEBUG)
            : new CompositeStreamListener(options.listeners());
        this.commitScheduler = StreamSchedulers.newCommit(options.streamId());
        this.coordinator = new AckCoordinator(committer, options, listener, commitScheduler);
        this.reader = new ChannelReader<>(channel, coordinator);
    }

    String streamId() {
        return options.streamId();
    }

    StreamOptions options() {
        return options;
    }

    AckCoordinator coordinator() {
        return coordinator;
    }

    ChannelReader<K, V> reader() {
        return reader;
    }

    Scheduler commitScheduler() {
        return commitScheduler;
    }

    boolean isClosed() {
        return closed.get();
    }

    /**
     * Makes <code>cursor</code> the open cursor of the stream, starting the stream on first use.
     * A cursor left open by the calling thread, for example by a loop that exited early,
     * is closed first.
     * @throws IllegalStateException if the stream is closed, if the channel reader was
     *         lost, or if another thread has a cursor open
     */
    void acquire(ActiveCursor<K, V> cursor) {
        if (closed.get())
            throw new IllegalStateException("Stream " + streamId() + " is closed");
        ActiveCursor<K, V> previous = active.get();
        if (previous != null && previous.isOwnedBy(Thread.currentThread())) {
            log.debug("Closing cursor {} left open on stream {}", previous, streamId());
            previous.close();
        }
        String lost = readerLostReason;
        if (lost != null)
            throw new IllegalStateException("Stream " + streamId() + " cannot open a cursor, " + lost);
        if (!active.compareAndSet(null, cursor))
            throw new IllegalStateException("Stream " + streamId() + " already has an open cursor " + active.get());
        if (started.compareAndSet(false, true)) {
            coordinator.start();
            channel.subscribe(coordinator);
            log.info("Started stream {}", streamId());
        }
    }

    void release(ActiveCursor<K, V> cursor) {
        active.compareAndSet(cursor, null);
    }

    /**
     * Marks the channel reader as possibly still pulled by a thread this session no longer
     * controls. No cursor can be opened afterwards.
     */
    void readerLost(String reason) {
        readerLostReason = reason;
        log.error("Channel reader of stream {} is no longer usable: {}", streamId(), reason);
    }

    Event<K, V> currentEvent() {
        ActiveCursor<K, V> cursor = active.get();
        return cursor == null ? null : cursor.currentEvent();
    }

    void ack(Event<K, V> event) {
        ActiveCursor<K, V> cursor = active.get();
        if (cursor == null)
            throw new StaleAcknowledgmentException("No open cursor on stream " + streamId() + " to acknowledge " + event);
        cursor.ack(event);
    }

    /**
     * Releases the open cursor, runs a final commit pass and closes the channel.
     * A cursor owned by the calling thread is closed normally, so its current event is
     * completed; a cursor in use by another thread is aborted. Failures are logged, the
     * remaining steps still run.
     */
    void close() {
        if (!closed.compareAndSet(false, true))
            return;
        log.debug("Closing stream {}", streamId());
        ActiveCursor<K, V> cursor = active.getAndSet(null);
        if (cursor != null) {
            try {
                if (cursor.isOwnedBy(Thread.currentThread()))
                    cursor.close();
                else
                    cursor.abort();
            } catch (RuntimeException e) {
                log.warn("Cursor of stream {} failed to stop", streamId(), e);
            }
        }
        try {
            coordinator.stop();
        } catch (RuntimeException e) {
            log.error("Final commit of stream {} failed", streamId(), e);
        }
        try {
            channel.close();
        } catch (Exception e) {
            log.warn("Channel of stream {} failed to close", streamId(), e);
        }
        commitScheduler.dispose();
        log.info("Closed stream {}", streamId());
    }
}
