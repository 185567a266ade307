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

package reactor.kstream.processor;

import org.apache.kafka.common.TopicPartition;
import reactor.core.publisher.Mono;
import reactor.kstream.Channel;
import reactor.kstream.Committer;
import reactor.kstream.Event;
import reactor.kstream.processor.errors.StaleAcknowledgmentException;
import reactor.kstream.processor.internals.DefaultEventStream;
import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A stream of events consumed from the partitions of a {@link Channel}. Processing
 * progress is tracked per partition, and the highest offset whose event and all
 * delivered predecessors have been acknowledged is committed periodically through
 * the {@link Committer}.
 * <p>
 * Only one cursor may be open on a stream (and on the streams derived from it with
 * {@link #noack()}) at a time. Events pulled but not consumed by a closed cursor are
 * handed to the next cursor, so iteration can be resumed. A cursor left open by a
 * <code>for</code> loop that exited with <code>break</code> is closed, and its last
 * event acknowledged, when the same thread opens the next cursor or closes the stream.
 *
 * @param <K> event key type
 * @param <V> event value type
 */
public interface EventStream<K, V> extends Iterable<Event<K, V>>, AutoCloseable {

    /**
     * Creates a stream over the specified channel.
     *
     * @param channel source of events. The stream subscribes to its assignment notifications
     *        when the first cursor is opened and closes it when the stream is closed.
     * @param committer destination of offset commits
     * @param options configuration options of this stream
     * @return new stream instance
     */
    static <K, V> EventStream<K, V> create(Channel<K, V> channel, Committer committer, StreamOptions options) {
        return new DefaultEventStream<>(channel, committer, options);
    }

    /**
     * Returns a view of this stream in which events are not acknowledged automatically.
     * Every event must then be acknowledged with {@link #ack(Event)} while it is current.
     * Events left unacknowledged hold back the committable offset of their partition.
     * @return stream sharing this stream's channel and offsets with {@link AckMode#MANUAL_ACK}
     */
    EventStream<K, V> noack();

    /**
     * Returns the acknowledgment mode of this stream.
     * @return acknowledgment mode
     */
    AckMode ackMode();

    /**
     * Opens a cursor over the events of this stream.
     * @return new cursor
     * @throws IllegalStateException if another cursor is open or the stream is closed
     */
    @Override
    EventCursor<K, V> iterator();

    /**
     * Opens a batching cursor. Up to <code>size</code> events are collected by a background
     * filler; a partial batch is handed out once <code>within</code> has elapsed since its
     * first event arrived.
     *
     * @param size maximum number of events in a batch
     * @param within maximum time to wait for a batch to fill up
     * @return new batch cursor
     * @throws IllegalArgumentException if <code>size</code> exceeds {@link StreamOptions#maxBufferSize()}
     */
    BatchCursor<K, V> take(int size, Duration within);

    /**
     * Opens a batching cursor using {@link StreamOptions#bufferSize()} and {@link StreamOptions#bufferWindow()}.
     * @return new batch cursor
     */
    default BatchCursor<K, V> take() {
        return take(options().bufferSize(), options().bufferWindow());
    }

    /**
     * Returns the event currently yielded by the open cursor.
     * @return current event or <code>null</code> if no cursor is open or nothing was yielded
     */
    @Nullable
    Event<K, V> currentEvent();

    /**
     * Acknowledges an event of the open cursor: its current event, or a member of its
     * current batch.
     * @param event event to acknowledge
     * @throws StaleAcknowledgmentException if the event cannot be acknowledged any more
     */
    void ack(Event<K, V> event);

    /**
     * Processes events until the channel is exhausted. If <code>action</code> throws,
     * the failed event is not acknowledged and the exception is rethrown.
     */
    @Override
    default void forEach(Consumer<? super Event<K, V>> action) {
        forEachWhile(event -> {
            action.accept(event);
            return true;
        });
    }

    /**
     * Processes events until <code>action</code> returns false or the channel is exhausted.
     * The event for which <code>action</code> returned false counts as processed.
     * If <code>action</code> throws, the failed event is not acknowledged and the
     * exception is rethrown.
     *
     * @param action processing step, returning false to stop
     * @return number of events processed
     */
    long forEachWhile(Predicate<? super Event<K, V>> action);

    /**
     * Processes batches of events collected by {@link #take(int, Duration)} until the channel
     * is exhausted. If <code>action</code> throws, no event of the failed batch is acknowledged
     * and the exception is rethrown.
     *
     * @param size maximum number of events in a batch
     * @param within maximum time to wait for a batch to fill up
     * @param action processing step
     */
    void forEachBatch(int size, Duration within, Consumer<? super List<Event<K, V>>> action);

    /**
     * Commits the acknowledged offsets of all partitions. This method commits asynchronously
     * when the returned Mono is subscribed to. Commit failures are not propagated: the offsets
     * are retried by the next commit pass.
     * @return Mono that completes when the commit pass completes
     */
    Mono<Void> commit();

    /**
     * Returns the committable offset of every partition currently tracked.
     * @return committable offsets, <code>-1</code> for partitions without progress
     */
    Map<TopicPartition, Long> committableOffsets();

    /**
     * Returns the options of this stream.
     * @return stream options
     */
    StreamOptions options();

    /**
     * Stops the stream: the open cursor is aborted without acknowledging events still
     * buffered, a final commit pass is attempted and the channel is closed.
     */
    @Override
    void close();
}
