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

import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kstream.Channel;
import reactor.kstream.Committer;
import reactor.kstream.Event;
import reactor.kstream.processor.AckMode;
import reactor.kstream.processor.BatchCursor;
import reactor.kstream.processor.EventCursor;
import reactor.kstream.processor.EventStream;
import reactor.kstream.processor.StreamOptions;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

public class DefaultEventStream<K, V> implements EventStream<K, V> {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventStream.class);

    static final int LARGE_BUFFER_SIZE = 1000;

    private final StreamSession<K, V> session;

    private final AckMode ackMode;

    public DefaultEventStream(Channel<K, V> channel, Committer committer, StreamOptions options) {
        this(new StreamSession<>(
            Objects.requireNonNull(channel, "channel"),
            Objects.requireNonNull(committer, "committer"),
            Objects.requireNonNull(options, "options")
        ), options.ackMode());
    }

    private DefaultEventStream(StreamSession<K, V> session, AckMode ackMode) {
        this.session = session;
        this.ackMode = ackMode;
    }

    @Override
    public EventStream<K, V> noack() {
        return new DefaultEventStream<>(session, AckMode.MANUAL_ACK);
    }

    @Override
    public AckMode ackMode() {
        return ackMode;
    }

    @Override
    public EventCursor<K, V> iterator() {
        DefaultEventCursor<K, V> cursor = new DefaultEventCursor<>(session, ackMode);
        session.acquire(cursor);
        return cursor;
    }

    @Override
    public BatchCursor<K, V> take(int size, Duration within) {
        Objects.requireNonNull(within, "within");
        int maxBufferSize = session.options().maxBufferSize();
        if (size <= 0 || size > maxBufferSize)
            throw new IllegalArgumentException("Batch size must be between 1 and " + maxBufferSize + ", was " + size);
        if (within.isNegative() || within.isZero())
            throw new IllegalArgumentException("Batch window must be positive, was " + within);
        if (size > LARGE_BUFFER_SIZE)
            log.warn("Batch size {} of stream {} is large, every event of a batch is processed again after a crash",
                size, session.streamId());
        BufferedBatchCursor<K, V> cursor = new BufferedBatchCursor<>(session, ackMode, size, within);
        session.acquire(cursor);
        cursor.start();
        return cursor;
    }

    @Override
    public Event<K, V> currentEvent() {
        return session.currentEvent();
    }

    @Override
    public void ack(Event<K, V> event) {
        session.ack(event);
    }

    @Override
    public long forEachWhile(Predicate<? super Event<K, V>> action) {
        long count = 0;
        try (EventCursor<K, V> cursor = iterator()) {
            while (cursor.hasNext()) {
                Event<K, V> event = cursor.next();
                count++;
                boolean more;
                try {
                    more = action.test(event);
                } catch (Throwable t) {
                    cursor.reject();
                    throw t;
                }
                if (!more)
                    break;
            }
        }
        return count;
    }

    @Override
    public void forEachBatch(int size, Duration within, Consumer<? super List<Event<K, V>>> action) {
        try (BatchCursor<K, V> cursor = take(size, within)) {
            while (cursor.hasNext()) {
                List<Event<K, V>> batch = cursor.next();
                try {
                    action.accept(batch);
                } catch (Throwable t) {
                    cursor.reject();
                    throw t;
                }
            }
        }
    }

    @Override
    public Mono<Void> commit() {
        return Mono.defer(() -> {
            if (session.isClosed())
                return Mono.empty();
            AckCoordinator coordinator = session.coordinator();
            Mono<Void> commit = Mono.fromRunnable(coordinator::commitNow);
            // inline on stream threads, the commit scheduler is single threaded
            if (StreamSchedulers.isCurrentThreadFromScheduler())
                return commit;
            return commit.subscribeOn(session.commitScheduler());
        });
    }

    @Override
    public Map<TopicPartition, Long> committableOffsets() {
        return session.coordinator().committableOffsets();
    }

    @Override
    public StreamOptions options() {
        return session.options();
    }

    @Override
    public void close() {
        session.close();
    }

    @Override
    public String toString() {
        return "EventStream(" + session.streamId() + ", " + ackMode + ")";
    }
}
