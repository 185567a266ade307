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

package reactor.kstream.kafka;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.kstream.AssignmentListener;
import reactor.kstream.Channel;
import reactor.kstream.Committer;
import reactor.kstream.Event;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * {@link Channel} over a kafka-clients {@link Consumer}. The consumer is not thread-safe, so
 * every access, including commits of the {@link #committer() committer}, is serialized on
 * one fair lock. Polls are short so that commits are not delayed for long.
 * <p>
 * The channel owns the consumer and closes it when it is closed.
 *
 * @param <K> record key type
 * @param <V> record value type
 */
public class KafkaChannel<K, V> implements Channel<K, V> {

    private static final Logger log = LoggerFactory.getLogger(KafkaChannel.class);

    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);

    public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final Consumer<K, V> consumer;

    private final BiConsumer<Consumer<K, V>, ConsumerRebalanceListener> subscriber;

    private final Duration pollTimeout;

    private final ReentrantLock consumerLock = new ReentrantLock(true);

    // guarded by consumerLock
    private final Deque<ConsumerRecord<K, V>> fetched = new ArrayDeque<>();

    private AssignmentListener assignmentListener;

    private boolean subscribed;

    private volatile boolean closed;

    KafkaChannel(Consumer<K, V> consumer, BiConsumer<Consumer<K, V>, ConsumerRebalanceListener> subscriber,
                 Duration pollTimeout) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.subscriber = subscriber;
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    }

    /**
     * Creates a channel reading <code>topics</code> with group management. Partition
     * assignments and revocations are forwarded to the owning stream.
     */
    public static <K, V> KafkaChannel<K, V> subscription(Consumer<K, V> consumer, Collection<String> topics) {
        return subscription(consumer, topics, DEFAULT_POLL_TIMEOUT);
    }

    public static <K, V> KafkaChannel<K, V> subscription(Consumer<K, V> consumer, Collection<String> topics,
                                                         Duration pollTimeout) {
        Objects.requireNonNull(topics, "topics");
        return new KafkaChannel<>(consumer, (c, listener) -> c.subscribe(topics, listener), pollTimeout);
    }

    /**
     * Creates a channel reading manually assigned <code>partitions</code>. The stream is
     * notified of the assignment once, when it starts; partitions are never revoked.
     */
    public static <K, V> KafkaChannel<K, V> assignment(Consumer<K, V> consumer, Collection<TopicPartition> partitions) {
        return assignment(consumer, partitions, DEFAULT_POLL_TIMEOUT);
    }

    public static <K, V> KafkaChannel<K, V> assignment(Consumer<K, V> consumer, Collection<TopicPartition> partitions,
                                                       Duration pollTimeout) {
        Collection<TopicPartition> assigned = new ArrayList<>(Objects.requireNonNull(partitions, "partitions"));
        return new KafkaChannel<>(consumer, (c, listener) -> {
            c.assign(assigned);
            listener.onPartitionsAssigned(assigned);
        }, pollTimeout);
    }

    /**
     * Returns a committer using the consumer of this channel.
     * @return committer sharing the consumer lock of this channel
     */
    public Committer committer() {
        return new KafkaCommitter(consumer, consumerLock);
    }

    @Override
    public void subscribe(AssignmentListener listener) {
        consumerLock.lock();
        try {
            if (subscribed)
                throw new IllegalStateException("Channel is already subscribed");
            subscribed = true;
            assignmentListener = listener;
            subscriber.accept(consumer, new RebalanceListener());
        } finally {
            consumerLock.unlock();
        }
    }

    @Override
    public Event<K, V> pull() throws InterruptedException {
        while (!closed) {
            if (Thread.interrupted())
                throw new InterruptedException("Interrupted while pulling from Kafka");
            consumerLock.lockInterruptibly();
            try {
                if (fetched.isEmpty())
                    poll();
                ConsumerRecord<K, V> record = fetched.pollFirst();
                if (record != null)
                    return toEvent(record);
            } finally {
                consumerLock.unlock();
            }
        }
        return null;
    }

    private void poll() throws InterruptedException {
        ConsumerRecords<K, V> records;
        try {
            records = consumer.poll(pollTimeout);
        } catch (WakeupException e) {
            log.debug("Poll woken up, closed={}", closed);
            return;
        } catch (InterruptException e) {
            Thread.interrupted();
            InterruptedException interrupted = new InterruptedException("Interrupted while polling Kafka");
            interrupted.initCause(e);
            throw interrupted;
        }
        if (!records.isEmpty()) {
            log.trace("Fetched {} records", records.count());
            for (ConsumerRecord<K, V> record : records)
                fetched.addLast(record);
        }
    }

    private Event<K, V> toEvent(ConsumerRecord<K, V> record) {
        return new Event<>(new TopicPartition(record.topic(), record.partition()), record.offset(), record.key(),
            record.value(), record.timestamp());
    }

    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        consumer.wakeup();
        consumerLock.lock();
        try {
            fetched.clear();
            consumer.close(DEFAULT_CLOSE_TIMEOUT);
            log.debug("Closed consumer");
        } finally {
            consumerLock.unlock();
        }
    }

    private class RebalanceListener implements ConsumerRebalanceListener {

        // invoked within poll(), with the consumer lock held
        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.debug("onPartitionsAssigned {}", partitions);
            if (!partitions.isEmpty())
                assignmentListener.assigned(partitions);
        }

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            log.debug("onPartitionsRevoked {}", partitions);
            if (partitions.isEmpty())
                return;
            Set<TopicPartition> revoked = new HashSet<>(partitions);
            int before = fetched.size();
            fetched.removeIf(record -> revoked.contains(new TopicPartition(record.topic(), record.partition())));
            if (before != fetched.size())
                log.debug("Dropped {} fetched records of revoked partitions", before - fetched.size());
            assignmentListener.revoked(partitions);
        }

        @Override
        public void onPartitionsLost(Collection<TopicPartition> partitions) {
            onPartitionsRevoked(partitions);
        }
    }
}
