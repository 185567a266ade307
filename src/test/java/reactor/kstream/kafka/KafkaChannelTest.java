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

import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.Before;
import org.junit.Test;
import reactor.kstream.AssignmentListener;
import reactor.kstream.Event;
import reactor.kstream.processor.EventCursor;
import reactor.kstream.processor.EventStream;
import reactor.kstream.processor.StreamOptions;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class KafkaChannelTest {

    private final TopicPartition tp0 = new TopicPartition("orders", 0);

    private final TopicPartition tp1 = new TopicPartition("orders", 1);

    private final AtomicReference<ConsumerRebalanceListener> rebalanceListener = new AtomicReference<>();

    private MockConsumer<Integer, String> consumer;

    @Before
    public void setUp() {
        consumer = new MockConsumer<Integer, String>(OffsetResetStrategy.EARLIEST) {
            @Override
            public synchronized void subscribe(Collection<String> topics, ConsumerRebalanceListener listener) {
                rebalanceListener.set(listener);
                super.subscribe(topics, listener);
            }
        };
        Map<TopicPartition, Long> beginningOffsets = new HashMap<>();
        beginningOffsets.put(tp0, 0L);
        beginningOffsets.put(tp1, 0L);
        consumer.updateBeginningOffsets(beginningOffsets);
    }

    @Test
    public void streamOverAssignedPartitionsCommitsNextPosition() {
        KafkaChannel<Integer, String> channel = KafkaChannel.assignment(consumer, Collections.singletonList(tp0));
        EventStream<Integer, String> stream = EventStream.create(channel, channel.committer(), StreamOptions.create()
            .commitInterval(Duration.ZERO));
        EventCursor<Integer, String> cursor = stream.iterator();
        assertThat(consumer.assignment()).containsExactly(tp0);
        for (long offset = 0; offset < 5; offset++)
            consumer.addRecord(new ConsumerRecord<>("orders", 0, offset, 1, "value-" + offset));

        for (long offset = 0; offset < 3; offset++) {
            Event<Integer, String> event = cursor.next();
            assertThat(event.topicPartition()).isEqualTo(tp0);
            assertThat(event.offset()).isEqualTo(offset);
            assertThat(event.value()).isEqualTo("value-" + offset);
        }
        cursor.close();
        stream.commit().block(Duration.ofSeconds(10));

        Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(Collections.singleton(tp0));
        assertThat(committed.get(tp0).offset()).isEqualTo(3L);

        stream.close();
        assertThat(consumer.closed()).isTrue();
    }

    @Test
    public void rebalanceEventsAreForwarded() {
        AssignmentListener listener = mock(AssignmentListener.class);
        KafkaChannel<Integer, String> channel = KafkaChannel.subscription(consumer, Collections.singletonList("orders"));
        channel.subscribe(listener);
        assertThat(consumer.subscription()).containsExactly("orders");

        List<TopicPartition> assigned = Arrays.asList(tp0, tp1);
        consumer.rebalance(assigned);
        rebalanceListener.get().onPartitionsRevoked(Collections.singletonList(tp1));
        rebalanceListener.get().onPartitionsLost(Collections.singletonList(tp0));

        verify(listener, times(1)).assigned(assigned);
        verify(listener, times(1)).revoked(Collections.singletonList(tp1));
        verify(listener, times(1)).revoked(Collections.singletonList(tp0));
        assertThatThrownBy(() -> channel.subscribe(listener)).isInstanceOf(IllegalStateException.class);
        channel.close();
    }

    @Test
    public void fetchedRecordsOfRevokedPartitionsAreDropped() throws InterruptedException {
        KafkaChannel<Integer, String> channel = KafkaChannel.subscription(consumer, Collections.singletonList("orders"));
        channel.subscribe(mock(AssignmentListener.class));
        List<TopicPartition> assigned = Arrays.asList(tp0, tp1);
        consumer.rebalance(assigned);
        consumer.addRecord(new ConsumerRecord<>("orders", 0, 0L, 1, "a"));
        consumer.addRecord(new ConsumerRecord<>("orders", 0, 1L, 1, "b"));
        consumer.addRecord(new ConsumerRecord<>("orders", 1, 0L, 1, "c"));
        consumer.addRecord(new ConsumerRecord<>("orders", 1, 1L, 1, "d"));

        Event<Integer, String> first = channel.pull();
        rebalanceListener.get().onPartitionsRevoked(Collections.singletonList(tp1));

        int remaining = first.topicPartition().equals(tp0) ? 1 : 2;
        for (int i = 0; i < remaining; i++)
            assertThat(channel.pull().topicPartition()).isEqualTo(tp0);
        consumer.addRecord(new ConsumerRecord<>("orders", 0, 2L, 1, "e"));
        Event<Integer, String> next = channel.pull();
        assertThat(next.topicPartition()).isEqualTo(tp0);
        assertThat(next.offset()).isEqualTo(2L);
        channel.close();
    }

    @Test
    public void interruptedPullThrowsInterruptedException() {
        KafkaChannel<Integer, String> channel = KafkaChannel.assignment(consumer, Collections.singletonList(tp0));
        channel.subscribe(mock(AssignmentListener.class));

        Thread.currentThread().interrupt();
        assertThatThrownBy(channel::pull).isInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
        channel.close();
    }

    @Test
    public void closedChannelIsExhausted() throws InterruptedException {
        KafkaChannel<Integer, String> channel = KafkaChannel.assignment(consumer, Collections.singletonList(tp0));
        channel.subscribe(mock(AssignmentListener.class));

        channel.close();

        assertThat(channel.pull()).isNull();
        assertThat(consumer.closed()).isTrue();
    }

    @Test
    public void committerCommitsPositionAfterOffset() {
        KafkaChannel<Integer, String> channel = KafkaChannel.assignment(consumer, Collections.singletonList(tp0));
        channel.subscribe(mock(AssignmentListener.class));

        channel.committer().commit(tp0, 41L);

        assertThat(consumer.committed(Collections.singleton(tp0)).get(tp0).offset()).isEqualTo(42L);
        channel.close();
    }
}
