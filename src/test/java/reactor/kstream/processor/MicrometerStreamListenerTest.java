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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.RetriableCommitFailedException;
import org.apache.kafka.common.TopicPartition;
import org.junit.Before;
import org.junit.Test;
import reactor.kstream.Event;
import reactor.kstream.mock.MockChannel;
import reactor.kstream.mock.MockCommitter;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

public class MicrometerStreamListenerTest {

    private final TopicPartition tp0 = new TopicPartition("orders", 0);

    private MeterRegistry registry;

    private MicrometerStreamListener listener;

    @Before
    public void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new MicrometerStreamListener(registry, Collections.singletonList(Tag.of("app", "billing")));
    }

    @Test
    public void countersAreTaggedWithPartition() {
        listener.onDelivered(Event.of("orders", 0, 1L, 1, "a"));
        listener.onDelivered(Event.of("orders", 0, 2L, 1, "b"));
        listener.onAcknowledged(tp0, 1L);

        assertThat(registry.get(MicrometerStreamListener.DELIVERED)
            .tags("topic", "orders", "partition", "0", "app", "billing")
            .counter().count()).isEqualTo(2.0);
        assertThat(registry.get(MicrometerStreamListener.ACKNOWLEDGED).counter().count()).isEqualTo(1.0);
    }

    @Test
    public void committedOffsetGaugeFollowsCommits() {
        listener.onCommitted(tp0, 4L);
        listener.onCommitted(tp0, 9L);

        assertThat(registry.get(MicrometerStreamListener.COMMITS).counter().count()).isEqualTo(2.0);
        assertThat(registry.get(MicrometerStreamListener.COMMITTED_OFFSET).gauge().value()).isEqualTo(9.0);
    }

    @Test
    public void commitFailuresAreTaggedWithException() {
        listener.onCommitFailed(tp0, 4L, new RetriableCommitFailedException("test"));

        assertThat(registry.get(MicrometerStreamListener.COMMIT_FAILURES)
            .tag("exception", "RetriableCommitFailedException")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    public void revocationsAreCountedPerPartition() {
        listener.onRevoked(Arrays.asList(tp0, new TopicPartition("orders", 1)));

        assertThat(registry.find(MicrometerStreamListener.REVOKED).counters()).hasSize(2);
    }

    @Test
    public void committedOffsetGaugeIsRemovedOnRevocation() {
        TopicPartition tp1 = new TopicPartition("orders", 1);
        listener.onCommitted(tp0, 4L);
        listener.onCommitted(tp1, 7L);

        listener.onRevoked(Collections.singletonList(tp0));

        assertThat(registry.find(MicrometerStreamListener.COMMITTED_OFFSET).gauges()).hasSize(1);
        assertThat(registry.get(MicrometerStreamListener.COMMITTED_OFFSET).tag("partition", "1").gauge().value())
            .isEqualTo(7.0);

        listener.onCommitted(tp0, 12L);
        assertThat(registry.get(MicrometerStreamListener.COMMITTED_OFFSET).tag("partition", "0").gauge().value())
            .isEqualTo(12.0);
    }

    @Test
    public void streamReportsToConfiguredListener() {
        MockChannel channel = new MockChannel();
        channel.sendRange("orders", 0, 0, 4).complete();
        EventStream<Integer, String> stream = EventStream.create(channel, new MockCommitter(), StreamOptions.create()
            .commitInterval(Duration.ZERO)
            .addListener(listener));

        stream.forEach(event -> { });
        stream.close();

        assertThat(registry.get(MicrometerStreamListener.DELIVERED).counter().count()).isEqualTo(5.0);
        assertThat(registry.get(MicrometerStreamListener.ACKNOWLEDGED).counter().count()).isEqualTo(5.0);
        assertThat(registry.get(MicrometerStreamListener.COMMITTED_OFFSET).gauge().value()).isEqualTo(4.0);
    }
}
