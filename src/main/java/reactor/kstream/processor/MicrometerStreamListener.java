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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.apache.kafka.common.TopicPartition;
import reactor.kstream.Event;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A stream listener that records engine events as Micrometer meters tagged with
 * <code>topic</code> and <code>partition</code>.
 * <ul>
 *   <li><code>reactor.kstream.events.delivered</code>, <code>reactor.kstream.events.acknowledged</code>,
 *       <code>reactor.kstream.commits</code>, <code>reactor.kstream.commits.failed</code>,
 *       <code>reactor.kstream.partitions.revoked</code>: counters
 *   <li><code>reactor.kstream.committed.offset</code>: gauge of the last committed offset,
 *       removed when the partition is revoked
 * </ul>
 */
public class MicrometerStreamListener implements StreamListener {

    static final String DELIVERED = "reactor.kstream.events.delivered";
    static final String ACKNOWLEDGED = "reactor.kstream.events.acknowledged";
    static final String COMMITS = "reactor.kstream.commits";
    static final String COMMIT_FAILURES = "reactor.kstream.commits.failed";
    static final String REVOKED = "reactor.kstream.partitions.revoked";
    static final String COMMITTED_OFFSET = "reactor.kstream.committed.offset";

    private final MeterRegistry meterRegistry;

    private final Tags tags;

    private final Map<TopicPartition, AtomicLong> committedOffsets = new ConcurrentHashMap<>();

    /**
     * Construct an instance with the provided registry.
     * @param meterRegistry the registry.
     */
    public MicrometerStreamListener(MeterRegistry meterRegistry) {
        this(meterRegistry, Collections.emptyList());
    }

    /**
     * Construct an instance with the provided registry and tags.
     * @param meterRegistry the registry.
     * @param tags the tags added to every meter.
     */
    public MicrometerStreamListener(MeterRegistry meterRegistry, List<Tag> tags) {
        this.meterRegistry = meterRegistry;
        this.tags = Tags.of(tags);
    }

    @Override
    public void onDelivered(Event<?, ?> event) {
        counter(DELIVERED, event.topicPartition()).increment();
    }

    @Override
    public void onAcknowledged(TopicPartition partition, long offset) {
        counter(ACKNOWLEDGED, partition).increment();
    }

    @Override
    public void onCommitted(TopicPartition partition, long offset) {
        counter(COMMITS, partition).increment();
        committedOffsets.computeIfAbsent(partition, this::registerCommittedGauge).set(offset);
    }

    @Override
    public void onCommitFailed(TopicPartition partition, long offset, Throwable error) {
        Counter.builder(COMMIT_FAILURES)
            .tags(partitionTags(partition))
            .tag("exception", error.getClass().getSimpleName())
            .register(meterRegistry)
            .increment();
    }

    @Override
    public void onRevoked(Collection<TopicPartition> partitions) {
        for (TopicPartition partition : partitions) {
            counter(REVOKED, partition).increment();
            if (committedOffsets.remove(partition) != null) {
                Gauge gauge = meterRegistry.find(COMMITTED_OFFSET).tags(partitionTags(partition)).gauge();
                if (gauge != null)
                    meterRegistry.remove(gauge);
            }
        }
    }

    private Counter counter(String name, TopicPartition partition) {
        return Counter.builder(name).tags(partitionTags(partition)).register(meterRegistry);
    }

    private AtomicLong registerCommittedGauge(TopicPartition partition) {
        AtomicLong offset = new AtomicLong(-1);
        Gauge.builder(COMMITTED_OFFSET, offset, AtomicLong::doubleValue)
            .tags(partitionTags(partition))
            .register(meterRegistry);
        return offset;
    }

    private Tags partitionTags(TopicPartition partition) {
        return tags.and("topic", partition.topic(), "partition", String.valueOf(partition.partition()));
    }
}
