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

package reactor.kstream;

import org.apache.kafka.common.TopicPartition;

import java.util.Objects;

/**
 * An immutable event read from a {@link Channel}. The offset is only meaningful
 * within the event's topic partition.
 *
 * @param <K> event key type
 * @param <V> event value type
 */
public final class Event<K, V> {

    private final TopicPartition topicPartition;

    private final long offset;

    private final K key;

    private final V value;

    private final long timestamp;

    public Event(TopicPartition topicPartition, long offset, K key, V value, long timestamp) {
        this.topicPartition = Objects.requireNonNull(topicPartition, "topicPartition");
        if (offset < 0)
            throw new IllegalArgumentException("Offset must be >= 0, was " + offset);
        this.offset = offset;
        this.key = key;
        this.value = value;
        this.timestamp = timestamp;
    }

    public static <K, V> Event<K, V> of(String topic, int partition, long offset, K key, V value) {
        return new Event<>(new TopicPartition(topic, partition), offset, key, value, System.currentTimeMillis());
    }

    public TopicPartition topicPartition() {
        return topicPartition;
    }

    public long offset() {
        return offset;
    }

    public K key() {
        return key;
    }

    public V value() {
        return value;
    }

    /**
     * Returns the timestamp of this event in milliseconds since the epoch.
     * @return event timestamp
     */
    public long timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object object) {
        if (object == this) return true;
        if (object instanceof Event) {
            Event<?, ?> that = (Event<?, ?>) object;
            return offset == that.offset
                && timestamp == that.timestamp
                && topicPartition.equals(that.topicPartition)
                && Objects.equals(key, that.key)
                && Objects.equals(value, that.value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(topicPartition, offset, key, value, timestamp);
    }

    @Override
    public String toString() {
        return topicPartition + "@" + offset;
    }
}
