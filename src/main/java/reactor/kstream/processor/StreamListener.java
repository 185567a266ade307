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
import reactor.kstream.Event;

import java.util.Collection;

/**
 * Receives the structured events emitted by the acknowledgment engine. All methods
 * have empty defaults. Implementations must be thread-safe: deliveries and
 * acknowledgments are reported from the consuming (or filler) thread, commits from
 * the commit scheduler.
 *
 * @see LoggingStreamListener
 * @see MicrometerStreamListener
 */
public interface StreamListener {

    default void onDelivered(Event<?, ?> event) {
    }

    default void onAcknowledged(TopicPartition partition, long offset) {
    }

    default void onCommitted(TopicPartition partition, long offset) {
    }

    default void onCommitFailed(TopicPartition partition, long offset, Throwable error) {
    }

    default void onAssigned(Collection<TopicPartition> partitions) {
    }

    default void onRevoked(Collection<TopicPartition> partitions) {
    }
}
