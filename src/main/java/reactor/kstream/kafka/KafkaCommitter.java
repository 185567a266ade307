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
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import reactor.kstream.Committer;

import java.util.Collections;
import java.util.concurrent.locks.Lock;

/**
 * Commits offsets with {@link Consumer#commitSync(java.util.Map)}. Kafka commits the
 * position of the next record to read, so the committed value is <code>offset + 1</code>.
 */
class KafkaCommitter implements Committer {

    private final Consumer<?, ?> consumer;

    private final Lock consumerLock;

    KafkaCommitter(Consumer<?, ?> consumer, Lock consumerLock) {
        this.consumer = consumer;
        this.consumerLock = consumerLock;
    }

    @Override
    public void commit(TopicPartition partition, long offset) {
        consumerLock.lock();
        try {
            consumer.commitSync(Collections.singletonMap(partition, new OffsetAndMetadata(offset + 1)));
        } finally {
            consumerLock.unlock();
        }
    }
}
