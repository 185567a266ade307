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

package reactor.kstream.processor.errors;

import org.apache.kafka.common.TopicPartition;

/**
 * Thrown when a channel hands out an offset lower than one it already delivered
 * for the same partition. The partition's offset tracker stays failed afterwards.
 */
public class OutOfOrderDeliveryException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final TopicPartition topicPartition;

    private final long offset;

    private final long lastDelivered;

    public OutOfOrderDeliveryException(TopicPartition topicPartition, long offset, long lastDelivered) {
        super("Offset " + offset + " of " + topicPartition + " delivered after offset " + lastDelivered);
        this.topicPartition = topicPartition;
        this.offset = offset;
        this.lastDelivered = lastDelivered;
    }

    public TopicPartition topicPartition() {
        return topicPartition;
    }

    public long offset() {
        return offset;
    }

    public long lastDelivered() {
        return lastDelivered;
    }
}
