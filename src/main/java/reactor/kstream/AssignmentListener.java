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

import java.util.Collection;

/**
 * Receives partition ownership changes for a stream.
 */
public interface AssignmentListener {

    /**
     * Invoked when partitions are assigned to this consumer.
     * @param partitions newly assigned partitions
     */
    void assigned(Collection<TopicPartition> partitions);

    /**
     * Invoked when partitions are taken away from this consumer. Progress acknowledged
     * but not yet committed for these partitions is discarded.
     * @param partitions revoked partitions
     */
    void revoked(Collection<TopicPartition> partitions);
}
