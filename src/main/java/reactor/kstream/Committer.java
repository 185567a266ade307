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
import org.apache.kafka.common.errors.RetriableException;

/**
 * Broker side of the offset checkpoint. Committing the same offset twice must be harmless.
 */
@FunctionalInterface
public interface Committer {

    /**
     * Commits <code>offset</code> as the last processed offset of <code>partition</code>.
     * Transient broker failures should be thrown as {@link RetriableException}.
     *
     * @param partition the partition to checkpoint
     * @param offset last offset of the partition whose event, and every delivered event before it, was processed
     */
    void commit(TopicPartition partition, long offset);
}
