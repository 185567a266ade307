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

package reactor.kstream.mock;

import org.apache.kafka.common.TopicPartition;
import reactor.kstream.Committer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Committer recording every commit, in order, per partition.
 */
public class MockCommitter implements Committer {

    private final Map<TopicPartition, List<Long>> commits = new ConcurrentHashMap<>();

    @Override
    public void commit(TopicPartition partition, long offset) {
        commits.computeIfAbsent(partition, tp -> Collections.synchronizedList(new ArrayList<>())).add(offset);
    }

    /**
     * Returns the last committed offset of <code>partition</code>, or null if it was never committed.
     */
    public Long lastCommitted(TopicPartition partition) {
        List<Long> offsets = commits.get(partition);
        if (offsets == null)
            return null;
        synchronized (offsets) {
            return offsets.isEmpty() ? null : offsets.get(offsets.size() - 1);
        }
    }

    public List<Long> commits(TopicPartition partition) {
        List<Long> offsets = commits.get(partition);
        if (offsets == null)
            return Collections.emptyList();
        synchronized (offsets) {
            return new ArrayList<>(offsets);
        }
    }
}
