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

import reactor.util.annotation.Nullable;

/**
 * Ordered source of events. Within a partition, events are returned in increasing
 * offset order. Events of different partitions may be interleaved.
 * <p>
 * A channel is pulled by one thread at a time, but not always the same thread:
 * batching streams pull from a background filler thread.
 *
 * @param <K> event key type
 * @param <V> event value type
 */
public interface Channel<K, V> extends AutoCloseable {

    /**
     * Blocks until the next event is available.
     * @return the next event, or <code>null</code> once the channel is exhausted
     * @throws InterruptedException if the pulling thread is interrupted while waiting
     */
    @Nullable
    Event<K, V> pull() throws InterruptedException;

    /**
     * Registers the listener notified of partition assignments and revocations.
     * Invoked once, when the owning stream starts. Channels without group
     * management do not need to notify anything.
     * @param listener assignment listener of the owning stream
     */
    default void subscribe(AssignmentListener listener) {
    }

    @Override
    default void close() {
    }
}
