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

package reactor.kstream.processor.internals;

import reactor.kstream.Event;

/**
 * An event handed to the application, bound to the tracker that recorded its delivery.
 * Acknowledgments always go to that tracker, so once the partition is revoked they are
 * ignored even if the partition is assigned again later.
 */
final class Delivery<K, V> {

    private final Event<K, V> event;

    private final PartitionOffsetTracker tracker;

    private final AckCoordinator coordinator;

    private boolean acknowledged;

    Delivery(Event<K, V> event, PartitionOffsetTracker tracker, AckCoordinator coordinator) {
        this.event = event;
        this.tracker = tracker;
        this.coordinator = coordinator;
    }

    Event<K, V> event() {
        return event;
    }

    boolean matches(Event<?, ?> other) {
        return other != null
            && event.offset() == other.offset()
            && event.topicPartition().equals(other.topicPartition());
    }

    void acknowledge() {
        if (acknowledged)
            return;
        acknowledged = true;
        coordinator.acknowledge(tracker, event.offset());
    }

    @Override
    public String toString() {
        return event.toString();
    }
}
