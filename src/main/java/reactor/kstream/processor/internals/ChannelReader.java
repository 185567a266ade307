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

import reactor.kstream.Channel;
import reactor.kstream.Event;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;

/**
 * Reads a channel on behalf of the cursors of one stream. An event pulled to answer
 * <code>hasNext()</code> and deliveries buffered but never yielded by a closed cursor
 * are kept here, so that the next cursor continues exactly where the previous one stopped.
 * <p>
 * Not thread-safe: it is used by one cursor at a time, and cursors hand it over only
 * after their filler thread has terminated.
 */
final class ChannelReader<K, V> {

    private final Channel<K, V> channel;

    private final AckCoordinator coordinator;

    private final Deque<Delivery<K, V>> returned = new ArrayDeque<>();

    private Event<K, V> lookahead;

    private boolean exhausted;

    ChannelReader(Channel<K, V> channel, AckCoordinator coordinator) {
        this.channel = channel;
        this.coordinator = coordinator;
    }

    /**
     * Returns true if another delivery is available, blocking on the channel if required.
     */
    boolean hasNext() throws InterruptedException {
        if (!returned.isEmpty() || lookahead != null)
            return true;
        if (exhausted)
            return false;
        lookahead = channel.pull();
        if (lookahead == null)
            exhausted = true;
        return lookahead != null;
    }

    /**
     * Returns the next delivery, recording it with the tracker of its partition unless
     * it was handed back by a previous cursor.
     * @return next delivery, or <code>null</code> if the channel is exhausted
     */
    Delivery<K, V> next() throws InterruptedException {
        if (!returned.isEmpty())
            return returned.pollFirst();
        if (!hasNext())
            return null;
        Event<K, V> event = lookahead;
        lookahead = null;
        PartitionOffsetTracker tracker = coordinator.deliver(event);
        return new Delivery<>(event, tracker, coordinator);
    }

    /**
     * Hands back deliveries that were recorded but never yielded. They are returned again,
     * in the same order, before anything else.
     */
    void pushBack(List<Delivery<K, V>> deliveries) {
        ListIterator<Delivery<K, V>> iterator = deliveries.listIterator(deliveries.size());
        while (iterator.hasPrevious())
            returned.addFirst(iterator.previous());
    }
}
