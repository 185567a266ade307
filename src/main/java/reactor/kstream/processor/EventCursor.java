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

import reactor.kstream.Event;
import reactor.kstream.processor.errors.OutOfOrderDeliveryException;
import reactor.kstream.processor.errors.StaleAcknowledgmentException;
import reactor.util.annotation.Nullable;

import java.util.Iterator;

/**
 * Iteration over the events of an {@link EventStream}, obtained with {@link EventStream#iterator()}.
 * <p>
 * In {@link AckMode#AUTO_ACK} mode, a yielded event is acknowledged once it has been
 * consumed, that is when the application asks for the next event or closes the cursor.
 * Closing the cursor after an early exit from the loop therefore still acknowledges the
 * last event processed, exactly once. An event marked with {@link #reject()} is never
 * acknowledged automatically.
 * <p>
 * Example usage:
 * <pre>
 * {@code
 * try (EventCursor<String, String> cursor = stream.iterator()) {
 *     while (cursor.hasNext()) {
 *         Event<String, String> event = cursor.next();
 *         if (process(event) == DONE)
 *             break;
 *     }
 * }
 * }
 * </pre>
 * Cursors are not thread-safe and must be used by one thread at a time.
 *
 * @param <K> event key type
 * @param <V> event value type
 */
public interface EventCursor<K, V> extends Iterator<Event<K, V>>, AutoCloseable {

    /**
     * Returns true if another event is available, blocking on the channel if required.
     * Completes consumption of the previously yielded event.
     */
    @Override
    boolean hasNext();

    /**
     * Yields the next event and records its delivery.
     * @throws OutOfOrderDeliveryException if the channel broke partition ordering
     */
    @Override
    Event<K, V> next();

    /**
     * Returns the event most recently yielded by this cursor.
     * @return current event or <code>null</code> if no event was yielded yet
     */
    @Nullable
    Event<K, V> currentEvent();

    /**
     * Acknowledges the current event. Acknowledging the current event more than once
     * has no effect.
     * @param event the event returned by the latest {@link #next()}
     * @throws StaleAcknowledgmentException if <code>event</code> is not the current event
     */
    void ack(Event<K, V> event);

    /**
     * Marks the current event as failed so that it is not acknowledged automatically.
     */
    void reject();

    /**
     * Completes consumption of the current event and releases this cursor.
     */
    @Override
    void close();
}
