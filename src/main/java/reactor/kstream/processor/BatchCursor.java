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
import reactor.kstream.processor.errors.StaleAcknowledgmentException;

import java.util.Iterator;
import java.util.List;

/**
 * Iteration over batches of events, obtained with {@link EventStream#take(int, java.time.Duration)}.
 * Events are buffered by a background filler; a batch is handed out when it reaches its
 * size or when its time window elapses, whichever comes first.
 * <p>
 * In {@link AckMode#AUTO_ACK} mode, the events of a batch are acknowledged in order only
 * after the whole batch has been consumed, that is when the application asks for the
 * next batch or closes the cursor. If the application fails while processing a batch
 * and {@link #reject()} is invoked, none of its events is acknowledged and the batch is
 * delivered again after a restart.
 *
 * @param <K> event key type
 * @param <V> event value type
 */
public interface BatchCursor<K, V> extends Iterator<List<Event<K, V>>>, AutoCloseable {

    /**
     * Returns the batch most recently yielded by this cursor.
     * @return current batch, empty if no batch was yielded yet
     */
    List<Event<K, V>> currentBatch();

    /**
     * Acknowledges one member of the current batch.
     * @param event an event of the current batch
     * @throws StaleAcknowledgmentException if <code>event</code> is not a member of the current batch
     */
    void ack(Event<K, V> event);

    /**
     * Marks the current batch as failed so that it is not acknowledged automatically.
     */
    void reject();

    /**
     * Stops the background filler and completes consumption of the current batch.
     * Events buffered but never yielded are handed back to the stream.
     */
    @Override
    void close();
}
