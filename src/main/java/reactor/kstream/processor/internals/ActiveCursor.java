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
 * The cursor currently open on a stream session.
 */
interface ActiveCursor<K, V> {

    Event<K, V> currentEvent();

    void ack(Event<K, V> event);

    /**
     * Returns true if <code>thread</code> opened this cursor or pulled from it last.
     */
    boolean isOwnedBy(Thread thread);

    /**
     * Completes consumption of the current event or batch and releases the cursor.
     * Invoked by the owning thread only.
     */
    void close();

    /**
     * Releases the cursor from another thread without acknowledging anything
     * that was not acknowledged yet.
     */
    void abort();
}
