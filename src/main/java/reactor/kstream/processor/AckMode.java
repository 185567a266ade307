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

/**
 * Acknowledgment policy of an {@link EventStream}.
 */
public enum AckMode {
    /**
     * Events are acknowledged automatically once they have been consumed.
     */
    AUTO_ACK,
    /**
     * Acknowledgment is left to the application, see {@link EventStream#ack(reactor.kstream.Event)}.
     */
    MANUAL_ACK
}
