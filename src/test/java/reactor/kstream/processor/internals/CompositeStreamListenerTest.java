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

import org.apache.kafka.common.TopicPartition;
import org.junit.Test;
import reactor.kstream.Event;
import reactor.kstream.processor.StreamListener;

import java.util.Arrays;
import java.util.Collections;

import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class CompositeStreamListenerTest {

    @Test
    public void failingListenerDoesNotAffectOthers() {
        StreamListener failing = mock(StreamListener.class);
        StreamListener healthy = mock(StreamListener.class);
        Event<Integer, String> event = Event.of("orders", 0, 1L, 1, "a");
        TopicPartition tp0 = event.topicPartition();
        willThrow(new IllegalStateException("listener failed")).given(failing).onDelivered(event);
        willThrow(new IllegalStateException("listener failed")).given(failing).onRevoked(Collections.singletonList(tp0));
        CompositeStreamListener composite = new CompositeStreamListener(Arrays.asList(failing, healthy));

        composite.onDelivered(event);
        composite.onCommitted(tp0, 1L);
        composite.onRevoked(Collections.singletonList(tp0));

        verify(healthy).onDelivered(event);
        verify(healthy).onCommitted(tp0, 1L);
        verify(failing).onCommitted(tp0, 1L);
        verify(healthy).onRevoked(Collections.singletonList(tp0));
    }
}
