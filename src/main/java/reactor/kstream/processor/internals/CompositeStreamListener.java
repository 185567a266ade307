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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.kstream.Event;
import reactor.kstream.processor.StreamListener;

import java.util.Collection;
import java.util.List;

/**
 * Fans engine events out to the configured listeners. A failing listener is logged
 * and does not affect the others or the engine.
 */
final class CompositeStreamListener implements StreamListener {

    private static final Logger log = LoggerFactory.getLogger(CompositeStreamListener.class);

    private final List<StreamListener> listeners;

    CompositeStreamListener(List<StreamListener> listeners) {
        this.listeners = listeners;
    }

    @Override
    public void onDelivered(Event<?, ?> event) {
        for (StreamListener listener : listeners) {
            try {
                listener.onDelivered(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed", listener, e);
            }
        }
    }

    @Override
    public void onAcknowledged(TopicPartition partition, long offset) {
        for (StreamListener listener : listeners) {
            try {
                listener.onAcknowledged(partition, offset);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed", listener, e);
            }
        }
    }

    @Override
    public void onCommitted(TopicPartition partition, long offset) {
        for (StreamListener listener : listeners) {
            try {
                listener.onCommitted(partition, offset);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed", listener, e);
            }
        }
    }

    @Override
    public void onCommitFailed(TopicPartition partition, long offset, Throwable error) {
        for (StreamListener listener : listeners) {
            try {
                listener.onCommitFailed(partition, offset, error);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed", listener, e);
            }
        }
    }

    @Override
    public void onAssigned(Collection<TopicPartition> partitions) {
        for (StreamListener listener : listeners) {
            try {
                listener.onAssigned(partitions);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed", listener, e);
            }
        }
    }

    @Override
    public void onRevoked(Collection<TopicPartition> partitions) {
        for (StreamListener listener : listeners) {
            try {
                listener.onRevoked(partitions);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed", listener, e);
            }
        }
    }
}
