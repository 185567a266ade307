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

import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import reactor.kstream.Event;

import java.util.Collection;
import java.util.Objects;

/**
 * A stream listener that writes every engine event to SLF4J at a fixed level.
 * Commit failures are always logged at <code>WARN</code> or above.
 */
public class LoggingStreamListener implements StreamListener {

    private final Logger log;

    private final Level level;

    public LoggingStreamListener(Level level) {
        this(LoggerFactory.getLogger(LoggingStreamListener.class), level);
    }

    public LoggingStreamListener(Logger log, Level level) {
        this.log = Objects.requireNonNull(log, "log");
        this.level = Objects.requireNonNull(level, "level");
    }

    public Level level() {
        return level;
    }

    @Override
    public void onDelivered(Event<?, ?> event) {
        log.atLevel(level).log("Delivered {}", event);
    }

    @Override
    public void onAcknowledged(TopicPartition partition, long offset) {
        log.atLevel(level).log("Acknowledged {}@{}", partition, offset);
    }

    @Override
    public void onCommitted(TopicPartition partition, long offset) {
        log.atLevel(level).log("Committed {}@{}", partition, offset);
    }

    @Override
    public void onCommitFailed(TopicPartition partition, long offset, Throwable error) {
        Level failureLevel = level.toInt() > Level.WARN.toInt() ? level : Level.WARN;
        log.atLevel(failureLevel).log("Commit of {}@{} failed: {}", partition, offset, error.toString());
    }

    @Override
    public void onAssigned(Collection<TopicPartition> partitions) {
        log.atLevel(level).log("Assigned {}", partitions);
    }

    @Override
    public void onRevoked(Collection<TopicPartition> partitions) {
        log.atLevel(level).log("Revoked {}", partitions);
    }
}
