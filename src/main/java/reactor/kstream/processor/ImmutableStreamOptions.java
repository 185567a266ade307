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

import reactor.util.annotation.NonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

class ImmutableStreamOptions implements StreamOptions {

    private static final AtomicLong COUNTER = new AtomicLong();

    static final Duration DEFAULT_COMMIT_INTERVAL = Duration.ofMillis(5000);
    static final int DEFAULT_BUFFER_SIZE = 100;
    static final Duration DEFAULT_BUFFER_WINDOW = Duration.ofSeconds(1);
    static final int DEFAULT_MAX_BUFFER_SIZE = 10_000;
    static final Duration DEFAULT_COMMIT_RETRY_BACKOFF = Duration.ofMillis(100);
    static final Duration DEFAULT_MAX_COMMIT_RETRY_BACKOFF = Duration.ofSeconds(10);
    static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(30);
    static final Predicate<Throwable> DEFAULT_RETRIABLE_COMMIT_EXCEPTION = StreamOptions::isRetriableException;

    private final String streamId;
    private final Duration commitInterval;
    private final int commitBatchSize;
    private final AckMode ackMode;
    private final int bufferSize;
    private final Duration bufferWindow;
    private final int maxBufferSize;
    private final Duration commitRetryBackoff;
    private final Duration maxCommitRetryBackoff;
    private final Duration closeTimeout;
    private final List<StreamListener> listeners;
    private final Predicate<Throwable> retriableCommitException;

    ImmutableStreamOptions() {
        streamId = "reactor-kstream-" + COUNTER.incrementAndGet();
        commitInterval = DEFAULT_COMMIT_INTERVAL;
        commitBatchSize = 0;
        ackMode = AckMode.AUTO_ACK;
        bufferSize = DEFAULT_BUFFER_SIZE;
        bufferWindow = DEFAULT_BUFFER_WINDOW;
        maxBufferSize = DEFAULT_MAX_BUFFER_SIZE;
        commitRetryBackoff = DEFAULT_COMMIT_RETRY_BACKOFF;
        maxCommitRetryBackoff = DEFAULT_MAX_COMMIT_RETRY_BACKOFF;
        closeTimeout = DEFAULT_CLOSE_TIMEOUT;
        listeners = Collections.emptyList();
        retriableCommitException = DEFAULT_RETRIABLE_COMMIT_EXCEPTION;
    }

    ImmutableStreamOptions(
        String streamId,
        Duration commitInterval,
        int commitBatchSize,
        AckMode ackMode,
        int bufferSize,
        Duration bufferWindow,
        int maxBufferSize,
        Duration commitRetryBackoff,
        Duration maxCommitRetryBackoff,
        Duration closeTimeout,
        List<StreamListener> listeners,
        Predicate<Throwable> retriableCommitException
    ) {
        this.streamId = streamId;
        this.commitInterval = commitInterval;
        this.commitBatchSize = commitBatchSize;
        this.ackMode = ackMode;
        this.bufferSize = bufferSize;
        this.bufferWindow = bufferWindow;
        this.maxBufferSize = maxBufferSize;
        this.commitRetryBackoff = commitRetryBackoff;
        this.maxCommitRetryBackoff = maxCommitRetryBackoff;
        this.closeTimeout = closeTimeout;
        this.listeners = Collections.unmodifiableList(new ArrayList<>(listeners));
        this.retriableCommitException = retriableCommitException;
    }

    static StreamOptions fromProperties(Properties properties) {
        return fromProperties(
            properties
                .entrySet()
                .stream()
                .collect(Collectors.toMap(
                    e -> e.getKey().toString(),
                    Map.Entry::getValue
                ))
        );
    }

    static StreamOptions fromProperties(Map<String, ?> properties) {
        StreamOptions options = new ImmutableStreamOptions();
        // the ceiling goes first so that buffer.size is validated against the configured one
        Object maxBufferSize = properties.get(BUFFER_MAX_SIZE_CONFIG);
        if (maxBufferSize != null)
            options = options.maxBufferSize(intValue(BUFFER_MAX_SIZE_CONFIG, maxBufferSize));
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            switch (name) {
                case STREAM_ID_CONFIG:
                    options = options.streamId(String.valueOf(value));
                    break;
                case COMMIT_INTERVAL_MS_CONFIG:
                    options = options.commitInterval(Duration.ofMillis(longValue(name, value)));
                    break;
                case COMMIT_BATCH_SIZE_CONFIG:
                    options = options.commitBatchSize(intValue(name, value));
                    break;
                case ACK_MODE_CONFIG:
                    options = options.ackMode(ackModeValue(value));
                    break;
                case BUFFER_SIZE_CONFIG:
                    options = options.bufferSize(intValue(name, value));
                    break;
                case BUFFER_WINDOW_MS_CONFIG:
                    options = options.bufferWindow(Duration.ofMillis(longValue(name, value)));
                    break;
                case BUFFER_MAX_SIZE_CONFIG:
                    break;
                case COMMIT_RETRY_BACKOFF_MS_CONFIG:
                    options = options.commitRetryBackoff(Duration.ofMillis(longValue(name, value)));
                    break;
                case COMMIT_RETRY_BACKOFF_MAX_MS_CONFIG:
                    options = options.maxCommitRetryBackoff(Duration.ofMillis(longValue(name, value)));
                    break;
                case CLOSE_TIMEOUT_MS_CONFIG:
                    options = options.closeTimeout(Duration.ofMillis(longValue(name, value)));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown stream property " + name);
            }
        }
        return options;
    }

    @Override
    @NonNull
    public String streamId() {
        return streamId;
    }

    @Override
    @NonNull
    public StreamOptions streamId(@NonNull String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        if (streamId.isEmpty())
            throw new IllegalArgumentException("Stream id must not be empty");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public Duration commitInterval() {
        return commitInterval;
    }

    @Override
    @NonNull
    public StreamOptions commitInterval(@NonNull Duration commitInterval) {
        if (commitInterval == null || commitInterval.isNegative())
            throw new IllegalArgumentException("Commit interval must be >= 0");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    public int commitBatchSize() {
        return commitBatchSize;
    }

    @Override
    @NonNull
    public StreamOptions commitBatchSize(int commitBatchSize) {
        if (commitBatchSize < 0)
            throw new IllegalArgumentException("Commit batch size must be >= 0");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public AckMode ackMode() {
        return ackMode;
    }

    @Override
    @NonNull
    public StreamOptions ackMode(@NonNull AckMode ackMode) {
        Objects.requireNonNull(ackMode, "ackMode");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    public int bufferSize() {
        return bufferSize;
    }

    @Override
    @NonNull
    public StreamOptions bufferSize(int bufferSize) {
        validateBufferSize(bufferSize, maxBufferSize);
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public Duration bufferWindow() {
        return bufferWindow;
    }

    @Override
    @NonNull
    public StreamOptions bufferWindow(@NonNull Duration bufferWindow) {
        validatePositive(bufferWindow, "Buffer window");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    public int maxBufferSize() {
        return maxBufferSize;
    }

    @Override
    @NonNull
    public StreamOptions maxBufferSize(int maxBufferSize) {
        if (maxBufferSize <= 0)
            throw new IllegalArgumentException("Max buffer size must be > 0");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            Math.min(bufferSize, maxBufferSize),
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public Duration commitRetryBackoff() {
        return commitRetryBackoff;
    }

    @Override
    @NonNull
    public StreamOptions commitRetryBackoff(@NonNull Duration commitRetryBackoff) {
        validatePositive(commitRetryBackoff, "Commit retry backoff");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public Duration maxCommitRetryBackoff() {
        return maxCommitRetryBackoff;
    }

    @Override
    @NonNull
    public StreamOptions maxCommitRetryBackoff(@NonNull Duration maxCommitRetryBackoff) {
        validatePositive(maxCommitRetryBackoff, "Max commit retry backoff");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public Duration closeTimeout() {
        return closeTimeout;
    }

    @Override
    @NonNull
    public StreamOptions closeTimeout(@NonNull Duration closeTimeout) {
        if (closeTimeout == null || closeTimeout.isNegative())
            throw new IllegalArgumentException("Close timeout must be >= 0");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public List<StreamListener> listeners() {
        return listeners;
    }

    @Override
    @NonNull
    public Predicate<Throwable> retriableCommitException() {
        return retriableCommitException;
    }

    @Override
    @NonNull
    public StreamOptions addListener(@NonNull StreamListener listener) {
        Objects.requireNonNull(listener, "listener");
        List<StreamListener> listeners = new ArrayList<>(this.listeners);
        listeners.add(listener);
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public StreamOptions clearListeners() {
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            Collections.emptyList(),
            retriableCommitException
        );
    }

    @Override
    @NonNull
    public StreamOptions retriableCommitException(@NonNull Predicate<Throwable> retriableCommitException) {
        Objects.requireNonNull(retriableCommitException, "retriableCommitException");
        return new ImmutableStreamOptions(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException
        );
    }

    private static void validateBufferSize(int bufferSize, int maxBufferSize) {
        if (bufferSize <= 0)
            throw new IllegalArgumentException("Buffer size must be > 0");
        if (bufferSize > maxBufferSize)
            throw new IllegalArgumentException("Buffer size " + bufferSize + " exceeds max buffer size " + maxBufferSize);
    }

    private static void validatePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    private static long longValue(String name, Object value) {
        if (value instanceof Number)
            return ((Number) value).longValue();
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value " + value + " for " + name, e);
        }
    }

    private static int intValue(String name, Object value) {
        long longValue = longValue(name, value);
        if (longValue > Integer.MAX_VALUE || longValue < Integer.MIN_VALUE)
            throw new IllegalArgumentException("Invalid value " + value + " for " + name);
        return (int) longValue;
    }

    private static AckMode ackModeValue(Object value) {
        if (value instanceof AckMode)
            return (AckMode) value;
        String name = String.valueOf(value).trim().toUpperCase(Locale.ROOT);
        if (name.equals("NOACK") || name.equals("MANUAL"))
            return AckMode.MANUAL_ACK;
        if (name.equals("AUTO"))
            return AckMode.AUTO_ACK;
        try {
            return AckMode.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value " + value + " for " + ACK_MODE_CONFIG, e);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            streamId,
            commitInterval,
            commitBatchSize,
            ackMode,
            bufferSize,
            bufferWindow,
            maxBufferSize,
            commitRetryBackoff,
            maxCommitRetryBackoff,
            closeTimeout,
            listeners,
            retriableCommitException);
    }

    @Override
    public boolean equals(Object object) {
        if (object == this) return true;
        if (object != null && object.getClass().equals(getClass())) {
            ImmutableStreamOptions that = (ImmutableStreamOptions) object;
            return Objects.equals(streamId, that.streamId)
                && Objects.equals(commitInterval, that.commitInterval)
                && Objects.equals(commitBatchSize, that.commitBatchSize)
                && Objects.equals(ackMode, that.ackMode)
                && Objects.equals(bufferSize, that.bufferSize)
                && Objects.equals(bufferWindow, that.bufferWindow)
                && Objects.equals(maxBufferSize, that.maxBufferSize)
                && Objects.equals(commitRetryBackoff, that.commitRetryBackoff)
                && Objects.equals(maxCommitRetryBackoff, that.maxCommitRetryBackoff)
                && Objects.equals(closeTimeout, that.closeTimeout)
                && Objects.equals(listeners, that.listeners)
                && Objects.equals(retriableCommitException, that.retriableCommitException);
        }
        return false;
    }

    @Override
    public String toString() {
        return "StreamOptions(" +
            "streamId=" + streamId +
            ", commitInterval=" + commitInterval +
            ", commitBatchSize=" + commitBatchSize +
            ", ackMode=" + ackMode +
            ", bufferSize=" + bufferSize +
            ", bufferWindow=" + bufferWindow +
            ", maxBufferSize=" + maxBufferSize +
            ", commitRetryBackoff=" + commitRetryBackoff +
            ", maxCommitRetryBackoff=" + maxCommitRetryBackoff +
            ", closeTimeout=" + closeTimeout +
            ", listeners=" + listeners +
            ")";
    }
}
