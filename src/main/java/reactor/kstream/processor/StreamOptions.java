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

import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.apache.kafka.common.errors.RetriableException;
import reactor.util.annotation.NonNull;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Predicate;

/**
 * Configuration of an {@link EventStream}. Instances are immutable: every wither
 * returns a new instance.
 */
public interface StreamOptions {

    String STREAM_ID_CONFIG = "stream.id";
    String COMMIT_INTERVAL_MS_CONFIG = "commit.interval.ms";
    String COMMIT_BATCH_SIZE_CONFIG = "commit.batch.size";
    String ACK_MODE_CONFIG = "ack.mode";
    String BUFFER_SIZE_CONFIG = "buffer.size";
    String BUFFER_WINDOW_MS_CONFIG = "buffer.window.ms";
    String BUFFER_MAX_SIZE_CONFIG = "buffer.max.size";
    String COMMIT_RETRY_BACKOFF_MS_CONFIG = "commit.retry.backoff.ms";
    String COMMIT_RETRY_BACKOFF_MAX_MS_CONFIG = "commit.retry.backoff.max.ms";
    String CLOSE_TIMEOUT_MS_CONFIG = "close.timeout.ms";

    /**
     * Creates an options instance with default values.
     * @return new instance of stream options
     */
    @NonNull
    static StreamOptions create() {
        return new ImmutableStreamOptions();
    }

    /**
     * Creates an options instance from configuration properties. Keys are the
     * <code>*_CONFIG</code> constants of this interface; unknown keys are rejected.
     * @return new instance of stream options
     */
    @NonNull
    static StreamOptions create(@NonNull Map<String, ?> configProperties) {
        return ImmutableStreamOptions.fromProperties(configProperties);
    }

    /**
     * Creates an options instance from configuration properties.
     * @return new instance of stream options
     * @see #create(Map)
     */
    @NonNull
    static StreamOptions create(@NonNull Properties configProperties) {
        return ImmutableStreamOptions.fromProperties(configProperties);
    }

    /**
     * Returns the identifier used in thread names and log messages.
     * @return stream id
     */
    @NonNull
    String streamId();

    @NonNull
    StreamOptions streamId(@NonNull String streamId);

    /**
     * Returns the interval between periodic commit passes.
     * @return commit interval, zero if periodic commits are disabled
     */
    @NonNull
    Duration commitInterval();

    /**
     * Configures the interval between periodic commit passes. Commit passes run
     * independently of the processing rate. If <code>commitInterval</code> is zero,
     * offsets are only committed by {@link EventStream#commit()}, when the commit batch
     * size is reached and when the stream is closed.
     * @return options instance with new commit interval
     */
    @NonNull
    StreamOptions commitInterval(@NonNull Duration commitInterval);

    /**
     * Returns the number of acknowledgments after which a commit pass is scheduled early.
     * @return commit batch size, zero if disabled
     */
    int commitBatchSize();

    @NonNull
    StreamOptions commitBatchSize(int commitBatchSize);

    /**
     * Returns the acknowledgment mode of streams created with these options.
     * @return default acknowledgment mode
     */
    @NonNull
    AckMode ackMode();

    @NonNull
    StreamOptions ackMode(@NonNull AckMode ackMode);

    /**
     * Returns the batch size used by {@link EventStream#take()}.
     * @return default buffer size
     */
    int bufferSize();

    @NonNull
    StreamOptions bufferSize(int bufferSize);

    /**
     * Returns the batch window used by {@link EventStream#take()}.
     * @return default buffer window
     */
    @NonNull
    Duration bufferWindow();

    @NonNull
    StreamOptions bufferWindow(@NonNull Duration bufferWindow);

    /**
     * Returns the largest batch size accepted by {@link EventStream#take(int, Duration)}.
     * Batch acknowledgment is linear in the batch size, and every event of a batch is
     * processed again if the application crashes before the batch is acknowledged.
     * @return buffer size ceiling
     */
    int maxBufferSize();

    /**
     * Configures the largest accepted batch size. The default buffer size is lowered to
     * <code>maxBufferSize</code> if it is larger.
     * @return options instance with new buffer size ceiling
     */
    @NonNull
    StreamOptions maxBufferSize(int maxBufferSize);

    /**
     * Returns the delay before the first retry of a failed commit. Each further
     * consecutive failure doubles the delay, up to {@link #maxCommitRetryBackoff()}.
     * @return initial commit retry backoff
     */
    @NonNull
    Duration commitRetryBackoff();

    @NonNull
    StreamOptions commitRetryBackoff(@NonNull Duration commitRetryBackoff);

    @NonNull
    Duration maxCommitRetryBackoff();

    @NonNull
    StreamOptions maxCommitRetryBackoff(@NonNull Duration maxCommitRetryBackoff);

    /**
     * Returns the maximum time to wait for the background filler when a cursor is closed.
     * @return close timeout
     */
    @NonNull
    Duration closeTimeout();

    @NonNull
    StreamOptions closeTimeout(@NonNull Duration closeTimeout);

    /**
     * Returns the listeners notified of engine events.
     * @return stream listeners
     */
    @NonNull
    List<StreamListener> listeners();

    @NonNull
    StreamOptions addListener(@NonNull StreamListener listener);

    @NonNull
    StreamOptions clearListeners();

    /**
     * Returns the predicate deciding whether a commit failure is transient. Transient
     * failures are logged at <code>WARN</code>, others at <code>ERROR</code>; both are
     * retried with backoff.
     * @return retriable commit exception predicate
     */
    @NonNull
    Predicate<Throwable> retriableCommitException();

    @NonNull
    StreamOptions retriableCommitException(@NonNull Predicate<Throwable> retriableCommitException);

    /**
     * The default retriable commit exception predicate.
     * @param t commit failure
     * @return true for kafka retriable exceptions and rebalances in progress
     */
    static boolean isRetriableException(Throwable t) {
        return t instanceof RetriableException || t instanceof RebalanceInProgressException;
    }
}
