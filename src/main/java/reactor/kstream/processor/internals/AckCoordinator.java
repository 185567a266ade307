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
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Scheduler;
import reactor.kstream.AssignmentListener;
import reactor.kstream.Committer;
import reactor.kstream.Event;
import reactor.kstream.processor.StreamListener;
import reactor.kstream.processor.StreamOptions;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Owns the offset trackers of the assigned partitions and commits their committable
 * offsets. Commit passes run periodically on the commit scheduler, early when the
 * commit batch size is reached, on demand, and once more when the coordinator stops.
 * Passes are serialized; a periodic tick finding a pass in flight is skipped.
 * <p>
 * A failed commit is never reported to the processing path. The partition is retried
 * by a later pass once its backoff has expired.
 */
public class AckCoordinator implements AssignmentListener {

    private static final Logger log = LoggerFactory.getLogger(AckCoordinator.class);

    private final Committer committer;

    private final StreamOptions options;

    private final StreamListener listener;

    private final Scheduler commitScheduler;

    private final LongSupplier nanoClock;

    final Map<TopicPartition, PartitionState> partitions = new ConcurrentHashMap<>();

    private final Set<TopicPartition> revokedPartitions = ConcurrentHashMap.newKeySet();

    private final ReentrantLock commitLock = new ReentrantLock();

    private final AtomicBoolean started = new AtomicBoolean();

    private final AtomicBoolean stopped = new AtomicBoolean();

    private final AtomicBoolean isPending = new AtomicBoolean();

    private final AtomicInteger uncommittedAcks = new AtomicInteger();

    private volatile Disposable periodicCommitDisposable = Disposables.disposed();

    public AckCoordinator(Committer committer, StreamOptions options, StreamListener listener, Scheduler commitScheduler) {
        this(committer, options, listener, commitScheduler, System::nanoTime);
    }

    AckCoordinator(Committer committer, StreamOptions options, StreamListener listener, Scheduler commitScheduler,
                   LongSupplier nanoClock) {
        this.committer = committer;
        this.options = options;
        this.listener = listener;
        this.commitScheduler = commitScheduler;
        this.nanoClock = nanoClock;
    }

    /**
     * Starts periodic commit passes, unless the commit interval is zero.
     */
    public void start() {
        if (!started.compareAndSet(false, true))
            return;
        Duration commitInterval = options.commitInterval();
        if (!commitInterval.isZero()) {
            periodicCommitDisposable = commitScheduler.schedulePeriodically(
                this::commitIfIdle,
                commitInterval.toMillis(),
                commitInterval.toMillis(),
                TimeUnit.MILLISECONDS
            );
        }
        log.debug("Started commits of {} every {}", options.streamId(), commitInterval);
    }

    /**
     * Records the delivery of <code>event</code> against the tracker of its partition.
     * @return the tracker that recorded the delivery
     */
    PartitionOffsetTracker deliver(Event<?, ?> event) {
        PartitionOffsetTracker tracker = trackerFor(event.topicPartition());
        tracker.deliver(event.offset());
        listener.onDelivered(event);
        return tracker;
    }

    private PartitionOffsetTracker trackerFor(TopicPartition topicPartition) {
        PartitionState state = partitions.get(topicPartition);
        if (state != null)
            return state.tracker;
        if (revokedPartitions.contains(topicPartition)) {
            log.debug("Event of revoked partition {} will not be committed", topicPartition);
            PartitionOffsetTracker detached = new PartitionOffsetTracker(topicPartition);
            detached.revoke();
            return detached;
        }
        return partitions.computeIfAbsent(topicPartition, tp -> {
            log.debug("Tracking partition {} without assignment", tp);
            return new PartitionState(new PartitionOffsetTracker(tp));
        }).tracker;
    }

    void acknowledge(PartitionOffsetTracker tracker, long offset) {
        if (!tracker.acknowledge(offset))
            return;
        listener.onAcknowledged(tracker.topicPartition(), offset);
        int commitBatchSize = options.commitBatchSize();
        if (commitBatchSize > 0 && uncommittedAcks.incrementAndGet() >= commitBatchSize)
            scheduleCommit();
    }

    @Override
    public void assigned(Collection<TopicPartition> assigned) {
        log.debug("assigned {}", assigned);
        for (TopicPartition topicPartition : assigned) {
            revokedPartitions.remove(topicPartition);
            partitions.putIfAbsent(topicPartition, new PartitionState(new PartitionOffsetTracker(topicPartition)));
        }
        listener.onAssigned(assigned);
    }

    @Override
    public void revoked(Collection<TopicPartition> revoked) {
        log.debug("revoked {}", revoked);
        for (TopicPartition topicPartition : revoked) {
            revokedPartitions.add(topicPartition);
            PartitionState state = partitions.remove(topicPartition);
            if (state != null) {
                long lost = state.tracker.uncommitted();
                state.tracker.revoke();
                if (lost != PartitionOffsetTracker.NO_OFFSET)
                    log.info("Discarded uncommitted offset {} of revoked partition {}", lost, topicPartition);
            }
        }
        listener.onRevoked(revoked);
    }

    /**
     * Schedules a commit pass on the commit scheduler, unless one is already scheduled.
     */
    void scheduleCommit() {
        if (started.get() && !stopped.get() && isPending.compareAndSet(false, true)) {
            commitScheduler.schedule(() -> {
                isPending.set(false);
                commitIfIdle();
            });
        }
    }

    void commitIfIdle() {
        if (!commitLock.tryLock()) {
            log.trace("Commit pass in progress, skipping");
            return;
        }
        try {
            commitPass(false);
        } finally {
            commitLock.unlock();
        }
    }

    /**
     * Runs a commit pass on the calling thread, waiting for a pass in flight to complete.
     * Partitions waiting for a retry are committed without waiting for their backoff.
     */
    public void commitNow() {
        commitLock.lock();
        try {
            commitPass(true);
        } finally {
            commitLock.unlock();
        }
    }

    private void commitPass(boolean ignoreBackoff) {
        uncommittedAcks.set(0);
        long now = nanoClock.getAsLong();
        Map<PartitionState, Long> due = new LinkedHashMap<>();
        for (PartitionState state : partitions.values()) {
            long offset = state.tracker.uncommitted();
            if (offset == PartitionOffsetTracker.NO_OFFSET)
                continue;
            if (!ignoreBackoff && state.consecutiveFailures > 0 && now - state.retryAtNanos < 0)
                continue;
            due.put(state, offset);
        }
        for (Map.Entry<PartitionState, Long> entry : due.entrySet()) {
            PartitionState state = entry.getKey();
            long offset = entry.getValue();
            PartitionOffsetTracker tracker = state.tracker;
            TopicPartition topicPartition = tracker.topicPartition();
            // revoked while earlier partitions of this pass were committed
            if (tracker.isRevoked()) {
                log.debug("Skipping commit of revoked partition {}", topicPartition);
                continue;
            }
            try {
                committer.commit(topicPartition, offset);
                tracker.committed(offset);
                state.consecutiveFailures = 0;
                log.trace("Committed {}@{}", topicPartition, offset);
                listener.onCommitted(topicPartition, offset);
            } catch (Exception e) {
                handleFailure(state, offset, e, now);
            }
        }
    }

    private void handleFailure(PartitionState state, long offset, Exception exception, long now) {
        state.consecutiveFailures++;
        long backoffMillis = backoffMillis(state.consecutiveFailures);
        state.retryAtNanos = now + TimeUnit.MILLISECONDS.toNanos(backoffMillis);
        TopicPartition topicPartition = state.tracker.topicPartition();
        if (options.retriableCommitException().test(exception)) {
            log.warn("Commit of {}@{} failed with exception {}, attempt {}, retrying in {} ms", topicPartition,
                offset, exception, state.consecutiveFailures, backoffMillis);
        } else {
            log.error("Commit of {}@{} failed, attempt {}, retrying in {} ms", topicPartition, offset,
                state.consecutiveFailures, backoffMillis, exception);
        }
        listener.onCommitFailed(topicPartition, offset, exception);
    }

    long backoffMillis(int consecutiveFailures) {
        long initial = options.commitRetryBackoff().toMillis();
        long max = Math.max(initial, options.maxCommitRetryBackoff().toMillis());
        int shift = Math.min(consecutiveFailures - 1, 30);
        long backoff = initial << shift;
        return backoff < 0 || backoff > max ? max : backoff;
    }

    /**
     * Returns the committable offset of every tracked partition.
     */
    public Map<TopicPartition, Long> committableOffsets() {
        Map<TopicPartition, Long> offsets = new HashMap<>();
        partitions.forEach((tp, state) -> offsets.put(tp, state.tracker.committable()));
        return offsets;
    }

    /**
     * Cancels periodic commits and runs a final commit pass.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true))
            return;
        periodicCommitDisposable.dispose();
        log.debug("Final commit of {}", options.streamId());
        commitNow();
    }

    boolean isStopped() {
        return stopped.get();
    }

    static final class PartitionState {

        final PartitionOffsetTracker tracker;

        // guarded by commitLock
        int consecutiveFailures;

        long retryAtNanos;

        PartitionState(PartitionOffsetTracker tracker) {
            this.tracker = tracker;
        }
    }
}
