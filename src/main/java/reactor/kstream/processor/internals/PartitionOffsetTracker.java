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
import reactor.kstream.processor.errors.OutOfOrderDeliveryException;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ledger of the offsets of one partition that were delivered to the application
 * and of those that were acknowledged. The committable offset is the highest
 * offset such that every delivered offset up to and including it was acknowledged.
 * <p>
 * Pending offsets are kept in delivery order, which is offset order. Acknowledging
 * the oldest pending offset pops the contiguous acknowledged prefix, so the
 * committable offset is maintained with amortized constant work per acknowledgment.
 * <p>
 * Methods are synchronized: the ledger is updated by the consuming thread of its
 * partition and read by commit passes.
 */
public final class PartitionOffsetTracker {

    public static final long NO_OFFSET = -1L;

    private static final Logger log = LoggerFactory.getLogger(PartitionOffsetTracker.class);

    private final TopicPartition topicPartition;

    /** Delivered offsets not yet part of the committable prefix, mapped to their acknowledged flag. */
    private final LinkedHashMap<Long, Boolean> pending = new LinkedHashMap<>();

    private long lastDelivered = NO_OFFSET;

    private long committable = NO_OFFSET;

    private long committed = NO_OFFSET;

    private boolean revoked;

    private OutOfOrderDeliveryException failure;

    public PartitionOffsetTracker(TopicPartition topicPartition) {
        this.topicPartition = topicPartition;
    }

    public TopicPartition topicPartition() {
        return topicPartition;
    }

    /**
     * Records that the event at <code>offset</code> was handed to the application.
     * Delivering the last delivered offset again is ignored.
     *
     * @param offset delivered offset
     * @throws OutOfOrderDeliveryException if <code>offset</code> is lower than the last delivered
     *         offset, or if an earlier delivery already broke the ordering
     */
    public synchronized void deliver(long offset) {
        if (failure != null)
            throw failure;
        if (revoked)
            return;
        if (offset < lastDelivered) {
            failure = new OutOfOrderDeliveryException(topicPartition, offset, lastDelivered);
            log.error("Partition {} failed", topicPartition, failure);
            throw failure;
        }
        if (offset == lastDelivered) {
            log.debug("Ignoring repeated delivery of {}@{}", topicPartition, offset);
            return;
        }
        lastDelivered = offset;
        pending.put(offset, Boolean.FALSE);
    }

    /**
     * Marks <code>offset</code> as processed.
     *
     * @param offset acknowledged offset
     * @return true if the ledger changed, false for redundant acknowledgments, offsets
     *         that were never delivered and acknowledgments after revocation
     */
    public synchronized boolean acknowledge(long offset) {
        if (revoked) {
            log.debug("Ignoring acknowledgment of {}@{}, partition revoked", topicPartition, offset);
            return false;
        }
        if (offset <= committable)
            return false;
        Boolean acknowledged = pending.get(offset);
        if (acknowledged == null) {
            log.warn("Ignoring acknowledgment of {}@{} which was never delivered", topicPartition, offset);
            return false;
        }
        if (acknowledged)
            return false;
        pending.put(offset, Boolean.TRUE);
        advance();
        return true;
    }

    private void advance() {
        Iterator<Map.Entry<Long, Boolean>> iterator = pending.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Long, Boolean> oldest = iterator.next();
            if (!oldest.getValue())
                break;
            committable = oldest.getKey();
            iterator.remove();
        }
    }

    /**
     * Returns the highest offset that may be committed.
     * @return committable offset, {@link #NO_OFFSET} if there is no progress
     */
    public synchronized long committable() {
        return committable;
    }

    /**
     * Returns the committable offset if it has not been committed yet.
     * @return offset to commit, {@link #NO_OFFSET} if there is nothing new or the partition was revoked
     */
    public synchronized long uncommitted() {
        if (revoked || committable <= committed)
            return NO_OFFSET;
        return committable;
    }

    /**
     * Records a successful commit of <code>offset</code>.
     * @param offset committed offset
     */
    public synchronized void committed(long offset) {
        if (offset > committed)
            committed = offset;
    }

    public synchronized long lastCommitted() {
        return committed;
    }

    public synchronized long lastDelivered() {
        return lastDelivered;
    }

    /**
     * Returns the number of delivered offsets that are not part of the committable prefix.
     * @return pending offset count
     */
    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Discards all state without committing. Further deliveries and acknowledgments are ignored.
     */
    public synchronized void revoke() {
        revoked = true;
        pending.clear();
        committable = NO_OFFSET;
    }

    public synchronized boolean isRevoked() {
        return revoked;
    }

    @Override
    public synchronized String toString() {
        return topicPartition + "(committable=" + committable + ", committed=" + committed +
            ", pending=" + pending.size() + (revoked ? ", revoked" : "") + ")";
    }
}
