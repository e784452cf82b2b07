/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publish bookkeeping for one connection cycle: the sequence counter, the set of sequence numbers
 * still waiting for a confirmation, and the ack/nack totals.
 *
 * <p>A new epoch replaces the old one wholesale each time a connection attempt starts, since
 * delivery tags do not carry over between connections. Instances are not thread-safe; every access
 * goes through {@link DeliveryTracker} under its lock.</p>
 */
public final class DeliveryEpoch {

    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final NavigableSet<Long> pending = new TreeSet<>();
    private long published;
    private long acked;
    private long nacked;

    public long getId() { return id; }

    long nextSequence() {
        published++;
        pending.add(published);
        return published;
    }

    boolean isPending(long sequenceNumber) {
        return pending.contains(sequenceNumber);
    }

    void withdraw(long sequenceNumber) {
        pending.remove(sequenceNumber);
    }

    /**
     * Remove confirmed tags and count them.
     *
     * @return number of tags removed
     * @throws IllegalStateException if a single-tag confirmation names a tag that is not pending
     */
    int confirm(long tag, boolean multiple, boolean positive) {
        int removed;
        if (multiple) {
            NavigableSet<Long> confirmed = pending.headSet(tag, true);
            removed = confirmed.size();
            confirmed.clear();
        } else {
            if (!pending.remove(tag)) {
                throw new IllegalStateException("Confirmation for unknown delivery tag " + tag
                        + " in epoch " + id);
            }
            removed = 1;
        }
        if (positive) acked += removed; else nacked += removed;
        return removed;
    }

    DeliveryStats snapshot() {
        return new DeliveryStats(published, pending.size(), acked, nacked);
    }

    @Override
    public String toString() {
        return "DeliveryEpoch{id=" + id + ", published=" + published + ", pending=" + pending.size()
                + ", acked=" + acked + ", nacked=" + nacked + "}";
    }
}
