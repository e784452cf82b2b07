/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks outbound messages awaiting publisher confirmation.
 *
 * <p>Sequence numbers start at 1 in every {@link DeliveryEpoch} and match the delivery tags the
 * broker uses in its confirmations, because each connection carries exactly one confirm-mode
 * channel. All state is guarded by the shared bookkeeping lock; waiting callers are woken through a
 * condition on that lock whenever a confirmation lands or the epoch is replaced.</p>
 */
public class DeliveryTracker {

    private static final Logger log = LoggerFactory.getLogger(DeliveryTracker.class);

    private final ReentrantLock lock;
    private final Condition changed;
    private DeliveryEpoch epoch = new DeliveryEpoch();

    public DeliveryTracker(ReentrantLock bookkeepingLock) {
        this.lock = bookkeepingLock;
        this.changed = bookkeepingLock.newCondition();
    }

    /**
     * Start a new connection cycle. Everything pending in the previous epoch is dropped.
     */
    public DeliveryEpoch reset() {
        lock.lock();
        try {
            DeliveryEpoch previous = epoch;
            epoch = new DeliveryEpoch();
            if (previous.snapshot().pending() > 0) {
                log.info("Discarding {} unconfirmed deliveries from epoch {}",
                        previous.snapshot().pending(), previous.getId());
            }
            changed.signalAll();
            return epoch;
        } finally {
            lock.unlock();
        }
    }

    public DeliveryEpoch currentEpoch() {
        lock.lock();
        try {
            return epoch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Assign the next sequence number and mark it pending. Must be called right before the message
     * is handed to the channel, in publish order.
     */
    public PendingDelivery recordPublish() {
        lock.lock();
        try {
            return new PendingDelivery(epoch, epoch.nextSequence());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forget a sequence number whose publish never reached the channel.
     */
    public void withdraw(PendingDelivery delivery) {
        lock.lock();
        try {
            delivery.epoch().withdraw(delivery.sequenceNumber());
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply a broker confirmation. Confirmations from a replaced epoch are ignored.
     *
     * @throws IllegalStateException if a single-tag confirmation names a tag that is not pending
     */
    public void recordConfirmation(DeliveryEpoch source, long tag, boolean multiple, boolean positive) {
        lock.lock();
        try {
            if (source != epoch) {
                log.debug("Ignoring {} for tag {} from stale epoch {}", positive ? "ack" : "nack", tag,
                        source.getId());
                return;
            }
            epoch.confirm(tag, multiple, positive);
            if (!positive) {
                log.warn("Broker nacked delivery tag {} (multiple={})", tag, multiple);
            }
            DeliveryStats stats = epoch.snapshot();
            log.info("published {} messages, {} have yet to be confirmed, {} were acked and {} were nacked",
                    stats.published(), stats.pending(), stats.acked(), stats.nacked());
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPending(PendingDelivery delivery) {
        lock.lock();
        try {
            return delivery.epoch() == epoch && epoch.isPending(delivery.sequenceNumber());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until {@code delivery} has been confirmed (positively or negatively).
     *
     * @return {@code true} once confirmed; {@code false} on timeout, interruption, or when the epoch
     *         was replaced before the confirmation arrived. A timed-out delivery stays pending.
     */
    public boolean awaitConfirmation(PendingDelivery delivery, Duration timeout) {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                if (delivery.epoch() != epoch) return false;
                if (!epoch.isPending(delivery.sequenceNumber())) return true;
                if (nanos <= 0) return false;
                nanos = changed.awaitNanos(nanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    public DeliveryStats stats() {
        lock.lock();
        try {
            return epoch.snapshot();
        } finally {
            lock.unlock();
        }
    }
}
