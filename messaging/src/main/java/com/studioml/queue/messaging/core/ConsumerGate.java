/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-state slot ({@code empty} / {@code holding}) for the one unacknowledged inbound message.
 *
 * <p>The first delivery offered to an empty gate is kept; anything offered while a message is held
 * is refused so the caller can requeue it on the broker. Transitions use compare-and-set, under the
 * shared bookkeeping lock so that waiting consumers can be signalled.</p>
 */
public class ConsumerGate {

    private final AtomicReference<HeldMessage> held = new AtomicReference<>();
    private final ReentrantLock lock;
    private final Condition filled;

    public ConsumerGate(ReentrantLock bookkeepingLock) {
        this.lock = bookkeepingLock;
        this.filled = bookkeepingLock.newCondition();
    }

    /**
     * @return {@code true} if the gate was empty and now holds {@code message}
     */
    public boolean offer(HeldMessage message) {
        lock.lock();
        try {
            boolean accepted = held.compareAndSet(null, message);
            if (accepted) filled.signalAll();
            return accepted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empty the gate unconditionally.
     *
     * @return the message that was held, if any
     */
    public Optional<HeldMessage> clear() {
        lock.lock();
        try {
            return Optional.ofNullable(held.getAndSet(null));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empty the gate on behalf of {@code message}. A message held from a newer epoch is kept, since
     * it is still unacknowledged on the current channel.
     *
     * @return {@code false} if a newer message was kept
     */
    public boolean release(HeldMessage message) {
        lock.lock();
        try {
            HeldMessage current = held.get();
            if (current != null && current.getEpoch() != message.getEpoch()) return false;
            held.set(null);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isHolding() {
        return held.get() != null;
    }

    public Optional<HeldMessage> peek() {
        return Optional.ofNullable(held.get());
    }

    /**
     * Wait up to {@code timeout} for the gate to hold a message. The message stays held.
     */
    public Optional<HeldMessage> await(Duration timeout) {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            HeldMessage current;
            while ((current = held.get()) == null && nanos > 0) {
                nanos = filled.awaitNanos(nanos);
            }
            return Optional.ofNullable(current);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.ofNullable(held.get());
        } finally {
            lock.unlock();
        }
    }
}
