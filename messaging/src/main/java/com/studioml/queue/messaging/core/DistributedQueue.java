/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocking work-queue view over a broker-backed queue.
 *
 * <p>At most one inbound message is held at a time: {@link #dequeue(int)} keeps returning the same
 * message until it is {@link #acknowledge(HeldMessage) acknowledged}. Timeouts and retry budgets
 * are counted in time units (one second unless configured otherwise).</p>
 *
 * <p>Methods must not be called from broker callback threads.</p>
 */
public interface DistributedQueue extends AutoCloseable {

    int DEFAULT_RETRIES = 10;

    /** Start the background connection loop. */
    void start();

    /** Name of the underlying broker queue. */
    String getName();

    /** Publish a message and wait for its confirmation. Returns the message sequence number. */
    long enqueue(String message, int retries);

    default long enqueue(String message) {
        return enqueue(message, DEFAULT_RETRIES);
    }

    /** Wait up to {@code timeout} time units for a message. Empty means none arrived. */
    Optional<HeldMessage> dequeue(int timeout);

    default Optional<HeldMessage> dequeue() {
        return dequeue(0);
    }

    /**
     * Release the held message and acknowledge it on the broker. The broker ack is skipped when the
     * message arrived on a channel that has since been replaced; the broker redelivers it.
     */
    void acknowledge(HeldMessage message);

    /** Acknowledge and discard messages until a dequeue times out. */
    void clean(int timeout);

    /** Keep the message unacknowledged. Redelivery delays are not supported. */
    void hold(HeldMessage message, int minutes);

    /** Not supported for a distributed queue. */
    void delete();

    /** Not supported for a distributed queue. */
    boolean hasNext();

    /** Request shutdown. Returns immediately. */
    void stop();

    /** Wait for the background loop to finish after {@link #stop()}. */
    boolean awaitTermination(Duration timeout);

    DeliveryStats getDeliveryStats();

    @Override
    default void close() {
        stop();
    }
}
