/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

/**
 * Channel handshake progress. States are entered strictly in declaration order from
 * {@link #OPENING} to {@link #READY}; any failure drops back to {@link #NONE}.
 */
public enum ChannelState {
    NONE,
    OPENING,
    EXCHANGE_DECLARING,
    QUEUE_DECLARING,
    BINDING,
    CONFIRM_ENABLING,
    READY,
    CLOSED;

    public boolean isReady() { return this == READY; }
}
