/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

/**
 * Snapshot of the publish bookkeeping for the current connection cycle.
 */
public record DeliveryStats(long published, int pending, long acked, long nacked) {}
