/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

/**
 * A published message awaiting its broker confirmation, tied to the connection cycle it was sent in.
 */
public record PendingDelivery(DeliveryEpoch epoch, long sequenceNumber) {}
