/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

/**
 * Lifecycle states of the single broker connection owned by the supervisor.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    OPEN,
    CLOSING
}
