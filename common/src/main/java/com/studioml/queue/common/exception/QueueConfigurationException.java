/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.common.exception;

/**
 * No broker URL is available, so nothing can be sent.
 */
public class QueueConfigurationException extends QueueException {
    public QueueConfigurationException(String message) {
        super("RMQ_CONFIGURATION", message);
    }

    public QueueConfigurationException(String message, Throwable cause) {
        super("RMQ_CONFIGURATION", message, cause);
    }
}
