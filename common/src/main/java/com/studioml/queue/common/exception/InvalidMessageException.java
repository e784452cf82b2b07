/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.common.exception;

public class InvalidMessageException extends QueueException {
    public InvalidMessageException(String message) {
        super("RMQ_INVALID_MESSAGE", message);
    }
}
