/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.common.exception;

/**
 * Raised by operations a broker-backed queue cannot honour the way a local queue would.
 */
public class UnsupportedQueueOperationException extends QueueException {
    public UnsupportedQueueOperationException(String operation) {
        super("RMQ_UNSUPPORTED",
              "using " + operation + " with a distributed queue is not supportable");
    }
}
