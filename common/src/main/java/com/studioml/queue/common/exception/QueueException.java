/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.common.exception;

/**
 * Unchecked root of every error the blocking queue facade reports to its callers.
 *
 * <p>Broker trouble inside the connection loop is retried and never surfaces here; callers only
 * see the failure of their own call, one subclass per kind. The {@link #getErrorCode() error code}
 * is a stable {@code RMQ_*} string that callers can log or branch on.</p>
 */
public class QueueException extends RuntimeException {
    private final String errorCode;

    public QueueException(String message) {
        super(message);
        this.errorCode = "RMQ_GENERIC";
    }

    public QueueException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public QueueException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
