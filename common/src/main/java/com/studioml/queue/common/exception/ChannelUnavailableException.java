/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.common.exception;

/**
 * The broker channel did not become ready for publishing within the retry budget,
 * or was lost while a publish was being handed to it.
 */
public class ChannelUnavailableException extends QueueException {
    public ChannelUnavailableException(String url, int retries) {
        super("RMQ_CHANNEL_UNAVAILABLE",
              "Channel to " + url + " was not ready after " + retries + " attempts");
    }

    public ChannelUnavailableException(String message) {
        super("RMQ_CHANNEL_UNAVAILABLE", message);
    }

    public ChannelUnavailableException(String message, Throwable cause) {
        super("RMQ_CHANNEL_UNAVAILABLE", message, cause);
    }
}
