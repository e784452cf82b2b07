/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.common.exception;

public class PublishUnconfirmedException extends QueueException {
    private final long sequenceNumber;

    public PublishUnconfirmedException(long sequenceNumber, String url, int retries) {
        super("RMQ_PUBLISH_UNCONFIRMED",
              "Message " + sequenceNumber + " was never confirmed by " + url
                      + " after " + retries + " attempts");
        this.sequenceNumber = sequenceNumber;
    }

    public long getSequenceNumber() { return sequenceNumber; }
}
