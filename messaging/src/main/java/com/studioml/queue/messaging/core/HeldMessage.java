/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The single inbound message a queue instance holds unacknowledged: the raw body, the broker
 * delivery tag used to acknowledge it, and the connection epoch it arrived in. A delivery tag is
 * only meaningful on the channel that issued it, so acknowledgements from an older epoch are not
 * sent to the broker.
 */
public final class HeldMessage {

    private final byte[] body;
    private final long deliveryTag;
    private final DeliveryEpoch epoch;

    public HeldMessage(byte[] body, long deliveryTag, DeliveryEpoch epoch) {
        this.body = body != null ? body.clone() : new byte[0];
        this.deliveryTag = deliveryTag;
        this.epoch = epoch;
    }

    public byte[] getBody() { return body.clone(); }
    public String getBodyAsString() { return new String(body, StandardCharsets.UTF_8); }
    public long getDeliveryTag() { return deliveryTag; }
    public DeliveryEpoch getEpoch() { return epoch; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeldMessage other)) return false;
        return deliveryTag == other.deliveryTag && epoch == other.epoch && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(deliveryTag) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "HeldMessage{deliveryTag=" + deliveryTag + ", epoch=" + (epoch != null ? epoch.getId() : "-")
                + ", bytes=" + body.length + "}";
    }
}
