/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.core;

import java.util.Objects;

/**
 * The one exchange / queue / routing-key binding a queue instance manages. Immutable for the
 * lifetime of the instance.
 *
 * <p>The exchange is declared durable and auto-delete together: it survives a broker restart
 * but disappears once its last queue is unbound.</p>
 */
public record BindingConfig(String exchange, String exchangeType, boolean durable, boolean autoDelete,
                            String queue, String routingKey) {

    public static final String STUDIOML_EXCHANGE = "StudioML.topic";
    public static final String TOPIC = "topic";

    public BindingConfig {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(exchangeType, "exchangeType");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(routingKey, "routingKey");
    }

    /** Binding of {@code queue} to the shared StudioML topic exchange. */
    public static BindingConfig studioml(String queue, String routingKey) {
        return new BindingConfig(STUDIOML_EXCHANGE, TOPIC, true, true, queue, routingKey);
    }
}
