/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.config;

import com.studioml.queue.common.config.QueueConfigLoader;
import com.studioml.queue.messaging.core.DistributedQueue;
import com.studioml.queue.messaging.rabbitmq.RabbitMQQueue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Builds and starts {@link DistributedQueue} instances from an explicit URL or a configuration tree.
 */
public final class QueueFactory {

    private QueueFactory() {}

    public static DistributedQueue create(String queue, String routingKey, String amqpUrl) {
        return start(new RabbitMQQueue(queue, routingKey, amqpUrl));
    }

    public static DistributedQueue create(String queue, String routingKey, Map<String, Object> config) {
        return start(new RabbitMQQueue(queue, routingKey, null, config));
    }

    /** Load a JSON configuration file and create a queue from its {@code cloud.queue} section. */
    public static DistributedQueue fromFile(Path configFile, String queue, String routingKey) throws IOException {
        return create(queue, routingKey, QueueConfigLoader.load(configFile));
    }

    private static DistributedQueue start(DistributedQueue queue) {
        queue.start();
        return queue;
    }
}
