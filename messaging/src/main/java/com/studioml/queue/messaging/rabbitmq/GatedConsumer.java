/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;

/**
 * Broker consumer that forwards deliveries to the event loop, where {@link ChannelManager} decides
 * whether the message becomes the held message or is requeued.
 */
final class GatedConsumer extends DefaultConsumer {

    private final ChannelManager manager;
    private final BrokerEventLoop loop;

    GatedConsumer(Channel channel, ChannelManager manager, BrokerEventLoop loop) {
        super(channel);
        this.manager = manager;
        this.loop = loop;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                               byte[] body) {
        Channel ch = getChannel();
        long deliveryTag = envelope.getDeliveryTag();
        loop.execute(() -> manager.onDelivery(ch, consumerTag, deliveryTag, body));
    }

    @Override
    public void handleCancel(String consumerTag) {
        Channel ch = getChannel();
        loop.execute(() -> manager.onConsumerCancelled(ch, consumerTag));
    }
}
