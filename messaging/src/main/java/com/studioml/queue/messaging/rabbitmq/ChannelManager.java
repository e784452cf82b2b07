/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ShutdownSignalException;
import com.studioml.queue.common.exception.ChannelUnavailableException;
import com.studioml.queue.messaging.core.BindingConfig;
import com.studioml.queue.messaging.core.ChannelState;
import com.studioml.queue.messaging.core.ConsumerGate;
import com.studioml.queue.messaging.core.DeliveryEpoch;
import com.studioml.queue.messaging.core.DeliveryTracker;
import com.studioml.queue.messaging.core.HeldMessage;
import com.studioml.queue.messaging.core.PendingDelivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns the one channel of the current connection and drives its handshake:
 * open (no prefetch limit) → declare exchange → declare queue → bind → enable confirms.
 *
 * <p>Each step is a separate event-loop task, started only after the previous one completed on the
 * same channel. A failure anywhere, or any channel closure, clears the channel and hands it to the
 * channel-lost callback, which closes the whole connection. There is no in-place channel repair.</p>
 *
 * <p>Channel handle, epoch, state and consumer tag are guarded by the connection lock shared with
 * {@link ConnectionSupervisor}. Publishers are serialized by a separate publish lock so that
 * sequence numbers follow channel order while the socket write happens outside the connection lock. The held-message slot lives in {@link ConsumerGate} under the
 * bookkeeping lock; the two locks are only ever nested connection-lock first.</p>
 */
public class ChannelManager {

    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

    static final String APP_ID = "studioml";
    static final String CONTENT_TYPE = "application/json";
    private static final AMQP.BasicProperties PROPERTIES = new AMQP.BasicProperties.Builder()
            .appId(APP_ID)
            .contentType(CONTENT_TYPE)
            .build();

    @FunctionalInterface
    private interface SetupStep {
        void run(Channel channel) throws IOException;
    }

    private final BindingConfig binding;
    private final ReentrantLock lock;
    private final Condition stateChanged;
    private final BrokerEventLoop loop;
    private final DeliveryTracker tracker;
    private final ConsumerGate gate;
    private final Consumer<Channel> onChannelLost;
    private final ReentrantLock publishLock = new ReentrantLock();

    private Connection connection;
    private DeliveryEpoch epoch;
    private Channel channel;
    private ChannelState state = ChannelState.NONE;
    private String consumerTag;

    ChannelManager(BindingConfig binding, ReentrantLock connectionLock, BrokerEventLoop loop,
                   DeliveryTracker tracker, ConsumerGate gate, Consumer<Channel> onChannelLost) {
        this.binding = binding;
        this.lock = connectionLock;
        this.stateChanged = connectionLock.newCondition();
        this.loop = loop;
        this.tracker = tracker;
        this.gate = gate;
        this.onChannelLost = onChannelLost;
    }

    // ─── Handshake (event loop) ─────────────────────────────────────────────

    void open(Connection conn, DeliveryEpoch epoch) {
        lock.lock();
        try {
            connection = conn;
            this.epoch = epoch;
            channel = null;
            consumerTag = null;
            transition(ChannelState.OPENING);
        } finally {
            lock.unlock();
        }
        loop.execute(() -> openChannel(conn, epoch));
    }

    private void openChannel(Connection conn, DeliveryEpoch epoch) {
        log.debug("creating a new channel");
        Channel created;
        try {
            created = conn.createChannel();
            if (created == null) throw new IOException("no channel number available");
            prepare(created, epoch);
        } catch (IOException | RuntimeException e) {
            fail(null, ChannelState.OPENING, e);
            return;
        }
        lock.lock();
        try {
            if (connection != conn || state != ChannelState.OPENING) {
                log.debug("connection changed while opening channel {}", created.getChannelNumber());
                created.abort();
                return;
            }
            channel = created;
            transition(ChannelState.EXCHANGE_DECLARING);
        } catch (IOException e) {
            log.warn("Could not abort stale channel: {}", e.getMessage());
            return;
        } finally {
            lock.unlock();
        }
        log.debug("created channel {}", created.getChannelNumber());
        loop.execute(() -> declareExchange(created));
    }

    private void prepare(Channel ch, DeliveryEpoch epoch) throws IOException {
        ch.basicQos(0);
        ch.addShutdownListener(cause -> loop.execute(() -> onChannelClosed(ch, cause)));
        ch.addConfirmListener(new EpochConfirmListener(epoch));
        ch.addReturnListener((Return returned) -> log.warn(
                "message returned as unroutable by {} with routing key {}: {} {}",
                returned.getExchange(), returned.getRoutingKey(),
                returned.getReplyCode(), returned.getReplyText()));
    }

    private void declareExchange(Channel ch) {
        log.debug("declaring exchange {}", binding.exchange());
        runStep(ch, ChannelState.EXCHANGE_DECLARING,
                c -> c.exchangeDeclare(binding.exchange(), binding.exchangeType(),
                        binding.durable(), binding.autoDelete(), null),
                ChannelState.QUEUE_DECLARING, () -> declareQueue(ch));
    }

    private void declareQueue(Channel ch) {
        log.debug("declaring queue {}", binding.queue());
        runStep(ch, ChannelState.QUEUE_DECLARING,
                c -> c.queueDeclare(binding.queue(), false, false, false, null),
                ChannelState.BINDING, () -> bindQueue(ch));
    }

    private void bindQueue(Channel ch) {
        log.debug("binding {} to {} with {}", binding.exchange(), binding.queue(), binding.routingKey());
        runStep(ch, ChannelState.BINDING,
                c -> c.queueBind(binding.queue(), binding.exchange(), binding.routingKey()),
                ChannelState.CONFIRM_ENABLING, () -> enableConfirms(ch));
    }

    private void enableConfirms(Channel ch) {
        log.info("bound {} to {} with {}", binding.exchange(), binding.queue(), binding.routingKey());
        runStep(ch, ChannelState.CONFIRM_ENABLING, Channel::confirmSelect, ChannelState.READY, null);
    }

    private void runStep(Channel ch, ChannelState expected, SetupStep step, ChannelState next,
                         Runnable andThen) {
        if (!isCurrent(ch, expected)) {
            log.debug("skipping {} on a replaced channel", expected);
            return;
        }
        try {
            step.run(ch);
        } catch (IOException | RuntimeException e) {
            fail(ch, expected, e);
            return;
        }
        lock.lock();
        try {
            if (channel != ch || state != expected) return;
            transition(next);
        } finally {
            lock.unlock();
        }
        if (andThen != null) loop.execute(andThen);
    }

    private boolean isCurrent(Channel ch, ChannelState expected) {
        lock.lock();
        try {
            return channel == ch && state == expected;
        } finally {
            lock.unlock();
        }
    }

    private void fail(Channel ch, ChannelState step, Exception cause) {
        log.warn("channel setup failed while {}: {}", step, cause.getMessage());
        lock.lock();
        try {
            if (channel != ch) return;
            channel = null;
            consumerTag = null;
            transition(ChannelState.NONE);
        } finally {
            lock.unlock();
        }
        onChannelLost.accept(ch);
    }

    private void onChannelClosed(Channel ch, ShutdownSignalException cause) {
        lock.lock();
        try {
            if (channel != ch) return;
            channel = null;
            consumerTag = null;
            transition(ChannelState.NONE);
        } finally {
            lock.unlock();
        }
        log.info("channel closed {}", cause.getMessage());
        dropHeldMessage();
        onChannelLost.accept(ch);
    }

    /**
     * Forget the channel after its connection went away.
     */
    void reset() {
        lock.lock();
        try {
            connection = null;
            epoch = null;
            channel = null;
            consumerTag = null;
            if (state != ChannelState.CLOSED) transition(ChannelState.NONE);
        } finally {
            lock.unlock();
        }
        dropHeldMessage();
    }

    /**
     * Close the channel for shutdown. The state stays {@link ChannelState#CLOSED}.
     */
    void close() {
        Channel ch;
        lock.lock();
        try {
            ch = channel;
            channel = null;
            consumerTag = null;
            transition(ChannelState.CLOSED);
        } finally {
            lock.unlock();
        }
        if (ch != null && ch.isOpen()) {
            log.info("closing the channel");
            try {
                ch.close();
            } catch (IOException | TimeoutException | AlreadyClosedException e) {
                log.warn("Error closing channel: {}", e.getMessage());
            }
        }
        dropHeldMessage();
    }

    private void dropHeldMessage() {
        gate.clear().ifPresent(m -> log.info("dropped held delivery {}, the broker will redeliver it",
                m.getDeliveryTag()));
    }

    private void transition(ChannelState next) {
        if (state != next) log.debug("channel {} -> {}", state, next);
        state = next;
        stateChanged.signalAll();
    }

    // ─── Caller-side operations ─────────────────────────────────────────────

    public ChannelState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to {@code timeout} for the channel to become ready. A zero timeout checks once.
     */
    public boolean awaitReady(Duration timeout) {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (state != ChannelState.READY && nanos > 0) {
                nanos = stateChanged.awaitNanos(nanos);
            }
            return state == ChannelState.READY;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Publish {@code body} on the ready channel, mandatory, and start tracking its confirmation.
     *
     * @throws ChannelUnavailableException if the channel is not ready or the publish fails locally
     */
    public PendingDelivery publish(byte[] body) {
        publishLock.lock();
        try {
            Channel ch;
            DeliveryEpoch channelEpoch;
            lock.lock();
            try {
                if (state != ChannelState.READY || channel == null) {
                    throw new ChannelUnavailableException(
                            "Channel for " + binding.exchange() + " is " + state);
                }
                ch = channel;
                channelEpoch = epoch;
            } finally {
                lock.unlock();
            }
            PendingDelivery delivery = tracker.recordPublish();
            if (delivery.epoch() != channelEpoch) {
                tracker.withdraw(delivery);
                throw new ChannelUnavailableException("Channel for " + binding.exchange() + " was replaced");
            }
            try {
                ch.basicPublish(binding.exchange(), binding.routingKey(), true, PROPERTIES, body);
            } catch (IOException | AlreadyClosedException e) {
                tracker.withdraw(delivery);
                throw new ChannelUnavailableException("Publish to " + binding.exchange() + " failed", e);
            }
            log.debug("sent message {} to {} with {}", delivery.sequenceNumber(), binding.exchange(),
                    binding.routingKey());
            return delivery;
        } finally {
            publishLock.unlock();
        }
    }

    /**
     * Register a consumer on the bound queue unless one is active or a message is already held.
     */
    public void ensureConsuming() {
        lock.lock();
        try {
            if (state != ChannelState.READY || channel == null || consumerTag != null || gate.isHolding()) {
                return;
            }
            Channel ch = channel;
            consumerTag = ch.basicConsume(binding.queue(), false, new GatedConsumer(ch, this, loop));
            log.debug("consuming from {} with tag {}", binding.queue(), consumerTag);
        } catch (IOException | AlreadyClosedException e) {
            log.warn("Could not start consuming from {}: {}", binding.queue(), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release the held slot, then ack on the broker if the message came from the channel that is still
     * open.
     */
    public void acknowledge(HeldMessage message) {
        long deliveryTag = message.getDeliveryTag();
        if (!gate.release(message)) {
            log.debug("delivery {} is from a replaced channel, keeping the newer held delivery", deliveryTag);
        }
        lock.lock();
        try {
            if (channel == null || !channel.isOpen()) {
                log.debug("no channel to acknowledge {}, the broker will redeliver it", deliveryTag);
                return;
            }
            if (message.getEpoch() != epoch) {
                log.debug("delivery {} came from a replaced channel, the broker will redeliver it", deliveryTag);
                return;
            }
            channel.basicAck(deliveryTag, false);
        } catch (IOException | AlreadyClosedException e) {
            log.warn("Failed to acknowledge delivery {}: {}", deliveryTag, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    // ─── Consumer callbacks (event loop) ────────────────────────────────────

    void onDelivery(Channel ch, String tag, long deliveryTag, byte[] body) {
        lock.lock();
        try {
            if (channel != ch) {
                log.debug("dropping delivery {} from a closed channel", deliveryTag);
                return;
            }
            // one message at a time: stop the consumer as soon as anything arrives
            if (tag.equals(consumerTag)) {
                consumerTag = null;
                cancel(ch, tag);
            }
            if (gate.offer(new HeldMessage(body, deliveryTag, epoch))) {
                log.debug("holding delivery {}", deliveryTag);
                return;
            }
            ch.basicNack(deliveryTag, false, true);
            log.debug("requeued delivery {}, a message is already held", deliveryTag);
        } catch (IOException | AlreadyClosedException e) {
            log.warn("Failed to requeue delivery {}: {}", deliveryTag, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private void cancel(Channel ch, String tag) {
        try {
            ch.basicCancel(tag);
        } catch (IOException | AlreadyClosedException e) {
            log.warn("Failed to cancel consumer {}: {}", tag, e.getMessage());
        }
    }

    void onConsumerCancelled(Channel ch, String tag) {
        lock.lock();
        try {
            if (channel == ch && tag.equals(consumerTag)) {
                log.info("consumer {} cancelled by the broker", tag);
                consumerTag = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private final class EpochConfirmListener implements ConfirmListener {
        private final DeliveryEpoch epoch;

        EpochConfirmListener(DeliveryEpoch epoch) {
            this.epoch = epoch;
        }

        @Override
        public void handleAck(long deliveryTag, boolean multiple) {
            log.debug("received ack for delivery tag: {}", deliveryTag);
            loop.execute(() -> tracker.recordConfirmation(epoch, deliveryTag, multiple, true));
        }

        @Override
        public void handleNack(long deliveryTag, boolean multiple) {
            log.debug("received nack for delivery tag: {}", deliveryTag);
            loop.execute(() -> tracker.recordConfirmation(epoch, deliveryTag, multiple, false));
        }
    }
}
