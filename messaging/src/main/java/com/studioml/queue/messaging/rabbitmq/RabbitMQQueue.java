/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.rabbitmq;

import com.rabbitmq.client.ConnectionFactory;
import com.studioml.queue.common.config.ConfigPropertyResolver;
import com.studioml.queue.common.config.NestedConfig;
import com.studioml.queue.common.exception.ChannelUnavailableException;
import com.studioml.queue.common.exception.InvalidMessageException;
import com.studioml.queue.common.exception.PublishUnconfirmedException;
import com.studioml.queue.common.exception.QueueConfigurationException;
import com.studioml.queue.common.exception.UnsupportedQueueOperationException;
import com.studioml.queue.messaging.config.QueueSettings;
import com.studioml.queue.messaging.core.BindingConfig;
import com.studioml.queue.messaging.core.ChannelState;
import com.studioml.queue.messaging.core.ConnectionState;
import com.studioml.queue.messaging.core.ConsumerGate;
import com.studioml.queue.messaging.core.DeliveryStats;
import com.studioml.queue.messaging.core.DeliveryTracker;
import com.studioml.queue.messaging.core.DistributedQueue;
import com.studioml.queue.messaging.core.HeldMessage;
import com.studioml.queue.messaging.core.PendingDelivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RabbitMQ-backed {@link DistributedQueue} using AMQP 0-9-1 publisher confirms.
 *
 * <p>Hides connection churn behind blocking calls: {@code enqueue} waits for the channel to be ready
 * and for the broker confirmation, {@code dequeue} waits for the single held message. Broker trouble
 * is retried by the background {@link ConnectionSupervisor} and only shows up here as longer waits,
 * {@link ChannelUnavailableException} or {@link PublishUnconfirmedException}.</p>
 *
 * <p>The broker URL comes from {@code cloud.queue.rmq} in the configuration when present, otherwise
 * from the constructor argument. {@code ${...}} placeholders in it are resolved.</p>
 */
public class RabbitMQQueue implements DistributedQueue {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQQueue.class);

    public static final String URL_PATH = "cloud.queue.rmq";

    private final BindingConfig binding;
    private final String url;
    private final QueueSettings settings;
    private final DeliveryTracker tracker;
    private final ConsumerGate gate;
    private final ConnectionSupervisor supervisor;
    private final ChannelManager channels;

    public RabbitMQQueue(String queue, String routingKey, String amqpUrl) {
        this(queue, routingKey, amqpUrl, null, null);
    }

    public RabbitMQQueue(String queue, String routingKey, String amqpUrl, Map<String, Object> config) {
        this(queue, routingKey, amqpUrl, config, null);
    }

    /**
     * @param factory connection factory to use; built from the URL when {@code null}
     */
    public RabbitMQQueue(String queue, String routingKey, String amqpUrl, Map<String, Object> config,
                         ConnectionFactory factory) {
        NestedConfig cfg = new NestedConfig(config);
        this.binding = BindingConfig.studioml(queue, routingKey);
        this.settings = QueueSettings.from(cfg);
        this.url = resolveUrl(amqpUrl, cfg);

        ReentrantLock bookkeepingLock = new ReentrantLock();
        this.tracker = new DeliveryTracker(bookkeepingLock);
        this.gate = new ConsumerGate(bookkeepingLock);

        ConnectionFactory connectionFactory = factory;
        if (connectionFactory == null && url != null) {
            connectionFactory = connectionFactory(url, settings);
        }
        this.supervisor = new ConnectionSupervisor(connectionFactory, settings, binding, tracker, gate);
        this.channels = supervisor.getChannelManager();
    }

    /**
     * Connection factory for {@code url}. Automatic recovery is off; {@link ConnectionSupervisor}
     * reconnects itself.
     */
    public static ConnectionFactory connectionFactory(String url, QueueSettings settings) {
        ConnectionFactory factory = new ConnectionFactory();
        try {
            factory.setUri(url);
        } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException | IllegalArgumentException e) {
            throw new QueueConfigurationException("Invalid broker url " + redact(url), e);
        }
        factory.setConnectionTimeout(settings.connectionTimeoutMs());
        factory.setRequestedHeartbeat(settings.heartbeatSeconds());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        return factory;
    }

    private static String resolveUrl(String explicitUrl, NestedConfig cfg) {
        String candidate = explicitUrl;
        String configured = cfg.getString(URL_PATH, null);
        if (configured != null) {
            log.info("url {} taken from {}", redact(configured), URL_PATH);
            candidate = configured;
        }
        if (candidate == null || candidate.isBlank()) return null;
        try {
            return new ConfigPropertyResolver().resolve(candidate.trim());
        } catch (ConfigPropertyResolver.ConfigResolutionException e) {
            throw new QueueConfigurationException(e.getMessage(), e);
        }
    }

    static String redact(String url) {
        return url == null ? null : url.replaceFirst("(//[^:/@]+:)[^@/]*@", "$1***@");
    }

    @Override
    public void start() {
        if (url == null) {
            log.warn("no broker url configured for queue {}, not connecting", binding.queue());
            return;
        }
        supervisor.start();
    }

    @Override
    public String getName() { return binding.queue(); }

    public ConnectionState getConnectionState() { return supervisor.getState(); }
    public ChannelState getChannelState() { return channels.getState(); }

    @Override
    public DeliveryStats getDeliveryStats() { return tracker.stats(); }

    // ─── Publishing ─────────────────────────────────────────────────────────

    @Override
    public long enqueue(String message, int retries) {
        requireUrl();
        if (message == null || message.isEmpty()) {
            throw new InvalidMessageException("message was empty, it needs a meaningful value to be sent");
        }
        return publish(message.getBytes(StandardCharsets.UTF_8), retries);
    }

    public long enqueue(byte[] message, int retries) {
        requireUrl();
        if (message == null || message.length == 0) {
            throw new InvalidMessageException("message was empty, it needs a meaningful value to be sent");
        }
        return publish(message, retries);
    }

    private void requireUrl() {
        if (url == null) {
            throw new QueueConfigurationException("url for rmq not initialized");
        }
    }

    private long publish(byte[] body, int retries) {
        requireCallerThread("enqueue");
        if (!channels.awaitReady(settings.units(retries))) {
            log.warn("failed to send message to {} as the channel was not ready after {} tries",
                    redact(url), retries);
            throw new ChannelUnavailableException(redact(url), retries);
        }
        PendingDelivery delivery = channels.publish(body);
        if (tracker.awaitConfirmation(delivery, settings.units(retries))) {
            log.debug("message {} acknowledged by {}", delivery.sequenceNumber(), redact(url));
            return delivery.sequenceNumber();
        }
        throw new PublishUnconfirmedException(delivery.sequenceNumber(), redact(url), retries);
    }

    // ─── Consuming ──────────────────────────────────────────────────────────

    @Override
    public Optional<HeldMessage> dequeue(int timeout) {
        requireCallerThread("dequeue");
        long unitNanos = settings.timeUnit().toNanos();
        long deadline = System.nanoTime() + settings.units(timeout).toNanos();
        while (true) {
            channels.ensureConsuming();
            long remaining = Math.max(0, deadline - System.nanoTime());
            Optional<HeldMessage> message = gate.await(Duration.ofNanos(Math.min(remaining, unitNanos)));
            if (message.isPresent()) {
                log.info("message {} from {}", message.get().getDeliveryTag(), binding.queue());
                return message;
            }
            if (deadline - System.nanoTime() <= 0) {
                log.debug("dequeue from {} timed-out", binding.queue());
                return Optional.empty();
            }
            log.debug("idle {}", binding.queue());
        }
    }

    @Override
    public void acknowledge(HeldMessage message) {
        requireCallerThread("acknowledge");
        channels.acknowledge(message);
    }

    @Override
    public void clean(int timeout) {
        int drained = 0;
        Optional<HeldMessage> message;
        while ((message = dequeue(timeout)).isPresent()) {
            acknowledge(message.get());
            drained++;
        }
        log.info("drained {} messages from {}", drained, binding.queue());
    }

    @Override
    public void hold(HeldMessage message, int minutes) {
        log.debug("hold {} for {} minutes: message stays unacknowledged until acknowledged or the channel closes",
                message.getDeliveryTag(), minutes);
    }

    @Override
    public void delete() {
        throw new UnsupportedQueueOperationException("delete");
    }

    @Override
    public boolean hasNext() {
        throw new UnsupportedQueueOperationException("hasNext");
    }

    // ─── Lifecycle ──────────────────────────────────────────────────────────

    @Override
    public void stop() {
        supervisor.stop();
    }

    @Override
    public boolean awaitTermination(Duration timeout) {
        return supervisor.awaitTermination(timeout);
    }

    private void requireCallerThread(String operation) {
        if (supervisor.inEventLoop()) {
            throw new IllegalStateException(operation + " must not be called from a broker callback");
        }
    }
}
