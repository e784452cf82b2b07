/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.studioml.queue.messaging.config.QueueSettings;
import com.studioml.queue.messaging.core.BindingConfig;
import com.studioml.queue.messaging.core.ConnectionState;
import com.studioml.queue.messaging.core.ConsumerGate;
import com.studioml.queue.messaging.core.DeliveryEpoch;
import com.studioml.queue.messaging.core.DeliveryTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the physical connection and the event loop it runs on.
 *
 * <p>The loop opens a connection, lets {@link ChannelManager} bring the channel up, and on any close
 * waits the reconnect delay and starts over with fresh delivery bookkeeping. Reconnection is done
 * here rather than by the client library's automatic recovery, because delivery tags and
 * confirmations do not survive a new connection. Once {@link #stop()} is requested the next close
 * ends the loop for good.</p>
 */
public class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final ConnectionFactory factory;
    private final QueueSettings settings;
    private final DeliveryTracker tracker;
    private final ConsumerGate gate;
    private final ReentrantLock lock = new ReentrantLock();
    private final BrokerEventLoop loop;
    private final ChannelManager channels;
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean stopping = false;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private Connection connection;
    private int attempts;

    public ConnectionSupervisor(ConnectionFactory factory, QueueSettings settings, BindingConfig binding,
                                DeliveryTracker tracker, ConsumerGate gate) {
        this.factory = factory;
        this.settings = settings;
        this.tracker = tracker;
        this.gate = gate;
        this.loop = new BrokerEventLoop("rmq-" + binding.queue());
        this.channels = new ChannelManager(binding, lock, loop, tracker, gate, this::onChannelLost);
    }

    public ChannelManager getChannelManager() { return channels; }
    public ConnectionState getState() { return state; }

    boolean inEventLoop() { return loop.inEventLoop(); }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        log.info("RMQ started");
        loop.execute(this::connect);
    }

    /**
     * Request shutdown: close channel and connection, then end the loop. Does not block.
     */
    public void stop() {
        if (stopping) return;
        log.info("stopping");
        stopping = true;
        loop.execute(this::shutdown);
    }

    public boolean awaitTermination(Duration timeout) {
        try {
            return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ─── Event loop ─────────────────────────────────────────────────────────

    private void connect() {
        if (stopping) {
            finish();
            return;
        }
        attempts++;
        DeliveryEpoch epoch = tracker.reset();
        gate.clear();
        setState(ConnectionState.CONNECTING);

        Connection conn;
        try {
            conn = factory.newConnection(settings.connectionName());
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("connection attempt {} to {}:{} failed, retry in {} ms: {}", attempts, factory.getHost(),
                    factory.getPort(), settings.reconnectDelay().toMillis(), e.getMessage());
            setState(ConnectionState.DISCONNECTED);
            scheduleReconnect();
            return;
        }
        conn.addShutdownListener(cause -> loop.execute(() -> onConnectionClosed(conn, cause)));

        lock.lock();
        try {
            connection = conn;
            state = ConnectionState.OPEN;
        } finally {
            lock.unlock();
        }
        log.info("RMQ connected to {}:{}{} (attempt {}, epoch {})", factory.getHost(), factory.getPort(),
                factory.getVirtualHost(), attempts, epoch.getId());
        channels.open(conn, epoch);
    }

    private void onConnectionClosed(Connection conn, ShutdownSignalException cause) {
        lock.lock();
        try {
            if (connection != conn) return;
            connection = null;
            state = ConnectionState.DISCONNECTED;
        } finally {
            lock.unlock();
        }
        channels.reset();
        if (stopping) {
            log.info("connection closed");
            finish();
        } else {
            log.info("connection closed, retry in {} ms: {}", settings.reconnectDelay().toMillis(),
                    cause.getMessage());
            scheduleReconnect();
        }
    }

    private void onChannelLost(Channel ch) {
        if (stopping) return;
        closeConnection();
    }

    private void scheduleReconnect() {
        loop.schedule(this::connect, settings.reconnectDelay());
    }

    private void shutdown() {
        channels.close();
        Connection conn;
        lock.lock();
        try {
            conn = connection;
            if (conn != null) state = ConnectionState.CLOSING;
        } finally {
            lock.unlock();
        }
        if (conn == null || !conn.isOpen()) {
            lock.lock();
            try {
                connection = null;
            } finally {
                lock.unlock();
            }
            finish();
            return;
        }
        // the shutdown listener finishes the loop
        closeConnection();
    }

    private void closeConnection() {
        Connection conn;
        lock.lock();
        try {
            conn = connection;
        } finally {
            lock.unlock();
        }
        if (conn == null || !conn.isOpen()) return;
        log.info("closing connection");
        try {
            conn.close(settings.connectionTimeoutMs());
        } catch (IOException | RuntimeException e) {
            log.warn("Error closing connection, aborting it: {}", e.getMessage());
            conn.abort(settings.connectionTimeoutMs());
        }
    }

    private void finish() {
        if (terminated.getCount() == 0) return;
        setState(ConnectionState.DISCONNECTED);
        log.info("RMQ stopped");
        loop.shutdown();
        terminated.countDown();
    }

    private void setState(ConnectionState next) {
        lock.lock();
        try {
            state = next;
        } finally {
            lock.unlock();
        }
    }
}
