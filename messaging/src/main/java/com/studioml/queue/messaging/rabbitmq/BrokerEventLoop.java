/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.rabbitmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Single daemon thread on which every connection, channel, confirmation and delivery callback runs.
 * Broker client callbacks only enqueue work here, so lifecycle state has one writer.
 */
final class BrokerEventLoop implements Executor {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventLoop.class);

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread thread;

    BrokerEventLoop(String name) {
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
        // pending reconnect timers must not fire once the loop is stopped
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guard(task));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop stopped, dropping task");
        }
    }

    void schedule(Runnable task, Duration delay) {
        try {
            executor.schedule(guard(task), delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop stopped, dropping timer");
        }
    }

    boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    void shutdown() {
        executor.shutdown();
    }

    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Event loop task failed", e);
            }
        };
    }
}
