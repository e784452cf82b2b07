/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.config;

import com.studioml.queue.common.config.NestedConfig;

import java.time.Duration;

/**
 * Timing and connection tunables, read from {@code cloud.queue.settings}:
 * <pre>
 *   time_unit_ms            length of one retry/timeout unit (default 1000)
 *   reconnect_delay_units   wait before reconnecting after a close (default 5)
 *   connection_timeout_ms   TCP connect timeout (default 30000)
 *   heartbeat_seconds       requested heartbeat (default 60)
 *   connection_name         client-provided connection name (default "studioml-queue")
 * </pre>
 */
public record QueueSettings(Duration timeUnit, int reconnectDelayUnits, int connectionTimeoutMs,
                            int heartbeatSeconds, String connectionName) {

    public static final String SETTINGS_PATH = "cloud.queue.settings";

    public static QueueSettings defaults() {
        return new QueueSettings(Duration.ofSeconds(1), 5, 30000, 60, "studioml-queue");
    }

    public static QueueSettings from(NestedConfig config) {
        NestedConfig s = config.child(SETTINGS_PATH);
        QueueSettings d = defaults();
        return new QueueSettings(
                s.getMillis("time_unit_ms", d.timeUnit()),
                s.getInt("reconnect_delay_units", d.reconnectDelayUnits()),
                s.getInt("connection_timeout_ms", d.connectionTimeoutMs()),
                s.getInt("heartbeat_seconds", d.heartbeatSeconds()),
                s.getString("connection_name", d.connectionName()));
    }

    /** {@code count} time units; negative counts are treated as zero. */
    public Duration units(int count) {
        return timeUnit.multipliedBy(Math.max(0, count));
    }

    public Duration reconnectDelay() {
        return units(reconnectDelayUnits);
    }

    public QueueSettings withTimeUnit(Duration unit) {
        return new QueueSettings(unit, reconnectDelayUnits, connectionTimeoutMs, heartbeatSeconds, connectionName);
    }
}
