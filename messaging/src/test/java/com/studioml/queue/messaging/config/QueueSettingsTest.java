/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.messaging.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.studioml.queue.common.config.NestedConfig;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueueSettingsTest {

    @Test
    void defaultsApplyWhenSectionIsMissing() {
        QueueSettings settings = QueueSettings.from(new NestedConfig(Map.of()));

        assertThat(settings).isEqualTo(QueueSettings.defaults());
        assertThat(settings.timeUnit()).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.reconnectDelay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void valuesAreReadFromCloudQueueSettings() {
        Map<String, Object> config = Map.of("cloud", Map.of("queue", Map.of("settings", Map.of(
                "time_unit_ms", 20,
                "reconnect_delay_units", 3,
                "heartbeat_seconds", "15",
                "connection_name", "worker-7"))));

        QueueSettings settings = QueueSettings.from(new NestedConfig(config));

        assertThat(settings.timeUnit()).isEqualTo(Duration.ofMillis(20));
        assertThat(settings.reconnectDelay()).isEqualTo(Duration.ofMillis(60));
        assertThat(settings.heartbeatSeconds()).isEqualTo(15);
        assertThat(settings.connectionTimeoutMs()).isEqualTo(30000);
        assertThat(settings.connectionName()).isEqualTo("worker-7");
    }

    @Test
    void negativeUnitCountsAreZero() {
        assertThat(QueueSettings.defaults().units(-4)).isEqualTo(Duration.ZERO);
        assertThat(QueueSettings.defaults().withTimeUnit(Duration.ofMillis(10)).units(3))
                .isEqualTo(Duration.ofMillis(30));
    }
}
