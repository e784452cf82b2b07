/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.studioml.queue.common.config;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;

/**
 * Read-only accessor over a nested configuration structure (maps of maps, as produced by
 * {@link QueueConfigLoader}), addressed with dotted paths.
 *
 * <pre>{@code
 *   NestedConfig cfg = new NestedConfig(config);
 *   String url = cfg.getString("cloud.queue.rmq", null);
 *   int unitMs = cfg.getInt("cloud.queue.settings.time_unit_ms", 1000);
 * }</pre>
 *
 * <p>A path that crosses a non-map value, or ends on a missing key, is treated as absent.</p>
 */
public final class NestedConfig {

    private final Map<String, Object> root;

    public NestedConfig(Map<String, Object> root) {
        this.root = root != null ? root : Collections.emptyMap();
    }

    /**
     * Raw value at {@code path}, or {@code null} if any segment is missing.
     */
    public Object get(String path) {
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) return null;
            current = ((Map<?, ?>) current).get(segment);
            if (current == null) return null;
        }
        return current;
    }

    public boolean has(String path) {
        return get(path) != null;
    }

    public String getString(String path, String defaultValue) {
        Object val = get(path);
        return val != null ? String.valueOf(val) : defaultValue;
    }

    public int getInt(String path, int defaultValue) {
        Object val = get(path);
        if (val instanceof Number n) return n.intValue();
        if (val == null || String.valueOf(val).isBlank()) return defaultValue;
        try { return Integer.parseInt(String.valueOf(val).trim()); }
        catch (NumberFormatException e) { return defaultValue; }
    }

    public long getLong(String path, long defaultValue) {
        Object val = get(path);
        if (val instanceof Number n) return n.longValue();
        if (val == null || String.valueOf(val).isBlank()) return defaultValue;
        try { return Long.parseLong(String.valueOf(val).trim()); }
        catch (NumberFormatException e) { return defaultValue; }
    }

    /**
     * Numeric value at {@code path} interpreted as milliseconds.
     */
    public Duration getMillis(String path, Duration defaultValue) {
        long millis = getLong(path, -1);
        return millis >= 0 ? Duration.ofMillis(millis) : defaultValue;
    }

    /**
     * Sub-tree at {@code path} as a new accessor; empty when absent.
     */
    @SuppressWarnings("unchecked")
    public NestedConfig child(String path) {
        Object val = get(path);
        return new NestedConfig(val instanceof Map ? (Map<String, Object>) val : null);
    }

    @Override
    public String toString() {
        return "NestedConfig{keys=" + root.keySet() + "}";
    }
}
