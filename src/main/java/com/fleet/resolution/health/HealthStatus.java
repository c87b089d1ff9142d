package com.fleet.resolution.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of a resolution component, with detail values such as cache
 * counters or index sizes.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthStatus of(Status status, String message) {
        return new HealthStatus(status, message, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
