package com.sectune.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of checking one component (store, database, provider).
 *
 * @param metadata extra key/value pairs shown alongside the component, never null
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /** DEGRADED means usable with reduced guarantees; only DOWN makes the service unhealthy. */
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * DOWN if any check is down, else DEGRADED if any is degraded, else UP.
     */
    public static Status overall(Collection<HealthStatus> checks) {
        if (checks.stream().anyMatch(c -> c.status() == Status.DOWN)) {
            return Status.DOWN;
        }
        if (checks.stream().anyMatch(c -> c.status() == Status.DEGRADED)) {
            return Status.DEGRADED;
        }
        return Status.UP;
    }
}
