package com.cape.core.health;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One component check. {@code DOWN} means capabilities on the default backend
 * cannot run; {@code DEGRADED} means only some capabilities or backends fail.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    /** Ordered by severity. */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    /**
     * The most severe status among {@code checks}; UP when there are none.
     */
    public static Status overall(List<HealthStatus> checks) {
        return checks.stream()
                .map(HealthStatus::status)
                .max(Comparator.naturalOrder())
                .orElse(Status.UP);
    }
}
