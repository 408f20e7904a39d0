package com.platform.kothak.model;

import java.time.Instant;

/**
 * Represents the health of one registered resource.
 */
public record ConnectionStatus(
    String family,
    String name,
    Status status,
    long latencyMs,
    Instant lastChecked,
    String errorMessage
) {
    public enum Status {
        UP,
        DOWN,
        UNKNOWN
    }
    
    public static ConnectionStatus up(ResourceFamily family, String name, long latencyMs) {
        return new ConnectionStatus(family.getMetricTag(), name, Status.UP, latencyMs, Instant.now(), null);
    }
    
    public static ConnectionStatus down(ResourceFamily family, String name, String errorMessage) {
        return new ConnectionStatus(family.getMetricTag(), name, Status.DOWN, -1, Instant.now(), errorMessage);
    }
    
    public static ConnectionStatus unknown(ResourceFamily family, String name) {
        return new ConnectionStatus(family.getMetricTag(), name, Status.UNKNOWN, -1, Instant.now(),
            "Status not checked for this resource type");
    }
    
    public boolean isHealthy() {
        return status == Status.UP;
    }
}
