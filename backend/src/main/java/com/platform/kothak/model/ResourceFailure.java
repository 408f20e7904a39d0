package com.platform.kothak.model;

import java.util.Objects;

/**
 * A failure scoped to one named resource.
 */
public record ResourceFailure(
    ResourceFamily family,
    String name,
    Throwable cause
) {
    public ResourceFailure {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cause, "cause");
    }
    
    public String describe() {
        return String.format("[%s/%s] %s", family.getMetricTag(), name, cause.getMessage());
    }
}
