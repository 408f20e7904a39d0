package com.platform.kothak.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The three kinds of resources Kothak brings up.
 */
public enum ResourceFamily {
    DATABASE("sql database", "database"),
    REDIS("redis", "redis"),
    OBJECT_STORAGE("object storage", "object_storage");
    
    private final String displayName;
    private final String metricTag;
    
    ResourceFamily(String displayName, String metricTag) {
        this.displayName = displayName;
        this.metricTag = metricTag;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    public String getMetricTag() {
        return metricTag;
    }
    
    /**
     * Resolve a family from its metric tag or enum name, ignoring case.
     */
    public static Optional<ResourceFamily> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
            .filter(f -> f.metricTag.equals(normalized) || f.name().toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst();
    }
}
