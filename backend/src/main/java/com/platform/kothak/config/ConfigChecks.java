package com.platform.kothak.config;

import com.platform.kothak.error.ConfigurationException;

import java.time.Duration;
import java.util.Set;

/**
 * Shared validation used while defaulting the resource configuration.
 */
final class ConfigChecks {
    
    private ConfigChecks() {
    }
    
    static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(field, value, "must not be blank");
        }
    }
    
    static void requireNonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new ConfigurationException(field, value, "must not be negative");
        }
    }
    
    static void requirePositive(String field, int value) {
        if (value < 1) {
            throw new ConfigurationException(field, value, "must be at least 1");
        }
    }
    
    static void requirePositive(String field, Duration value) {
        if (value != null && (value.isZero() || value.isNegative())) {
            throw new ConfigurationException(field, value, "must be positive");
        }
    }
    
    static void requireIdleWithinMax(String field, int idle, int max) {
        if (idle > max) {
            throw new ConfigurationException(field, idle, "must not exceed the maximum of " + max);
        }
    }
    
    static void requireUnique(String field, String name, Set<String> seen) {
        if (!seen.add(name)) {
            throw new ConfigurationException(field, name, "duplicate resource name");
        }
    }
}
