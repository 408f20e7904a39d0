package com.platform.kothak.config;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Redis family configuration. Pool sizing and timeout are shared by every endpoint.
 */
@Data
public class RedisConfig {
    
    static final int DEFAULT_MAX_ACTIVE = 100;
    static final int DEFAULT_MAX_IDLE = 10;
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    
    private Integer maxActive;
    
    private Integer maxIdle;
    
    private Duration timeout;
    
    private List<RedisConnConfig> connections = new ArrayList<>();
    
    public void setDefault() {
        ConfigChecks.requireNonNegative("kothak.redis.max-active", maxActive);
        ConfigChecks.requireNonNegative("kothak.redis.max-idle", maxIdle);
        ConfigChecks.requirePositive("kothak.redis.timeout", timeout);
        
        if (maxActive == null || maxActive == 0) {
            maxActive = DEFAULT_MAX_ACTIVE;
        }
        if (maxIdle == null) {
            maxIdle = Math.min(DEFAULT_MAX_IDLE, maxActive);
        }
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        ConfigChecks.requireIdleWithinMax("kothak.redis.max-idle", maxIdle, maxActive);
        
        Set<String> names = new HashSet<>();
        for (int i = 0; i < connections.size(); i++) {
            RedisConnConfig conn = connections.get(i);
            String path = "kothak.redis.connections[" + i + "]";
            ConfigChecks.requireText(path + ".name", conn.getName());
            ConfigChecks.requireUnique(path + ".name", conn.getName(), names);
            ConfigChecks.requireText(path + ".address", conn.getAddress());
        }
    }
}
