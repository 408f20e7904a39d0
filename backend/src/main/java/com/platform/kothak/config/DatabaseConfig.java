package com.platform.kothak.config;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Database family configuration: shared pool defaults plus one entry per database.
 */
@Data
public class DatabaseConfig {
    
    static final int DEFAULT_MAX_RETRY = 3;
    static final int DEFAULT_MAX_OPEN_CONNS = 10;
    static final int DEFAULT_MAX_IDLE_CONNS = 2;
    static final Duration DEFAULT_CONN_MAX_LIFETIME = Duration.ofMinutes(30);
    static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(1);
    
    private Integer maxRetry;
    
    private Integer maxOpenConns;
    
    private Integer maxIdleConns;
    
    private Duration connMaxLifetime;
    
    /**
     * Wait between connect retries.
     */
    private Duration retryInterval;
    
    private List<SqlDbConfig> sqldbs = new ArrayList<>();
    
    /**
     * Fill unset family defaults, then push them down into every leader and replica.
     *
     * @throws com.platform.kothak.error.ConfigurationException if a value is invalid
     *         or conflicts with another
     */
    public void setDefault() {
        ConfigChecks.requireNonNegative("kothak.database.max-retry", maxRetry);
        ConfigChecks.requireNonNegative("kothak.database.max-open-conns", maxOpenConns);
        ConfigChecks.requireNonNegative("kothak.database.max-idle-conns", maxIdleConns);
        ConfigChecks.requirePositive("kothak.database.conn-max-lifetime", connMaxLifetime);
        ConfigChecks.requirePositive("kothak.database.retry-interval", retryInterval);
        
        if (maxRetry == null) {
            maxRetry = DEFAULT_MAX_RETRY;
        }
        if (maxOpenConns == null) {
            maxOpenConns = DEFAULT_MAX_OPEN_CONNS;
        }
        if (maxIdleConns == null) {
            maxIdleConns = Math.min(DEFAULT_MAX_IDLE_CONNS, maxOpenConns);
        }
        if (connMaxLifetime == null) {
            connMaxLifetime = DEFAULT_CONN_MAX_LIFETIME;
        }
        if (retryInterval == null) {
            retryInterval = DEFAULT_RETRY_INTERVAL;
        }
        ConfigChecks.requirePositive("kothak.database.max-open-conns", maxOpenConns);
        ConfigChecks.requireIdleWithinMax("kothak.database.max-idle-conns", maxIdleConns, maxOpenConns);
        
        Set<String> names = new HashSet<>();
        for (int i = 0; i < sqldbs.size(); i++) {
            SqlDbConfig db = sqldbs.get(i);
            String path = "kothak.database.sqldbs[" + i + "]";
            
            ConfigChecks.requireText(path + ".name", db.getName());
            ConfigChecks.requireUnique(path + ".name", db.getName(), names);
            // no implicit driver
            ConfigChecks.requireText(path + ".driver", db.getDriver());
            if (db.getLeader() == null) {
                db.setLeader(new ConnConfig());
            }
            ConfigChecks.requireText(path + ".leader.dsn", db.getLeader().getDsn());
            
            db.getLeader().setDefault(this, path + ".leader");
            if (db.hasReplica()) {
                db.getReplica().setDefault(this, path + ".replica");
            }
        }
    }
}
