package com.platform.kothak.config;

import lombok.Data;

/**
 * Connection settings for one side (leader or replica) of a database.
 * Unset numeric fields are inherited from {@link DatabaseConfig}.
 */
@Data
public class ConnConfig {
    
    /**
     * JDBC URL.
     */
    private String dsn;
    
    private String username;
    
    private String password;
    
    /**
     * Retries after the first failed connect attempt.
     */
    private Integer maxRetry;
    
    private Integer maxOpenConns;
    
    private Integer maxIdleConns;
    
    public boolean hasDsn() {
        return dsn != null && !dsn.isBlank();
    }
    
    void setDefault(DatabaseConfig defaults, String path) {
        ConfigChecks.requireNonNegative(path + ".max-retry", maxRetry);
        ConfigChecks.requireNonNegative(path + ".max-open-conns", maxOpenConns);
        ConfigChecks.requireNonNegative(path + ".max-idle-conns", maxIdleConns);
        
        if (maxRetry == null) {
            maxRetry = defaults.getMaxRetry();
        }
        if (maxOpenConns == null) {
            maxOpenConns = defaults.getMaxOpenConns();
        }
        if (maxIdleConns == null) {
            maxIdleConns = Math.min(defaults.getMaxIdleConns(), maxOpenConns);
        }
        
        ConfigChecks.requirePositive(path + ".max-open-conns", maxOpenConns);
        ConfigChecks.requireIdleWithinMax(path + ".max-idle-conns", maxIdleConns, maxOpenConns);
    }
}
