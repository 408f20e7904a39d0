package com.platform.kothak.config;

import lombok.Data;

/**
 * One logical database: a leader and an optional read replica.
 */
@Data
public class SqlDbConfig {
    
    private String name;
    
    /**
     * Driver identifier, e.g. {@code mysql}, {@code postgres}, {@code h2},
     * or a fully qualified JDBC driver class name.
     */
    private String driver;
    
    private ConnConfig leader = new ConnConfig();
    
    /**
     * Optional. Without a DSN the follower pool is the leader pool.
     */
    private ConnConfig replica = new ConnConfig();
    
    public boolean hasReplica() {
        return replica != null && replica.hasDsn();
    }
}
