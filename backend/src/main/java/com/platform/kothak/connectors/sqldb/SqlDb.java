package com.platform.kothak.connectors.sqldb;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * A logical database with a leader pool for writes and a follower pool for reads.
 * Without a replica both roles share the same pool instance.
 */
public class SqlDb implements AutoCloseable {
    
    private final String name;
    private final HikariDataSource leader;
    private final HikariDataSource follower;
    
    public SqlDb(String name, HikariDataSource leader, HikariDataSource follower) {
        this.name = Objects.requireNonNull(name, "name");
        this.leader = Objects.requireNonNull(leader, "leader");
        this.follower = follower != null ? follower : leader;
    }
    
    public String getName() {
        return name;
    }
    
    public HikariDataSource getLeader() {
        return leader;
    }
    
    public HikariDataSource getFollower() {
        return follower;
    }
    
    public boolean hasDedicatedFollower() {
        return follower != leader;
    }
    
    /**
     * Get connection for write operations (always uses the leader).
     */
    public Connection getWriteConnection() throws SQLException {
        return leader.getConnection();
    }
    
    /**
     * Get connection for read operations (uses the follower).
     */
    public Connection getReadConnection() throws SQLException {
        return follower.getConnection();
    }
    
    /**
     * Closes the leader, then the follower if it is a separate pool.
     */
    @Override
    public void close() {
        try {
            leader.close();
        } finally {
            if (hasDedicatedFollower()) {
                follower.close();
            }
        }
    }
    
    /**
     * Which side of the database a pool serves.
     */
    public enum Role {
        LEADER,
        REPLICA
    }
}
