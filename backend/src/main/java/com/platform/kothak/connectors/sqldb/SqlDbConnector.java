package com.platform.kothak.connectors.sqldb;

import com.platform.kothak.config.DatabaseConfig;
import com.platform.kothak.config.SqlDbConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Opens one connection pool for one side of a configured database.
 */
public interface SqlDbConnector {
    
    /**
     * Open and validate a pool for the given role.
     * @param family defaulted database family settings
     * @param db the database entry
     * @param role leader or replica
     * @return a ready pool
     * @throws com.platform.kothak.error.ResourceConnectException if the pool cannot be opened
     */
    HikariDataSource connect(DatabaseConfig family, SqlDbConfig db, SqlDb.Role role);
}
