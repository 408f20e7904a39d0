package com.platform.kothak.connectors.sqldb;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps driver identifiers used in configuration to JDBC driver classes.
 */
final class SqlDrivers {
    
    private static final Map<String, String> DRIVER_CLASSES = Map.of(
        "mysql", "com.mysql.cj.jdbc.Driver",
        "mariadb", "org.mariadb.jdbc.Driver",
        "postgres", "org.postgresql.Driver",
        "postgresql", "org.postgresql.Driver",
        "sqlserver", "com.microsoft.sqlserver.jdbc.SQLServerDriver",
        "oracle", "oracle.jdbc.OracleDriver",
        "h2", "org.h2.Driver"
    );
    
    private SqlDrivers() {
    }
    
    /**
     * Resolve a driver identifier. A value containing a dot is taken as a class name as-is.
     */
    static Optional<String> driverClassName(String driver) {
        if (driver == null || driver.isBlank()) {
            return Optional.empty();
        }
        String trimmed = driver.trim();
        if (trimmed.contains(".")) {
            return Optional.of(trimmed);
        }
        return Optional.ofNullable(DRIVER_CLASSES.get(trimmed.toLowerCase(Locale.ROOT)));
    }
}
