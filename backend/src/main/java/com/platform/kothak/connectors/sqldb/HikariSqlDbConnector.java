package com.platform.kothak.connectors.sqldb;

import com.platform.kothak.config.ConnConfig;
import com.platform.kothak.config.DatabaseConfig;
import com.platform.kothak.config.SqlDbConfig;
import com.platform.kothak.error.ResourceConnectException;
import com.platform.kothak.model.ResourceFamily;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * HikariCP-backed connector. A pool is only returned once its first connection
 * has been validated; failed attempts are retried {@code max-retry} times.
 */
@Slf4j
@Component
public class HikariSqlDbConnector implements SqlDbConnector {
    
    @Override
    public HikariDataSource connect(DatabaseConfig family, SqlDbConfig db, SqlDb.Role role) {
        ConnConfig conn = role == SqlDb.Role.LEADER ? db.getLeader() : db.getReplica();
        String driverClassName = SqlDrivers.driverClassName(db.getDriver())
            .orElseThrow(() -> ResourceConnectException.unsupportedDriver(db.getName(), db.getDriver()));
        
        HikariConfig config;
        try {
            config = createConfig(family, db, role, conn, driverClassName);
        } catch (RuntimeException e) {
            // driver alias is known but its class is not on the classpath
            throw ResourceConnectException.connect(ResourceFamily.DATABASE, db.getName(), e);
        }
        Retry retry = Retry.of(config.getPoolName(), RetryConfig.custom()
            .maxAttempts(conn.getMaxRetry() + 1)
            .waitDuration(family.getRetryInterval())
            .build());
        retry.getEventPublisher().onRetry(event -> 
            log.warn("Connecting {} failed (attempt {}/{}): {}", config.getPoolName(),
                event.getNumberOfRetryAttempts(), conn.getMaxRetry() + 1,
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        
        long startTime = System.currentTimeMillis();
        try {
            HikariDataSource dataSource = retry.executeSupplier(() -> new HikariDataSource(config));
            log.info("Connected {} in {}ms", config.getPoolName(), System.currentTimeMillis() - startTime);
            return dataSource;
        } catch (RuntimeException e) {
            throw ResourceConnectException.connect(ResourceFamily.DATABASE, db.getName(), e);
        }
    }
    
    private HikariConfig createConfig(DatabaseConfig family, SqlDbConfig db, SqlDb.Role role,
                                      ConnConfig conn, String driverClassName) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("sqldb-" + db.getName() + "-" + role.name().toLowerCase(Locale.ROOT));
        config.setDriverClassName(driverClassName);
        config.setJdbcUrl(conn.getDsn());
        if (conn.getUsername() != null) {
            config.setUsername(conn.getUsername());
        }
        if (conn.getPassword() != null) {
            config.setPassword(conn.getPassword());
        }
        config.setMaximumPoolSize(conn.getMaxOpenConns());
        config.setMinimumIdle(conn.getMaxIdleConns());
        config.setMaxLifetime(family.getConnMaxLifetime().toMillis());
        // fail construction when the first connection cannot be made
        config.setInitializationFailTimeout(1);
        config.setReadOnly(role == SqlDb.Role.REPLICA);
        return config;
    }
}
