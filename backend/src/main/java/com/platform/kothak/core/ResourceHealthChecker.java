package com.platform.kothak.core;

import com.platform.kothak.connectors.redis.Redis;
import com.platform.kothak.connectors.sqldb.SqlDb;
import com.platform.kothak.model.ConnectionStatus;
import com.platform.kothak.model.ResourceFamily;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;

/**
 * On-demand health probe for registered resources.
 */
@Slf4j
public class ResourceHealthChecker {
    
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;
    
    private final Kothak kothak;
    
    public ResourceHealthChecker(Kothak kothak) {
        this.kothak = kothak;
    }
    
    /**
     * Probe one resource. Object storage has no cheap probe and reports UNKNOWN.
     *
     * @throws com.platform.kothak.error.ResourceNotFoundException if the name is not registered
     */
    public ConnectionStatus check(ResourceFamily family, String name) {
        return switch (family) {
            case DATABASE -> checkSqlDb(kothak.getSqlDb(name));
            case REDIS -> checkRedis(kothak.getRedis(name));
            case OBJECT_STORAGE -> {
                kothak.getObjectStorage(name);
                yield ConnectionStatus.unknown(family, name);
            }
        };
    }
    
    private ConnectionStatus checkSqlDb(SqlDb sqlDb) {
        long startTime = System.currentTimeMillis();
        try (Connection connection = sqlDb.getWriteConnection()) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                return ConnectionStatus.down(ResourceFamily.DATABASE, sqlDb.getName(), "Connection is not valid");
            }
            return ConnectionStatus.up(ResourceFamily.DATABASE, sqlDb.getName(), 
                System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            log.warn("Health check failed for sql database {}: {}", sqlDb.getName(), e.getMessage());
            return ConnectionStatus.down(ResourceFamily.DATABASE, sqlDb.getName(), e.getMessage());
        }
    }
    
    private ConnectionStatus checkRedis(Redis redis) {
        long startTime = System.currentTimeMillis();
        try {
            String reply = redis.ping();
            if (!"PONG".equalsIgnoreCase(reply)) {
                return ConnectionStatus.down(ResourceFamily.REDIS, redis.getName(), "Unexpected PING reply: " + reply);
            }
            return ConnectionStatus.up(ResourceFamily.REDIS, redis.getName(), 
                System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            log.warn("Health check failed for redis {}: {}", redis.getName(), e.getMessage());
            return ConnectionStatus.down(ResourceFamily.REDIS, redis.getName(), e.getMessage());
        }
    }
}
