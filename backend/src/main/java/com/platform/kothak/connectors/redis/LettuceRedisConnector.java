package com.platform.kothak.connectors.redis;

import com.platform.kothak.config.RedisConfig;
import com.platform.kothak.config.RedisConnConfig;
import com.platform.kothak.error.ResourceConnectException;
import com.platform.kothak.model.ResourceFamily;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.support.ConnectionPoolSupport;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Lettuce connector. The pool is sized from the family's {@code max-active} / {@code max-idle}
 * and the endpoint must answer PING before the handle is returned.
 */
@Slf4j
@Component
public class LettuceRedisConnector implements RedisConnector {
    
    @Override
    public Redis connect(RedisConnConfig connection, RedisConfig family) {
        log.info("Attempting to connect to Redis {} at {}", connection.getName(), connection.getAddress());
        long startTime = System.currentTimeMillis();
        
        RedisClient client;
        try {
            client = RedisClient.create(toUri(connection.getAddress(), family.getTimeout()));
        } catch (RuntimeException e) {
            throw ResourceConnectException.connect(ResourceFamily.REDIS, connection.getName(), e);
        }
        client.setOptions(ClientOptions.builder()
            .socketOptions(SocketOptions.builder().connectTimeout(family.getTimeout()).build())
            .timeoutOptions(TimeoutOptions.enabled(family.getTimeout()))
            .build());
        
        GenericObjectPoolConfig<StatefulRedisConnection<String, String>> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(family.getMaxActive());
        poolConfig.setMaxIdle(family.getMaxIdle());
        poolConfig.setMaxWait(family.getTimeout());
        GenericObjectPool<StatefulRedisConnection<String, String>> pool = 
            ConnectionPoolSupport.createGenericObjectPool(() -> client.connect(), poolConfig);
        
        LettuceRedis redis = new LettuceRedis(connection.getName(), client, pool);
        try {
            String response = redis.ping();
            if (!"PONG".equals(response)) {
                throw new IllegalStateException("Unexpected PING response: " + response);
            }
        } catch (RuntimeException e) {
            redis.close();
            throw ResourceConnectException.connect(ResourceFamily.REDIS, connection.getName(), e);
        }
        
        log.info("Successfully connected to Redis {} in {}ms", connection.getName(), 
            System.currentTimeMillis() - startTime);
        return redis;
    }
    
    static RedisURI toUri(String address, Duration timeout) {
        String trimmed = address.trim();
        RedisURI uri = RedisURI.create(trimmed.contains("://") ? trimmed : "redis://" + trimmed);
        uri.setTimeout(timeout);
        return uri;
    }
}
