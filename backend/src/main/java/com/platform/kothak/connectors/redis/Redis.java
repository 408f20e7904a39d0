package com.platform.kothak.connectors.redis;

import io.lettuce.core.api.sync.RedisCommands;

import java.util.function.Function;

/**
 * A pooled connection to one Redis endpoint.
 */
public interface Redis extends AutoCloseable {
    
    String getName();
    
    /**
     * Execute PING.
     * @return the server reply, {@code PONG} when healthy
     */
    String ping();
    
    String get(String key);
    
    void set(String key, String value);
    
    /**
     * @return number of keys removed
     */
    long delete(String... keys);
    
    /**
     * Run commands on one pooled connection.
     */
    <T> T execute(Function<RedisCommands<String, String>, T> action);
    
    /**
     * Close the pool and release the client.
     */
    @Override
    void close();
}
