package com.platform.kothak.connectors.redis;

import com.platform.kothak.error.SystemUnavailableException;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPool;

import java.util.function.Function;

/**
 * {@link Redis} backed by a Lettuce client and a commons-pool2 connection pool.
 */
@Slf4j
public class LettuceRedis implements Redis {
    
    private final String name;
    private final RedisClient client;
    private final GenericObjectPool<StatefulRedisConnection<String, String>> pool;
    
    public LettuceRedis(String name, RedisClient client,
                        GenericObjectPool<StatefulRedisConnection<String, String>> pool) {
        this.name = name;
        this.client = client;
        this.pool = pool;
    }
    
    @Override
    public String getName() {
        return name;
    }
    
    @Override
    public String ping() {
        return execute(RedisCommands::ping);
    }
    
    @Override
    public String get(String key) {
        return execute(commands -> commands.get(key));
    }
    
    @Override
    public void set(String key, String value) {
        execute(commands -> commands.set(key, value));
    }
    
    @Override
    public long delete(String... keys) {
        Long removed = execute(commands -> commands.del(keys));
        return removed != null ? removed : 0L;
    }
    
    @Override
    public <T> T execute(Function<RedisCommands<String, String>, T> action) {
        try (StatefulRedisConnection<String, String> connection = pool.borrowObject()) {
            return action.apply(connection.sync());
        } catch (Exception e) {
            throw SystemUnavailableException.redis(name, 
                String.format("redis %s: %s", name, e.getMessage()), e);
        }
    }
    
    @Override
    public void close() {
        log.debug("Closing redis {}", name);
        try {
            pool.close();
        } finally {
            client.shutdown();
        }
    }
}
