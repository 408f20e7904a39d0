package com.platform.kothak.connectors.redis;

import com.platform.kothak.config.RedisConfig;
import com.platform.kothak.config.RedisConnConfig;

/**
 * Opens a pooled connection to one configured Redis endpoint.
 */
public interface RedisConnector {
    
    /**
     * @param connection the endpoint
     * @param family defaulted pool sizing and timeout shared by all endpoints
     * @return a handle that has answered PING
     * @throws com.platform.kothak.error.ResourceConnectException if the endpoint is unreachable
     */
    Redis connect(RedisConnConfig connection, RedisConfig family);
}
