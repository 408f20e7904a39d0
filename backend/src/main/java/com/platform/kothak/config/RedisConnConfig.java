package com.platform.kothak.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One named Redis endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RedisConnConfig {
    
    private String name;
    
    /**
     * {@code host:port}, or a full {@code redis://} / {@code rediss://} URI.
     */
    private String address;
}
