package com.platform.kothak.config;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything Kothak brings up, bound from {@code kothak.*}.
 */
@Data
@ConfigurationProperties(prefix = "kothak")
public class KothakProperties {
    
    private DatabaseConfig database = new DatabaseConfig();
    
    private RedisConfig redis = new RedisConfig();
    
    private List<ObjectStorageConfig> objectStorage = new ArrayList<>();
    
    /**
     * Keep running with the resources that did come up when some failed.
     */
    private boolean allowPartialBringUp = false;
    
    /**
     * Directory under which {@code local} object storage buckets are created.
     */
    private String localStorageRoot = ".";
    
    @Setter(AccessLevel.NONE)
    private boolean defaulted;
    
    /**
     * Apply defaults and validate every family. Runs once; later calls are no-ops.
     *
     * @throws com.platform.kothak.error.ConfigurationException on the first invalid value
     */
    public synchronized void setDefault() {
        if (defaulted) {
            return;
        }
        database.setDefault();
        redis.setDefault();
        
        Set<String> names = new HashSet<>();
        for (int i = 0; i < objectStorage.size(); i++) {
            String path = "kothak.object-storage[" + i + "].name";
            ConfigChecks.requireText(path, objectStorage.get(i).getName());
            ConfigChecks.requireUnique(path, objectStorage.get(i).getName(), names);
        }
        defaulted = true;
    }
}
