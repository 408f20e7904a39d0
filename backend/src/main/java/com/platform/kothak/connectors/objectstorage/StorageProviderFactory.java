package com.platform.kothak.connectors.objectstorage;

import com.platform.kothak.config.ObjectStorageConfig;

import java.util.Set;

/**
 * Builds a connected {@link StorageProvider} in three steps:
 * credentials, provider configuration, connect.
 *
 * @param <C> credential type
 * @param <P> provider configuration type
 */
public interface StorageProviderFactory<C, P> {
    
    /**
     * Lower-case provider identifiers this factory serves.
     */
    Set<String> providerIds();
    
    C loadCredentials(ObjectStorageConfig config) throws Exception;
    
    P buildConfig(ObjectStorageConfig config, C credentials) throws Exception;
    
    StorageProvider connect(P providerConfig) throws Exception;
}
