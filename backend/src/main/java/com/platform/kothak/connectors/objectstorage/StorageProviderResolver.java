package com.platform.kothak.connectors.objectstorage;

import com.platform.kothak.config.ObjectStorageConfig;
import com.platform.kothak.connectors.objectstorage.gcs.GcsStorageProviderFactory;
import com.platform.kothak.connectors.objectstorage.local.LocalStorageProviderFactory;
import com.platform.kothak.connectors.objectstorage.s3.S3StorageProviderFactory;
import com.platform.kothak.error.KothakException;
import com.platform.kothak.error.ProviderNotFoundException;
import com.platform.kothak.error.ResourceConnectException;
import com.platform.kothak.model.ResourceFamily;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Table of provider identifier to {@link StorageProviderFactory}. Lookup ignores case.
 */
@Slf4j
public class StorageProviderResolver {
    
    private final Map<String, StorageProviderFactory<?, ?>> factories;
    
    public StorageProviderResolver(List<? extends StorageProviderFactory<?, ?>> factories) {
        Map<String, StorageProviderFactory<?, ?>> table = new TreeMap<>();
        for (StorageProviderFactory<?, ?> factory : factories) {
            for (String id : factory.providerIds()) {
                StorageProviderFactory<?, ?> previous = table.putIfAbsent(normalize(id), factory);
                if (previous != null) {
                    throw new IllegalStateException(String.format(
                        "Object storage provider '%s' registered by both %s and %s",
                        id, previous.getClass().getSimpleName(), factory.getClass().getSimpleName()));
                }
            }
        }
        this.factories = Collections.unmodifiableMap(table);
        log.debug("Registered object storage providers: {}", this.factories.keySet());
    }
    
    /**
     * Resolver with the built-in local, GCS and S3-compatible providers.
     */
    public static StorageProviderResolver defaults(Path localRoot) {
        return new StorageProviderResolver(List.of(
            new LocalStorageProviderFactory(localRoot),
            new GcsStorageProviderFactory(),
            new S3StorageProviderFactory()
        ));
    }
    
    public Set<String> providerIds() {
        return factories.keySet();
    }
    
    /**
     * Build and connect the storage described by {@code config}.
     *
     * @throws ProviderNotFoundException if no factory serves the provider identifier
     * @throws ResourceConnectException if credentials, provider config or connect fail
     */
    public ObjectStorage resolve(ObjectStorageConfig config) {
        StorageProviderFactory<?, ?> factory = factories.get(normalize(config.getProvider()));
        if (factory == null) {
            throw new ProviderNotFoundException(config.getName(), config.getProvider());
        }
        StorageProvider provider = create(factory, config);
        return new ObjectStorage(config.getName(), provider, config.getBucketProto(), config.getBucketUrl());
    }
    
    private static <C, P> StorageProvider create(StorageProviderFactory<C, P> factory, ObjectStorageConfig config) {
        String name = config.getName();
        
        C credentials;
        try {
            credentials = factory.loadCredentials(config);
        } catch (KothakException e) {
            throw e;
        } catch (Exception e) {
            throw ResourceConnectException.credentials(name, e);
        }
        
        P providerConfig;
        try {
            providerConfig = factory.buildConfig(config, credentials);
        } catch (KothakException e) {
            throw e;
        } catch (Exception e) {
            throw ResourceConnectException.providerConfig(name, e);
        }
        
        try {
            return factory.connect(providerConfig);
        } catch (KothakException e) {
            throw e;
        } catch (Exception e) {
            throw ResourceConnectException.connect(ResourceFamily.OBJECT_STORAGE, name, e);
        }
    }
    
    private static String normalize(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }
}
