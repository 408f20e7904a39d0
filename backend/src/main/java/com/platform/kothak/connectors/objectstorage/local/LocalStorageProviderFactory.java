package com.platform.kothak.connectors.objectstorage.local;

import com.platform.kothak.config.ObjectStorageConfig;
import com.platform.kothak.connectors.objectstorage.StorageProvider;
import com.platform.kothak.connectors.objectstorage.StorageProviderFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Directory-backed buckets under a root directory. Needs no credentials,
 * and buckets are kept when the handle is closed.
 */
public class LocalStorageProviderFactory implements StorageProviderFactory<Void, LocalProviderConfig> {
    
    private final Path root;
    
    public LocalStorageProviderFactory(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }
    
    @Override
    public Set<String> providerIds() {
        return Set.of(LocalStorageProvider.TYPE);
    }
    
    @Override
    public Void loadCredentials(ObjectStorageConfig config) {
        return null;
    }
    
    @Override
    public LocalProviderConfig buildConfig(ObjectStorageConfig config, Void credentials) {
        String bucket = config.getBucket();
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket must not be blank");
        }
        Path directory = root.resolve(bucket).normalize();
        if (!directory.startsWith(root)) {
            throw new IllegalArgumentException("bucket '" + bucket + "' resolves outside " + root);
        }
        return new LocalProviderConfig(bucket, directory, false);
    }
    
    @Override
    public StorageProvider connect(LocalProviderConfig providerConfig) throws IOException {
        Files.createDirectories(providerConfig.directory());
        return new LocalStorageProvider(providerConfig);
    }
}
