package com.platform.kothak.connectors.objectstorage.gcs;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import com.platform.kothak.config.ObjectStorageConfig;
import com.platform.kothak.connectors.objectstorage.StorageProvider;
import com.platform.kothak.connectors.objectstorage.StorageProviderFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Google Cloud Storage, authenticated with a service account JSON key file.
 */
public class GcsStorageProviderFactory implements StorageProviderFactory<GoogleCredentials, GcsProviderConfig> {
    
    @Override
    public Set<String> providerIds() {
        return Set.of(GcsStorageProvider.TYPE);
    }
    
    @Override
    public GoogleCredentials loadCredentials(ObjectStorageConfig config) throws IOException {
        String jsonKey = config.getGcs() != null ? config.getGcs().getJsonKey() : null;
        if (jsonKey == null || jsonKey.isBlank()) {
            throw new IllegalArgumentException("gcs.json-key must not be blank");
        }
        try (InputStream in = Files.newInputStream(Path.of(jsonKey))) {
            return GoogleCredentials.fromStream(in);
        }
    }
    
    @Override
    public GcsProviderConfig buildConfig(ObjectStorageConfig config, GoogleCredentials credentials) {
        if (config.getBucket() == null || config.getBucket().isBlank()) {
            throw new IllegalArgumentException("bucket must not be blank");
        }
        return new GcsProviderConfig(credentials, config.getBucket(), config.getBucketProto(), config.getBucketUrl());
    }
    
    @Override
    public StorageProvider connect(GcsProviderConfig providerConfig) {
        Storage storage = StorageOptions.newBuilder()
            .setCredentials(providerConfig.credentials())
            .build()
            .getService();
        return new GcsStorageProvider(storage, providerConfig.bucket());
    }
}
