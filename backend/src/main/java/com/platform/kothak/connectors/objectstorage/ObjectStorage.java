package com.platform.kothak.connectors.objectstorage;

import com.platform.kothak.error.SystemUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Named object storage handle. Hides which provider sits behind it.
 */
@Slf4j
public class ObjectStorage implements AutoCloseable {
    
    private static final String DEFAULT_BUCKET_PROTO = "https";
    
    private final String name;
    private final StorageProvider provider;
    private final String bucketProto;
    private final String bucketUrl;
    
    public ObjectStorage(String name, StorageProvider provider, String bucketProto, String bucketUrl) {
        this.name = Objects.requireNonNull(name, "name");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.bucketProto = bucketProto == null || bucketProto.isBlank() ? DEFAULT_BUCKET_PROTO : bucketProto;
        this.bucketUrl = bucketUrl;
    }
    
    public String getName() {
        return name;
    }
    
    public String getProviderType() {
        return provider.type();
    }
    
    public String getBucket() {
        return provider.bucket();
    }
    
    public void put(String key, byte[] content, String contentType) {
        try {
            provider.put(key, content, contentType);
        } catch (IOException e) {
            throw failure("put", key, e);
        }
    }
    
    public byte[] get(String key) {
        try {
            return provider.get(key);
        } catch (IOException e) {
            throw failure("get", key, e);
        }
    }
    
    public void delete(String key) {
        try {
            provider.delete(key);
        } catch (IOException e) {
            throw failure("delete", key, e);
        }
    }
    
    /**
     * Public URL of an object, when a bucket URL is configured.
     */
    public Optional<String> objectUrl(String key) {
        if (bucketUrl == null || bucketUrl.isBlank()) {
            return Optional.empty();
        }
        String base = bucketUrl.endsWith("/") ? bucketUrl.substring(0, bucketUrl.length() - 1) : bucketUrl;
        String path = key.startsWith("/") ? key.substring(1) : key;
        return Optional.of(bucketProto + "://" + base + "/" + path);
    }
    
    @Override
    public void close() throws IOException {
        log.debug("Closing object storage {} ({})", name, provider.type());
        provider.close();
    }
    
    private SystemUnavailableException failure(String operation, String key, IOException cause) {
        return SystemUnavailableException.objectStorage(name,
            String.format("object storage %s: %s %s failed: %s", name, operation, key, cause.getMessage()), cause);
    }
}
