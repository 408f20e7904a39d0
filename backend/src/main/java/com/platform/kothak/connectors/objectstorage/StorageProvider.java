package com.platform.kothak.connectors.objectstorage;

import java.io.IOException;

/**
 * Capability surface shared by every object storage provider.
 */
public interface StorageProvider extends AutoCloseable {
    
    /**
     * Provider identifier, e.g. {@code local}, {@code gcs}, {@code s3}.
     */
    String type();
    
    String bucket();
    
    void put(String key, byte[] content, String contentType) throws IOException;
    
    byte[] get(String key) throws IOException;
    
    void delete(String key) throws IOException;
    
    @Override
    void close() throws IOException;
}
