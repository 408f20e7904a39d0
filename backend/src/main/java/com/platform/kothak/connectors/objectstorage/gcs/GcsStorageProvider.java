package com.platform.kothak.connectors.objectstorage.gcs;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.platform.kothak.connectors.objectstorage.StorageProvider;

import java.io.IOException;

/**
 * Objects in one Google Cloud Storage bucket.
 */
public class GcsStorageProvider implements StorageProvider {
    
    static final String TYPE = "gcs";
    
    private final Storage storage;
    private final String bucket;
    
    public GcsStorageProvider(Storage storage, String bucket) {
        this.storage = storage;
        this.bucket = bucket;
    }
    
    @Override
    public String type() {
        return TYPE;
    }
    
    @Override
    public String bucket() {
        return bucket;
    }
    
    @Override
    public void put(String key, byte[] content, String contentType) throws IOException {
        BlobInfo blob = BlobInfo.newBuilder(BlobId.of(bucket, key))
            .setContentType(contentType)
            .build();
        try {
            storage.create(blob, content);
        } catch (StorageException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
    
    @Override
    public byte[] get(String key) throws IOException {
        try {
            return storage.readAllBytes(BlobId.of(bucket, key));
        } catch (StorageException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
    
    @Override
    public void delete(String key) throws IOException {
        try {
            storage.delete(BlobId.of(bucket, key));
        } catch (StorageException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
    
    @Override
    public void close() throws IOException {
        // only the gRPC-capable client releases anything on close
        Object client = storage;
        if (!(client instanceof AutoCloseable closeable)) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            throw new IOException("closing gcs client failed: " + e.getMessage(), e);
        }
    }
}
