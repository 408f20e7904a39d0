package com.platform.kothak.connectors.objectstorage.s3;

import com.platform.kothak.connectors.objectstorage.StorageProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;

/**
 * Objects in one S3 (or S3-compatible) bucket.
 */
public class S3StorageProvider implements StorageProvider {
    
    static final String TYPE = "s3";
    
    private final S3Client client;
    private final String bucket;
    
    public S3StorageProvider(S3Client client, String bucket) {
        this.client = client;
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
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(contentType)
            .build();
        try {
            client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
    
    @Override
    public byte[] get(String key) throws IOException {
        try {
            return client.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build())
                .asByteArray();
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
    
    @Override
    public void delete(String key) throws IOException {
        try {
            client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
    
    @Override
    public void close() {
        client.close();
    }
}
