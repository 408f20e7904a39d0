package com.platform.kothak.config;

import lombok.Data;

/**
 * One named object storage bucket. Only the credential block matching
 * {@link #provider} is read.
 */
@Data
public class ObjectStorageConfig {
    
    private String name;
    
    /**
     * {@code local}, {@code gcs}, {@code s3}, {@code do} or {@code minio}; case-insensitive.
     */
    private String provider;
    
    private String bucket;
    
    /**
     * Scheme used when building public object URLs, e.g. {@code https}.
     */
    private String bucketProto;
    
    /**
     * Host (and optional path) used when building public object URLs.
     */
    private String bucketUrl;
    
    private String region;
    
    private String endpoint;
    
    private Gcs gcs = new Gcs();
    
    private S3 s3 = new S3();
    
    @Data
    public static class Gcs {
        /**
         * Path to the service account JSON key file.
         */
        private String jsonKey;
    }
    
    @Data
    public static class S3 {
        private String clientId;
        
        private String clientSecret;
        
        private boolean disableSsl;
        
        private boolean forcePathStyle;
    }
}
