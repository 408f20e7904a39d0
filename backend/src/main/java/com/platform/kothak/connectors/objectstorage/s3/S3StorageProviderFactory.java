package com.platform.kothak.connectors.objectstorage.s3;

import com.platform.kothak.config.ObjectStorageConfig;
import com.platform.kothak.connectors.objectstorage.StorageProvider;
import com.platform.kothak.connectors.objectstorage.StorageProviderFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.util.Set;

/**
 * AWS S3 and S3-compatible services, authenticated with a client id and secret.
 */
public class S3StorageProviderFactory implements StorageProviderFactory<AwsCredentials, S3ProviderConfig> {
    
    static final String DEFAULT_REGION = "us-east-1";
    
    @Override
    public Set<String> providerIds() {
        return Set.of("s3", "do", "minio");
    }
    
    @Override
    public AwsCredentials loadCredentials(ObjectStorageConfig config) {
        ObjectStorageConfig.S3 s3 = config.getS3();
        if (s3 == null || isBlank(s3.getClientId()) || isBlank(s3.getClientSecret())) {
            throw new IllegalArgumentException("s3.client-id and s3.client-secret must not be blank");
        }
        return AwsBasicCredentials.create(s3.getClientId(), s3.getClientSecret());
    }
    
    @Override
    public S3ProviderConfig buildConfig(ObjectStorageConfig config, AwsCredentials credentials) {
        if (isBlank(config.getBucket())) {
            throw new IllegalArgumentException("bucket must not be blank");
        }
        boolean disableSsl = config.getS3() != null && config.getS3().isDisableSsl();
        boolean forcePathStyle = config.getS3() != null && config.getS3().isForcePathStyle();
        Region region = Region.of(isBlank(config.getRegion()) ? DEFAULT_REGION : config.getRegion().trim());
        
        return new S3ProviderConfig(
            credentials,
            config.getBucket(),
            config.getBucketProto(),
            config.getBucketUrl(),
            region,
            endpoint(config.getEndpoint(), disableSsl),
            forcePathStyle
        );
    }
    
    @Override
    public StorageProvider connect(S3ProviderConfig providerConfig) {
        S3ClientBuilder builder = S3Client.builder()
            .credentialsProvider(StaticCredentialsProvider.create(providerConfig.credentials()))
            .region(providerConfig.region())
            .serviceConfiguration(S3Configuration.builder()
                .pathStyleAccessEnabled(providerConfig.forcePathStyle())
                .build());
        if (providerConfig.endpoint() != null) {
            builder.endpointOverride(providerConfig.endpoint());
        }
        return new S3StorageProvider(builder.build(), providerConfig.bucket());
    }
    
    /**
     * Endpoint without a scheme gets {@code http://} when SSL is disabled, {@code https://} otherwise.
     */
    static URI endpoint(String endpoint, boolean disableSsl) {
        if (isBlank(endpoint)) {
            return null;
        }
        String trimmed = endpoint.trim();
        if (!trimmed.contains("://")) {
            trimmed = (disableSsl ? "http://" : "https://") + trimmed;
        } else if (disableSsl && trimmed.startsWith("https://")) {
            trimmed = "http://" + trimmed.substring("https://".length());
        }
        return URI.create(trimmed);
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
