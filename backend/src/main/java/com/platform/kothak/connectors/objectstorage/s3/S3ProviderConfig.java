package com.platform.kothak.connectors.objectstorage.s3;

import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.regions.Region;

import java.net.URI;

/**
 * Settings for one bucket on AWS S3 or an S3-compatible service (DigitalOcean Spaces, MinIO).
 *
 * @param endpoint endpoint override, {@code null} for AWS itself
 */
public record S3ProviderConfig(
    AwsCredentials credentials,
    String bucket,
    String bucketProto,
    String bucketUrl,
    Region region,
    URI endpoint,
    boolean forcePathStyle
) {}
