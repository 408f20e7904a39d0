package com.platform.kothak.connectors.objectstorage.gcs;

import com.google.auth.oauth2.GoogleCredentials;

/**
 * Settings for one Google Cloud Storage bucket.
 */
public record GcsProviderConfig(
    GoogleCredentials credentials,
    String bucket,
    String bucketProto,
    String bucketUrl
) {}
