package com.platform.kothak.connectors.objectstorage.local;

import java.nio.file.Path;

/**
 * Directory backing a local bucket.
 */
public record LocalProviderConfig(
    String bucket,
    Path directory,
    boolean deleteOnClose
) {}
