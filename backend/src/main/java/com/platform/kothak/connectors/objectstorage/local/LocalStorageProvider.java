package com.platform.kothak.connectors.objectstorage.local;

import com.platform.kothak.connectors.objectstorage.StorageProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores objects as files under the bucket directory.
 */
@Slf4j
public class LocalStorageProvider implements StorageProvider {
    
    static final String TYPE = "local";
    
    private final LocalProviderConfig config;
    
    public LocalStorageProvider(LocalProviderConfig config) {
        this.config = config;
    }
    
    @Override
    public String type() {
        return TYPE;
    }
    
    @Override
    public String bucket() {
        return config.bucket();
    }
    
    public Path directory() {
        return config.directory();
    }
    
    @Override
    public void put(String key, byte[] content, String contentType) throws IOException {
        Path target = resolve(key);
        Files.createDirectories(target.getParent());
        Files.write(target, content);
    }
    
    @Override
    public byte[] get(String key) throws IOException {
        return Files.readAllBytes(resolve(key));
    }
    
    @Override
    public void delete(String key) throws IOException {
        Files.deleteIfExists(resolve(key));
    }
    
    @Override
    public void close() throws IOException {
        if (!config.deleteOnClose()) {
            return;
        }
        log.debug("Deleting local bucket {}", config.directory());
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(config.directory())) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }
    
    private Path resolve(String key) throws IOException {
        Path target = config.directory().resolve(key).normalize();
        if (!target.startsWith(config.directory()) || target.equals(config.directory())) {
            throw new IOException("invalid object key: " + key);
        }
        return target;
    }
}
