package com.platform.kothak.connectors.objectstorage.local;

import com.platform.kothak.config.ObjectStorageConfig;
import com.platform.kothak.connectors.objectstorage.ObjectStorage;
import com.platform.kothak.error.SystemUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalStorageProviderTest {
    
    @TempDir
    Path root;
    
    @Test
    void storesObjectsUnderBucketDirectory() throws IOException {
        LocalStorageProviderFactory factory = new LocalStorageProviderFactory(root);
        LocalStorageProvider provider = (LocalStorageProvider) factory.connect(
            factory.buildConfig(config("avatars"), null));
        
        provider.put("users/42.png", "png".getBytes(StandardCharsets.UTF_8), "image/png");
        
        assertThat(root.resolve("avatars/users/42.png")).hasContent("png");
        assertThat(provider.get("users/42.png")).asString(StandardCharsets.UTF_8).isEqualTo("png");
        
        provider.delete("users/42.png");
        assertThat(root.resolve("avatars/users/42.png")).doesNotExist();
    }
    
    @Test
    void rejectsKeysOutsideBucket() throws IOException {
        LocalStorageProviderFactory factory = new LocalStorageProviderFactory(root);
        ObjectStorage storage = open(factory, "avatars");
        
        assertThatThrownBy(() -> storage.put("../escape.txt", new byte[0], "text/plain"))
            .isInstanceOf(SystemUnavailableException.class)
            .hasMessageContaining("invalid object key");
    }
    
    @Test
    void rejectsBucketOutsideRoot() {
        LocalStorageProviderFactory factory = new LocalStorageProviderFactory(root);
        
        assertThatThrownBy(() -> factory.buildConfig(config("../outside"), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void closeKeepsBucketByDefault() throws IOException {
        LocalStorageProviderFactory factory = new LocalStorageProviderFactory(root);
        ObjectStorage storage = open(factory, "reports");
        storage.put("a.txt", "a".getBytes(StandardCharsets.UTF_8), "text/plain");
        
        storage.close();
        
        assertThat(root.resolve("reports/a.txt")).exists();
    }
    
    @Test
    void closeDeletesTemporaryBucket() throws IOException {
        Path directory = root.resolve("scratch");
        LocalStorageProvider provider = (LocalStorageProvider) new LocalStorageProviderFactory(root)
            .connect(new LocalProviderConfig("scratch", directory, true));
        provider.put("nested/b.txt", "b".getBytes(StandardCharsets.UTF_8), "text/plain");
        
        provider.close();
        
        assertThat(directory).doesNotExist();
    }
    
    @Test
    void objectUrlUsesBucketUrl() throws IOException {
        LocalStorageProviderFactory factory = new LocalStorageProviderFactory(root);
        ObjectStorage withUrl = new ObjectStorage("assets",
            factory.connect(factory.buildConfig(config("assets"), null)), null, "cdn.example.com/");
        ObjectStorage withoutUrl = new ObjectStorage("plain",
            factory.connect(factory.buildConfig(config("plain"), null)), "http", null);
        
        assertThat(withUrl.objectUrl("/img/logo.svg")).contains("https://cdn.example.com/img/logo.svg");
        assertThat(withoutUrl.objectUrl("img/logo.svg")).isEmpty();
    }
    
    private static ObjectStorageConfig config(String bucket) {
        ObjectStorageConfig config = new ObjectStorageConfig();
        config.setName(bucket);
        config.setProvider("local");
        config.setBucket(bucket);
        return config;
    }
    
    private static ObjectStorage open(LocalStorageProviderFactory factory, String bucket) throws IOException {
        return new ObjectStorage(bucket, factory.connect(factory.buildConfig(config(bucket), null)), null, null);
    }
}
