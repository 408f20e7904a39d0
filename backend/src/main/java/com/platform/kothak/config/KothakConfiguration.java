package com.platform.kothak.config;

import com.platform.kothak.connectors.objectstorage.StorageProviderFactory;
import com.platform.kothak.connectors.objectstorage.StorageProviderResolver;
import com.platform.kothak.connectors.objectstorage.gcs.GcsStorageProviderFactory;
import com.platform.kothak.connectors.objectstorage.local.LocalStorageProviderFactory;
import com.platform.kothak.connectors.objectstorage.s3.S3StorageProviderFactory;
import com.platform.kothak.connectors.redis.RedisConnector;
import com.platform.kothak.connectors.sqldb.SqlDbConnector;
import com.platform.kothak.core.BringUpResult;
import com.platform.kothak.core.Kothak;
import com.platform.kothak.core.KothakInitializer;
import com.platform.kothak.core.ProcessTerminator;
import com.platform.kothak.core.ResourceHealthChecker;
import com.platform.kothak.error.BringUpException;
import com.platform.kothak.error.ResourceCloseException;
import com.platform.kothak.lifecycle.ResourceShutdownManager;
import com.platform.kothak.model.ResourceFailure;
import com.platform.kothak.observability.MetricsRegistry;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

/**
 * Wires the bring-up pipeline and exposes the resulting {@link Kothak} registry as a bean.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(KothakProperties.class)
public class KothakConfiguration {
    
    @Bean
    public LocalStorageProviderFactory localStorageProviderFactory(KothakProperties properties) {
        return new LocalStorageProviderFactory(Path.of(properties.getLocalStorageRoot()));
    }
    
    @Bean
    public GcsStorageProviderFactory gcsStorageProviderFactory() {
        return new GcsStorageProviderFactory();
    }
    
    @Bean
    public S3StorageProviderFactory s3StorageProviderFactory() {
        return new S3StorageProviderFactory();
    }
    
    /**
     * Every provider factory in the context, keyed by the identifiers it serves.
     */
    @Bean
    public StorageProviderResolver storageProviderResolver(List<StorageProviderFactory<?, ?>> factories) {
        StorageProviderResolver resolver = new StorageProviderResolver(factories);
        log.info("Object storage providers: {}", resolver.providerIds());
        return resolver;
    }
    
    @Bean
    @ConditionalOnMissingBean
    public ProcessTerminator processTerminator() {
        return ProcessTerminator.HALT;
    }
    
    @Bean
    public KothakInitializer kothakInitializer(
            SqlDbConnector sqlDbConnector,
            RedisConnector redisConnector,
            StorageProviderResolver storageProviderResolver,
            MetricsRegistry metricsRegistry,
            Tracer tracer,
            ProcessTerminator processTerminator) {
        return new KothakInitializer(sqlDbConnector, redisConnector, storageProviderResolver,
            metricsRegistry, tracer, processTerminator);
    }
    
    /**
     * Bring up every configured resource. Unless partial bring-up is allowed, any
     * failure closes what did come up and fails the context.
     */
    @Bean
    public Kothak kothak(KothakInitializer initializer, KothakProperties properties) {
        BringUpResult result = initializer.initialize(properties);
        if (result.isComplete()) {
            return result.kothak();
        }
        
        if (!properties.isAllowPartialBringUp()) {
            BringUpException failure = new BringUpException(result.kothak(), result.failures());
            try {
                result.kothak().closeAll();
            } catch (ResourceCloseException e) {
                failure.addSuppressed(e);
            }
            throw failure;
        }
        
        for (ResourceFailure f : result.failures()) {
            log.warn("Continuing without {} {}: {}", f.family().getDisplayName(), f.name(), f.cause().getMessage());
        }
        return result.kothak();
    }
    
    @Bean
    public ResourceHealthChecker resourceHealthChecker(Kothak kothak) {
        return new ResourceHealthChecker(kothak);
    }
    
    @Bean
    public ResourceShutdownManager resourceShutdownManager(Kothak kothak, MetricsRegistry metricsRegistry) {
        return new ResourceShutdownManager(kothak, metricsRegistry);
    }
}
