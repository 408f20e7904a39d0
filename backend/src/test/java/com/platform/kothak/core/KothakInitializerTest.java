package com.platform.kothak.core;

import com.platform.kothak.config.KothakProperties;
import com.platform.kothak.config.ObjectStorageConfig;
import com.platform.kothak.config.RedisConnConfig;
import com.platform.kothak.config.SqlDbConfig;
import com.platform.kothak.connectors.objectstorage.StorageProviderResolver;
import com.platform.kothak.connectors.redis.Redis;
import com.platform.kothak.connectors.redis.RedisConnector;
import com.platform.kothak.connectors.sqldb.SqlDb;
import com.platform.kothak.connectors.sqldb.SqlDbConnector;
import com.platform.kothak.error.ConfigurationException;
import com.platform.kothak.error.ProviderNotFoundException;
import com.platform.kothak.error.ResourceConnectException;
import com.platform.kothak.model.ResourceFailure;
import com.platform.kothak.model.ResourceFamily;
import com.platform.kothak.observability.MetricsRegistry;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KothakInitializerTest {
    
    @TempDir
    Path storageRoot;
    
    private SqlDbConnector sqlDbConnector;
    private RedisConnector redisConnector;
    private SimpleMeterRegistry meterRegistry;
    private KothakInitializer initializer;
    
    @BeforeEach
    void setUp() {
        sqlDbConnector = mock(SqlDbConnector.class);
        redisConnector = mock(RedisConnector.class);
        meterRegistry = new SimpleMeterRegistry();
        initializer = new KothakInitializer(
            sqlDbConnector,
            redisConnector,
            StorageProviderResolver.defaults(storageRoot),
            new MetricsRegistry(meterRegistry),
            OpenTelemetry.noop().getTracer("test"),
            cause -> cause);
        
        when(sqlDbConnector.connect(any(), any(), any())).thenAnswer(inv -> mock(HikariDataSource.class));
        when(redisConnector.connect(any(), any())).thenAnswer(inv -> mock(Redis.class));
    }
    
    @Test
    void initialize_registersEveryResource() {
        KothakProperties properties = new KothakProperties();
        properties.getDatabase().getSqldbs().add(sqlDb("orders"));
        properties.getRedis().getConnections().add(new RedisConnConfig("cache", "localhost:6379"));
        properties.getObjectStorage().add(localStorage("uploads"));
        
        BringUpResult result = initializer.initialize(properties);
        
        assertThat(result.isComplete()).isTrue();
        assertThat(result.firstError()).isEmpty();
        Kothak kothak = result.orElseThrow();
        assertThat(kothak.getSqlDb("orders").getName()).isEqualTo("orders");
        assertThat(kothak.getRedis("cache")).isNotNull();
        assertThat(kothak.getObjectStorage("uploads").getProviderType()).isEqualTo("local");
        assertThat(kothak.size()).isEqualTo(3);
        assertThat(meterRegistry.get("kothak.connection.success").tag("family", "database").counter().count())
            .isEqualTo(1.0);
    }
    
    @Test
    void initialize_emptyConfigurationYieldsEmptyRegistry() {
        BringUpResult result = initializer.initialize(new KothakProperties());
        
        assertThat(result.isComplete()).isTrue();
        assertThat(result.kothak().size()).isZero();
    }
    
    @Test
    void initialize_databaseWithoutReplicaSharesLeaderPool() {
        KothakProperties properties = new KothakProperties();
        properties.getDatabase().getSqldbs().add(sqlDb("orders"));
        
        SqlDb sqlDb = initializer.initialize(properties).orElseThrow().getSqlDb("orders");
        
        assertThat(sqlDb.getFollower()).isSameAs(sqlDb.getLeader());
        verify(sqlDbConnector, times(1)).connect(any(), any(), eq(SqlDb.Role.LEADER));
        verify(sqlDbConnector, never()).connect(any(), any(), eq(SqlDb.Role.REPLICA));
    }
    
    @Test
    void initialize_databaseWithReplicaOpensSecondPool() {
        KothakProperties properties = new KothakProperties();
        SqlDbConfig db = sqlDb("orders");
        db.getReplica().setDsn("jdbc:h2:mem:orders-replica");
        properties.getDatabase().getSqldbs().add(db);
        
        SqlDb sqlDb = initializer.initialize(properties).orElseThrow().getSqlDb("orders");
        
        assertThat(sqlDb.hasDedicatedFollower()).isTrue();
    }
    
    @Test
    void initialize_replicaFailureClosesLeaderAndFailsDatabase() {
        HikariDataSource leader = mock(HikariDataSource.class);
        doReturn(leader).when(sqlDbConnector).connect(any(), any(), eq(SqlDb.Role.LEADER));
        doThrow(new IllegalStateException("replica down"))
            .when(sqlDbConnector).connect(any(), any(), eq(SqlDb.Role.REPLICA));
        KothakProperties properties = new KothakProperties();
        SqlDbConfig db = sqlDb("orders");
        db.getReplica().setDsn("jdbc:h2:mem:orders-replica");
        properties.getDatabase().getSqldbs().add(db);
        
        BringUpResult result = initializer.initialize(properties);
        
        assertThat(result.isComplete()).isFalse();
        assertThat(result.kothak().names(ResourceFamily.DATABASE)).isEmpty();
        verify(leader).close();
    }
    
    @Test
    void initialize_collectsEveryFailureAndKeepsSuccesses() {
        doThrow(ResourceConnectException.unsupportedDriver("broken", "db2"))
            .when(sqlDbConnector).connect(any(), argThat(db -> "broken".equals(db.getName())), any());
        doThrow(new IllegalStateException("connection refused"))
            .when(redisConnector).connect(argThat(c -> "sessions".equals(c.getName())), any());
        
        KothakProperties properties = new KothakProperties();
        properties.getDatabase().getSqldbs().add(sqlDb("orders"));
        properties.getDatabase().getSqldbs().add(sqlDb("broken"));
        properties.getRedis().getConnections().add(new RedisConnConfig("cache", "localhost:6379"));
        properties.getRedis().getConnections().add(new RedisConnConfig("sessions", "localhost:6380"));
        properties.getObjectStorage().add(localStorage("uploads"));
        ObjectStorageConfig ftp = localStorage("legacy");
        ftp.setProvider("ftp");
        properties.getObjectStorage().add(ftp);
        
        BringUpResult result = initializer.initialize(properties);
        
        assertThat(result.isComplete()).isFalse();
        assertThat(result.failures())
            .extracting(ResourceFailure::family, ResourceFailure::name)
            .containsExactly(
                tuple(ResourceFamily.DATABASE, "broken"),
                tuple(ResourceFamily.REDIS, "sessions"),
                tuple(ResourceFamily.OBJECT_STORAGE, "legacy"));
        assertThat(result.failures().get(1).cause())
            .isInstanceOf(ResourceConnectException.class)
            .hasMessageContaining("connection refused");
        assertThat(result.failures().get(2).cause()).isInstanceOf(ProviderNotFoundException.class);
        assertThat(result.firstError()).containsInstanceOf(ResourceConnectException.class);
        
        Kothak kothak = result.kothak();
        assertThat(kothak.names(ResourceFamily.DATABASE)).containsExactly("orders");
        assertThat(kothak.names(ResourceFamily.REDIS)).containsExactly("cache");
        assertThat(kothak.names(ResourceFamily.OBJECT_STORAGE)).containsExactly("uploads");
        assertThat(meterRegistry.get("kothak.connection.failure").tag("family", "redis").counter().count())
            .isEqualTo(1.0);
    }
    
    @Test
    void initialize_unknownProviderFailsOnlyThatBucket() {
        KothakProperties properties = new KothakProperties();
        properties.getDatabase().getSqldbs().add(sqlDb("orders"));
        properties.getRedis().getConnections().add(new RedisConnConfig("cache", "localhost:6379"));
        for (int i = 0; i < 4; i++) {
            properties.getObjectStorage().add(localStorage("bucket-" + i));
        }
        ObjectStorageConfig ftp = localStorage("archive");
        ftp.setProvider("ftp");
        properties.getObjectStorage().add(2, ftp);
        
        BringUpResult result = initializer.initialize(properties);
        
        assertThat(result.firstError()).containsInstanceOf(ProviderNotFoundException.class);
        assertThat(result.failures()).singleElement().extracting(ResourceFailure::name).isEqualTo("archive");
        assertThat(result.kothak().names(ResourceFamily.OBJECT_STORAGE))
            .containsExactly("bucket-0", "bucket-1", "bucket-2", "bucket-3");
        assertThat(result.kothak().names(ResourceFamily.DATABASE)).containsExactly("orders");
        assertThat(result.kothak().names(ResourceFamily.REDIS)).containsExactly("cache");
    }
    
    @Test
    void initialize_invalidConfigurationConnectsNothing() {
        KothakProperties properties = new KothakProperties();
        properties.getDatabase().getSqldbs().add(sqlDb("orders"));
        properties.getRedis().getConnections().add(new RedisConnConfig("cache", " "));
        
        assertThatThrownBy(() -> initializer.initialize(properties))
            .isInstanceOf(ConfigurationException.class);
        
        verify(sqlDbConnector, never()).connect(any(), any(), any());
        verify(redisConnector, never()).connect(any(), any());
    }
    
    @Test
    void initialize_runsResourcesConcurrently() {
        int count = 8;
        CountDownLatch allStarted = new CountDownLatch(count);
        doAnswer(inv -> {
            allStarted.countDown();
            if (!allStarted.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("resources were brought up one at a time");
            }
            return mock(Redis.class);
        }).when(redisConnector).connect(any(), any());
        KothakProperties properties = new KothakProperties();
        for (int i = 0; i < count; i++) {
            properties.getRedis().getConnections().add(new RedisConnConfig("redis-" + i, "localhost:" + (6379 + i)));
        }
        
        BringUpResult result = initializer.initialize(properties);
        
        assertThat(result.failures()).isEmpty();
        assertThat(result.kothak().size()).isEqualTo(count);
    }
    
    @Test
    void initialize_manyResourcesAllRegisteredInConfigurationOrder() {
        KothakProperties properties = new KothakProperties();
        List<String> expectedDatabases = new ArrayList<>();
        List<String> expectedRedis = new ArrayList<>();
        List<String> expectedStorage = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expectedDatabases.add("db-" + i);
            properties.getDatabase().getSqldbs().add(sqlDb("db-" + i));
            expectedRedis.add("redis-" + i);
            properties.getRedis().getConnections().add(new RedisConnConfig("redis-" + i, "localhost:6379"));
            expectedStorage.add("bucket-" + i);
            properties.getObjectStorage().add(localStorage("bucket-" + i));
        }
        
        Kothak kothak = initializer.initialize(properties).orElseThrow();
        
        assertThat(kothak.size()).isEqualTo(60);
        assertThat(kothak.names(ResourceFamily.DATABASE)).containsExactlyElementsOf(expectedDatabases);
        assertThat(kothak.names(ResourceFamily.REDIS)).containsExactlyElementsOf(expectedRedis);
        assertThat(kothak.names(ResourceFamily.OBJECT_STORAGE)).containsExactlyElementsOf(expectedStorage);
    }
    
    private static SqlDbConfig sqlDb(String name) {
        SqlDbConfig db = new SqlDbConfig();
        db.setName(name);
        db.setDriver("h2");
        db.getLeader().setDsn("jdbc:h2:mem:" + name);
        return db;
    }
    
    private static ObjectStorageConfig localStorage(String name) {
        ObjectStorageConfig config = new ObjectStorageConfig();
        config.setName(name);
        config.setProvider("local");
        config.setBucket(name);
        return config;
    }
}
