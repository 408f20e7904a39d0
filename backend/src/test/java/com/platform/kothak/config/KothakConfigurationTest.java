package com.platform.kothak.config;

import com.platform.kothak.connectors.redis.LettuceRedisConnector;
import com.platform.kothak.connectors.sqldb.HikariSqlDbConnector;
import com.platform.kothak.connectors.sqldb.SqlDb;
import com.platform.kothak.core.Kothak;
import com.platform.kothak.core.ProcessTerminator;
import com.platform.kothak.error.ResourceConnectException;
import com.platform.kothak.model.ResourceFamily;
import com.platform.kothak.observability.MetricsRegistry;
import com.platform.kothak.observability.TracingConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class KothakConfigurationTest {
    
    @TempDir
    Path storageRoot;
    
    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
            .withUserConfiguration(KothakConfiguration.class, TracingConfig.class, MetricsRegistry.class,
                HikariSqlDbConnector.class, LettuceRedisConnector.class)
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withPropertyValues(
                "kothak.local-storage-root=" + storageRoot,
                "kothak.database.retry-interval=10ms",
                "kothak.database.sqldbs[0].name=orders",
                "kothak.database.sqldbs[0].driver=h2",
                "kothak.database.sqldbs[0].leader.dsn=jdbc:h2:mem:context-orders;DB_CLOSE_DELAY=-1",
                "kothak.object-storage[0].name=uploads",
                "kothak.object-storage[0].provider=local",
                "kothak.object-storage[0].bucket=uploads");
    }
    
    @Test
    void bringsUpConfiguredResourcesAndClosesThemWithContext() {
        AtomicReference<SqlDb> orders = new AtomicReference<>();
        
        runner().run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(ProcessTerminator.class);
            Kothak kothak = context.getBean(Kothak.class);
            assertThat(kothak.names(ResourceFamily.DATABASE)).containsExactly("orders");
            assertThat(kothak.names(ResourceFamily.OBJECT_STORAGE)).containsExactly("uploads");
            assertThat(storageRoot.resolve("uploads")).isDirectory();
            orders.set(kothak.getSqlDb("orders"));
        });
        
        assertThat(orders.get().getLeader().isClosed()).isTrue();
    }
    
    @Test
    void failedResourceFailsStartupByDefault() {
        runner()
            .withPropertyValues(
                "kothak.database.max-retry=0",
                "kothak.database.sqldbs[1].name=legacy",
                "kothak.database.sqldbs[1].driver=db2",
                "kothak.database.sqldbs[1].leader.dsn=jdbc:db2://host/legacy")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(ResourceConnectException.class)
                    .hasStackTraceContaining("failed to come up");
            });
    }
    
    @Test
    void partialBringUpKeepsHealthyResources() {
        runner()
            .withPropertyValues(
                "kothak.allow-partial-bring-up=true",
                "kothak.database.max-retry=0",
                "kothak.database.sqldbs[1].name=legacy",
                "kothak.database.sqldbs[1].driver=db2",
                "kothak.database.sqldbs[1].leader.dsn=jdbc:db2://host/legacy")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(Kothak.class).names(ResourceFamily.DATABASE)).containsExactly("orders");
            });
    }
    
    @Test
    void invalidConfigurationFailsStartup() {
        runner()
            .withPropertyValues("kothak.redis.connections[0].name=cache")
            .run(context -> assertThat(context.getStartupFailure())
                .hasStackTraceContaining("kothak.redis.connections[0].address"));
    }
}
