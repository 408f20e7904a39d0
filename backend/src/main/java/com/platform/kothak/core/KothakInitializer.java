package com.platform.kothak.core;

import com.platform.kothak.config.DatabaseConfig;
import com.platform.kothak.config.KothakProperties;
import com.platform.kothak.config.ObjectStorageConfig;
import com.platform.kothak.config.RedisConfig;
import com.platform.kothak.config.RedisConnConfig;
import com.platform.kothak.config.SqlDbConfig;
import com.platform.kothak.connectors.objectstorage.ObjectStorage;
import com.platform.kothak.connectors.objectstorage.StorageProviderResolver;
import com.platform.kothak.connectors.redis.Redis;
import com.platform.kothak.connectors.redis.RedisConnector;
import com.platform.kothak.connectors.sqldb.SqlDb;
import com.platform.kothak.connectors.sqldb.SqlDbConnector;
import com.platform.kothak.error.ConfigurationException;
import com.platform.kothak.error.KothakException;
import com.platform.kothak.error.ResourceConnectException;
import com.platform.kothak.model.ResourceFailure;
import com.platform.kothak.model.ResourceFamily;
import com.platform.kothak.observability.LoggingConfig;
import com.platform.kothak.observability.MetricsRegistry;
import com.zaxxer.hikari.HikariDataSource;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Brings up every configured database, Redis endpoint and object storage bucket concurrently.
 *
 * Flow:
 * 1. Apply configuration defaults (a failure aborts before anything connects)
 * 2. Start one task per resource on its own thread
 * 3. Wait for every task, successful or not
 * 4. Fold the task outcomes into the registry and the failure list on the calling thread
 *
 * Tasks share no mutable state: each returns its handle or failure to the collector.
 */
@Slf4j
public class KothakInitializer {
    
    private final SqlDbConnector sqlDbConnector;
    private final RedisConnector redisConnector;
    private final StorageProviderResolver storageProviderResolver;
    private final MetricsRegistry metricsRegistry;
    private final Tracer tracer;
    private final ProcessTerminator terminator;
    
    public KothakInitializer(
            SqlDbConnector sqlDbConnector,
            RedisConnector redisConnector,
            StorageProviderResolver storageProviderResolver,
            MetricsRegistry metricsRegistry,
            Tracer tracer,
            ProcessTerminator terminator) {
        this.sqlDbConnector = sqlDbConnector;
        this.redisConnector = redisConnector;
        this.storageProviderResolver = storageProviderResolver;
        this.metricsRegistry = metricsRegistry;
        this.tracer = tracer;
        this.terminator = terminator;
    }
    
    /**
     * Bring up everything in {@code properties}.
     *
     * @return the registry (never null) and every resource-scoped failure
     * @throws ConfigurationException if defaulting fails; nothing has been connected then
     */
    public BringUpResult initialize(KothakProperties properties) {
        Span span = tracer.spanBuilder("kothak/new").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            properties.setDefault();
            
            List<BringUpTask> tasks = planTasks(properties);
            log.info("kothak: bringing up {} resource(s)", tasks.size());
            long startTime = System.currentTimeMillis();
            
            List<BringUpOutcome> outcomes = runAll(tasks);
            BringUpResult result = collect(outcomes);
            
            long duration = System.currentTimeMillis() - startTime;
            if (result.isComplete()) {
                log.info("kothak: {} resource(s) up in {}ms", result.kothak().size(), duration);
            } else {
                log.warn("kothak: {} resource(s) up, {} failed in {}ms", 
                    result.kothak().size(), result.failures().size(), duration);
                span.setStatus(StatusCode.ERROR, result.failures().size() + " resource(s) failed");
            }
            span.setAttribute("kothak.resources.up", result.kothak().size());
            span.setAttribute("kothak.resources.failed", result.failures().size());
            return result;
        } catch (ConfigurationException e) {
            log.error("kothak: invalid configuration: {}", e.getMessage());
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }
    
    private List<BringUpTask> planTasks(KothakProperties properties) {
        List<BringUpTask> tasks = new ArrayList<>();
        
        DatabaseConfig database = properties.getDatabase();
        for (SqlDbConfig db : database.getSqldbs()) {
            tasks.add(new BringUpTask(ResourceFamily.DATABASE, db.getName(), 
                "database/connect/" + db.getName(), () -> connectSqlDb(database, db)));
        }
        
        RedisConfig redis = properties.getRedis();
        for (RedisConnConfig connection : redis.getConnections()) {
            tasks.add(new BringUpTask(ResourceFamily.REDIS, connection.getName(),
                "redis/init/" + connection.getName(), () -> redisConnector.connect(connection, redis)));
        }
        
        for (ObjectStorageConfig storage : properties.getObjectStorage()) {
            tasks.add(new BringUpTask(ResourceFamily.OBJECT_STORAGE, storage.getName(),
                "object_storage/init/" + storage.getName(), () -> storageProviderResolver.resolve(storage)));
        }
        return tasks;
    }
    
    private SqlDb connectSqlDb(DatabaseConfig database, SqlDbConfig db) {
        HikariDataSource leader = sqlDbConnector.connect(database, db, SqlDb.Role.LEADER);
        HikariDataSource follower = leader;
        
        if (db.hasReplica()) {
            try {
                follower = sqlDbConnector.connect(database, db, SqlDb.Role.REPLICA);
            } catch (RuntimeException e) {
                leader.close();
                throw e;
            }
        }
        return new SqlDb(db.getName(), leader, follower);
    }
    
    private List<BringUpOutcome> runAll(List<BringUpTask> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        
        ExecutorService executor = Executors.newCachedThreadPool(new BringUpThreadFactory());
        try {
            List<Future<BringUpOutcome>> futures = new ArrayList<>(tasks.size());
            for (BringUpTask task : tasks) {
                futures.add(executor.submit(Context.current().wrap((Callable<BringUpOutcome>) () -> run(task))));
            }
            
            List<BringUpOutcome> outcomes = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                outcomes.add(await(tasks.get(i), futures.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdown();
        }
    }
    
    /**
     * Wait for one task. Interrupts are deferred so that no task is abandoned.
     */
    private BringUpOutcome await(BringUpTask task, Future<BringUpOutcome> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    return BringUpOutcome.failure(new ResourceFailure(task.family(), task.name(),
                        ResourceConnectException.connect(task.family(), task.name(), cause)));
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
    
    private BringUpOutcome run(BringUpTask task) {
        Span span = tracer.spanBuilder(task.spanName()).startSpan();
        LoggingConfig.setResourceContext(task.family(), task.name());
        long startTime = System.currentTimeMillis();
        
        try (Scope ignored = span.makeCurrent()) {
            AutoCloseable handle = task.action().call();
            long latency = System.currentTimeMillis() - startTime;
            
            metricsRegistry.recordConnectionSuccess(task.family());
            metricsRegistry.recordLatency(task.family(), "connect", latency);
            log.debug("kothak: connected to {} {} in {}ms", task.family().getDisplayName(), task.name(), latency);
            return BringUpOutcome.success(task.family(), task.name(), handle);
            
        } catch (Exception e) {
            KothakException error = e instanceof KothakException kothakException
                ? kothakException
                : ResourceConnectException.connect(task.family(), task.name(), e);
            
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, error.getMessage());
            metricsRegistry.recordConnectionFailure(task.family());
            log.error("kothak: failed to bring up {} {}: {}", 
                task.family().getDisplayName(), task.name(), error.getMessage());
            return BringUpOutcome.failure(new ResourceFailure(task.family(), task.name(), error));
            
        } finally {
            span.end();
            LoggingConfig.clearResourceContext();
        }
    }
    
    /**
     * Single collector: only this thread writes the maps and the failure list.
     */
    private BringUpResult collect(List<BringUpOutcome> outcomes) {
        Map<String, SqlDb> sqlDbs = new LinkedHashMap<>();
        Map<String, Redis> redises = new LinkedHashMap<>();
        Map<String, ObjectStorage> objectStorages = new LinkedHashMap<>();
        List<ResourceFailure> failures = new ArrayList<>();
        
        for (BringUpOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                failures.add(outcome.failure());
                continue;
            }
            switch (outcome.family()) {
                case DATABASE -> sqlDbs.put(outcome.name(), (SqlDb) outcome.handle());
                case REDIS -> redises.put(outcome.name(), (Redis) outcome.handle());
                case OBJECT_STORAGE -> objectStorages.put(outcome.name(), (ObjectStorage) outcome.handle());
            }
        }
        
        return new BringUpResult(new Kothak(sqlDbs, redises, objectStorages, terminator), failures);
    }
    
    private record BringUpTask(
        ResourceFamily family,
        String name,
        String spanName,
        Callable<? extends AutoCloseable> action
    ) {}
    
    private static class BringUpThreadFactory implements ThreadFactory {
        
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
        
        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger threadSequence = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, 
                "kothak-bringup-" + pool + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
