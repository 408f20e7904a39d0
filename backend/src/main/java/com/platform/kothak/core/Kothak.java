package com.platform.kothak.core;

import com.platform.kothak.connectors.objectstorage.ObjectStorage;
import com.platform.kothak.connectors.redis.Redis;
import com.platform.kothak.connectors.sqldb.SqlDb;
import com.platform.kothak.error.ResourceCloseException;
import com.platform.kothak.error.ResourceNotFoundException;
import com.platform.kothak.model.ResourceFailure;
import com.platform.kothak.model.ResourceFamily;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Name-keyed registry of every resource that came up.
 *
 * Built once after bring-up and never modified afterwards, so reads need no locking.
 * Each family has two accessors:
 * - {@code getX(name)} throws {@link ResourceNotFoundException}, for callers that can recover
 * - {@code mustGetX(name)} terminates the process through {@link ProcessTerminator}, for
 *   resources the caller knows were configured
 *
 * The registry owns every handle; {@link #closeAll()} is the only way they are closed.
 */
@Slf4j
public class Kothak {
    
    private final Map<String, ObjectStorage> objectStorages;
    private final Map<String, SqlDb> sqlDbs;
    private final Map<String, Redis> redises;
    private final ProcessTerminator terminator;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    
    Kothak(Map<String, SqlDb> sqlDbs, Map<String, Redis> redises,
           Map<String, ObjectStorage> objectStorages, ProcessTerminator terminator) {
        this.sqlDbs = Collections.unmodifiableMap(new LinkedHashMap<>(sqlDbs));
        this.redises = Collections.unmodifiableMap(new LinkedHashMap<>(redises));
        this.objectStorages = Collections.unmodifiableMap(new LinkedHashMap<>(objectStorages));
        this.terminator = Objects.requireNonNull(terminator, "terminator");
    }
    
    public SqlDb getSqlDb(String name) {
        return get(sqlDbs, ResourceFamily.DATABASE, name);
    }
    
    public SqlDb mustGetSqlDb(String name) {
        return mustGet(sqlDbs, ResourceFamily.DATABASE, name);
    }
    
    public Redis getRedis(String name) {
        return get(redises, ResourceFamily.REDIS, name);
    }
    
    public Redis mustGetRedis(String name) {
        return mustGet(redises, ResourceFamily.REDIS, name);
    }
    
    public ObjectStorage getObjectStorage(String name) {
        return get(objectStorages, ResourceFamily.OBJECT_STORAGE, name);
    }
    
    public ObjectStorage mustGetObjectStorage(String name) {
        return mustGet(objectStorages, ResourceFamily.OBJECT_STORAGE, name);
    }
    
    /**
     * Registered names of one family, in configuration order.
     */
    public Set<String> names(ResourceFamily family) {
        return handles(family).keySet();
    }
    
    public int size() {
        return sqlDbs.size() + redises.size() + objectStorages.size();
    }
    
    public boolean isClosed() {
        return closed.get();
    }
    
    /**
     * Close object storage, then databases, then Redis. Every handle is attempted
     * even when an earlier one fails. Only the first call does anything.
     *
     * @throws ResourceCloseException listing every handle that failed to close
     */
    public void closeAll() {
        if (!closed.compareAndSet(false, true)) {
            log.debug("kothak: resources already closed");
            return;
        }
        
        List<ResourceFailure> failures = new ArrayList<>();
        closeFamily(ResourceFamily.OBJECT_STORAGE, objectStorages, failures);
        closeFamily(ResourceFamily.DATABASE, sqlDbs, failures);
        closeFamily(ResourceFamily.REDIS, redises, failures);
        
        if (!failures.isEmpty()) {
            throw new ResourceCloseException(failures);
        }
    }
    
    private void closeFamily(ResourceFamily family, Map<String, ? extends AutoCloseable> handles,
                             List<ResourceFailure> failures) {
        handles.forEach((name, handle) -> {
            try {
                handle.close();
                log.debug("kothak: closed {} {}", family.getDisplayName(), name);
            } catch (Exception e) {
                log.warn("kothak: failed to close {} {}: {}", family.getDisplayName(), name, e.getMessage());
                failures.add(new ResourceFailure(family, name, e));
            }
        });
    }
    
    private Map<String, ?> handles(ResourceFamily family) {
        return switch (family) {
            case DATABASE -> sqlDbs;
            case REDIS -> redises;
            case OBJECT_STORAGE -> objectStorages;
        };
    }
    
    private static <T> T get(Map<String, T> handles, ResourceFamily family, String name) {
        T handle = handles.get(name);
        if (handle == null) {
            throw new ResourceNotFoundException(family, name);
        }
        return handle;
    }
    
    private <T> T mustGet(Map<String, T> handles, ResourceFamily family, String name) {
        T handle = handles.get(name);
        if (handle == null) {
            ResourceNotFoundException missing = new ResourceNotFoundException(family, name);
            log.error("kothak: {}; terminating", missing.getMessage());
            throw terminator.terminate(missing);
        }
        return handle;
    }
}
