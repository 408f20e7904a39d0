package com.platform.kothak.lifecycle;

import com.platform.kothak.core.Kothak;
import com.platform.kothak.error.ResourceCloseException;
import com.platform.kothak.model.ResourceFailure;
import com.platform.kothak.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes every registered resource when the application context shuts down.
 *
 * Close failures are logged and counted; they never abort the rest of the shutdown.
 */
@Slf4j
public class ResourceShutdownManager implements ApplicationListener<ContextClosedEvent> {
    
    private final Kothak kothak;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public ResourceShutdownManager(Kothak kothak, MetricsRegistry metricsRegistry) {
        this.kothak = kothak;
        this.metricsRegistry = metricsRegistry;
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        shutdown();
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        
        Instant startTime = Instant.now();
        log.info("Closing {} resource(s)...", kothak.size());
        
        try {
            kothak.closeAll();
            log.info("All resources closed in {}ms", Duration.between(startTime, Instant.now()).toMillis());
        } catch (ResourceCloseException e) {
            for (ResourceFailure failure : e.getFailures()) {
                metricsRegistry.recordCloseFailure(failure.family());
            }
            log.error("Resource shutdown finished with {} failure(s): {}", e.getFailures().size(), e.getMessage());
        }
    }
}
