package com.platform.kothak.observability;

import com.platform.kothak.model.ResourceFamily;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for bring-up and shutdown metrics, tagged by resource family.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }
    
    /**
     * Record a resource that came up.
     */
    public void recordConnectionSuccess(ResourceFamily family) {
        getCounter("kothak.connection.success", family).increment();
    }
    
    /**
     * Record a resource that failed to come up.
     */
    public void recordConnectionFailure(ResourceFamily family) {
        getCounter("kothak.connection.failure", family).increment();
    }
    
    /**
     * Record a resource that failed to close.
     */
    public void recordCloseFailure(ResourceFamily family) {
        getCounter("kothak.close.failure", family).increment();
    }
    
    /**
     * Record latency for an operation.
     */
    public void recordLatency(ResourceFamily family, String operation, long latencyMs) {
        String timerKey = family.getMetricTag() + "." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k -> 
            Timer.builder("kothak.operation.latency")
                .tag("family", family.getMetricTag())
                .tag("operation", operation)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    private Counter getCounter(String name, ResourceFamily family) {
        String key = name + "." + family.getMetricTag();
        return counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tag("family", family.getMetricTag())
                .register(meterRegistry));
    }
}
