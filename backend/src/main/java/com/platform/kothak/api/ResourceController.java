package com.platform.kothak.api;

import com.platform.kothak.core.Kothak;
import com.platform.kothak.core.ResourceHealthChecker;
import com.platform.kothak.model.ConnectionStatus;
import com.platform.kothak.model.ResourceFamily;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only REST API over the resource registry.
 */
@Slf4j
@RestController
@RequestMapping("/api/resources")
@RequiredArgsConstructor
public class ResourceController {
    
    private final Kothak kothak;
    private final ResourceHealthChecker healthChecker;
    
    /**
     * Registered resource names, grouped by family.
     */
    @GetMapping
    public ResponseEntity<Map<String, Set<String>>> listResources() {
        Map<String, Set<String>> resources = new LinkedHashMap<>();
        for (ResourceFamily family : ResourceFamily.values()) {
            resources.put(family.getMetricTag(), kothak.names(family));
        }
        return ResponseEntity.ok(resources);
    }
    
    /**
     * Probe the health of one resource.
     */
    @GetMapping("/{family}/{name}")
    public ResponseEntity<ConnectionStatus> getResourceHealth(
            @PathVariable String family, 
            @PathVariable String name) {
        ResourceFamily resourceFamily = ResourceFamily.fromValue(family).orElse(null);
        if (resourceFamily == null) {
            log.warn("Unknown resource family requested: {}", family);
            return ResponseEntity.notFound().build();
        }
        
        ConnectionStatus status = healthChecker.check(resourceFamily, name);
        log.debug("Health of {} {}: {}", resourceFamily.getDisplayName(), name, status.status());
        return ResponseEntity.ok(status);
    }
}
