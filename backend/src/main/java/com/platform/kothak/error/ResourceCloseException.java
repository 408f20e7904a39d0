package com.platform.kothak.error;

import com.platform.kothak.model.ResourceFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more resources failed to close. Every other resource was still closed.
 */
public class ResourceCloseException extends KothakException {
    
    private final List<ResourceFailure> failures;
    
    public ResourceCloseException(List<ResourceFailure> failures) {
        super(ErrorCode.CLOSE_FAILED, 
            String.format("failed to close %d resource(s): %s", failures.size(), describe(failures)));
        this.failures = List.copyOf(failures);
        failures.forEach(f -> addSuppressed(f.cause()));
    }
    
    public List<ResourceFailure> getFailures() {
        return failures;
    }
    
    static String describe(List<ResourceFailure> failures) {
        return failures.stream()
            .map(ResourceFailure::describe)
            .collect(Collectors.joining("; "));
    }
}
