package com.platform.kothak.core;

import com.platform.kothak.error.ResourceNotFoundException;

/**
 * What {@code mustGet*} does when a resource that must exist is missing.
 */
@FunctionalInterface
public interface ProcessTerminator {
    
    /**
     * Halts the JVM with status 1 without running shutdown hooks.
     */
    ProcessTerminator HALT = cause -> {
        Runtime.getRuntime().halt(1);
        return cause;
    };
    
    /**
     * Terminate because of {@code cause}. Implementations that do not stop the process
     * return the exception the caller must throw; the accessor never returns normally.
     */
    RuntimeException terminate(ResourceNotFoundException cause);
}
