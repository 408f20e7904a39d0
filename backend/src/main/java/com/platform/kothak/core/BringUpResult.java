package com.platform.kothak.core;

import com.platform.kothak.error.BringUpException;
import com.platform.kothak.model.ResourceFailure;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a bring-up. The registry is always present and holds every resource
 * that came up, even when others failed; the caller decides whether that is enough.
 */
public record BringUpResult(
    Kothak kothak,
    List<ResourceFailure> failures
) {
    public BringUpResult {
        Objects.requireNonNull(kothak, "kothak");
        failures = List.copyOf(failures);
    }
    
    public boolean isComplete() {
        return failures.isEmpty();
    }
    
    /**
     * The first failure in configuration order, if any.
     */
    public Optional<Throwable> firstError() {
        return failures.stream().findFirst().map(ResourceFailure::cause);
    }
    
    /**
     * @return the registry when every resource came up
     * @throws BringUpException carrying the partial registry and all failures otherwise
     */
    public Kothak orElseThrow() {
        if (!isComplete()) {
            throw new BringUpException(kothak, failures);
        }
        return kothak;
    }
}
