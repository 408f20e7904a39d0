package com.platform.kothak.core;

import com.platform.kothak.model.ResourceFailure;
import com.platform.kothak.model.ResourceFamily;

/**
 * What one bring-up task hands back to the collector: a handle or a failure.
 */
record BringUpOutcome(
    ResourceFamily family,
    String name,
    AutoCloseable handle,
    ResourceFailure failure
) {
    static BringUpOutcome success(ResourceFamily family, String name, AutoCloseable handle) {
        return new BringUpOutcome(family, name, handle, null);
    }
    
    static BringUpOutcome failure(ResourceFailure failure) {
        return new BringUpOutcome(failure.family(), failure.name(), null, failure);
    }
    
    boolean isSuccess() {
        return failure == null;
    }
}
