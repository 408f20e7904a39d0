package com.platform.kothak.error;

import com.platform.kothak.core.Kothak;
import com.platform.kothak.model.ResourceFailure;

import java.util.List;

/**
 * Bring-up finished with failures. The registry of resources that did come up
 * is still attached and must be closed by whoever catches this.
 */
public class BringUpException extends KothakException {
    
    private final transient Kothak kothak;
    private final List<ResourceFailure> failures;
    
    public BringUpException(Kothak kothak, List<ResourceFailure> failures) {
        super(ErrorCode.BRING_UP_INCOMPLETE, 
            String.format("%d resource(s) failed to come up: %s", 
                failures.size(), ResourceCloseException.describe(failures)),
            failures.isEmpty() ? null : failures.get(0).cause());
        this.kothak = kothak;
        this.failures = List.copyOf(failures);
        failures.stream().skip(1).forEach(f -> addSuppressed(f.cause()));
    }
    
    public Kothak getKothak() {
        return kothak;
    }
    
    public List<ResourceFailure> getFailures() {
        return failures;
    }
}
