package com.platform.kothak.error;

import com.platform.kothak.model.ResourceFamily;

/**
 * The requested resource name is not present in the registry.
 */
public class ResourceNotFoundException extends KothakException {
    
    private final ResourceFamily family;
    private final String resourceName;
    
    public ResourceNotFoundException(ResourceFamily family, String resourceName) {
        super(ErrorCode.RESOURCE_NOT_FOUND, 
            String.format("%s with name %s does not exist", family.getDisplayName(), resourceName));
        this.family = family;
        this.resourceName = resourceName;
    }
    
    public ResourceFamily getFamily() {
        return family;
    }
    
    public String getResourceName() {
        return resourceName;
    }
}
