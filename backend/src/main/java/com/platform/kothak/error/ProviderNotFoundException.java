package com.platform.kothak.error;

/**
 * No object storage provider is registered under the configured identifier.
 */
public class ProviderNotFoundException extends KothakException {
    
    private final String provider;
    
    public ProviderNotFoundException(String resourceName, String provider) {
        super(ErrorCode.PROVIDER_NOT_FOUND,
            String.format("object storage provider '%s' for %s not found", provider, resourceName));
        this.provider = provider;
    }
    
    public String getProvider() {
        return provider;
    }
}
