package com.platform.kothak.error;

import com.platform.kothak.model.ResourceFamily;

/**
 * A single resource could not be brought up. Scoped to that resource only.
 */
public class ResourceConnectException extends KothakException {
    
    private final ResourceFamily family;
    private final String resourceName;
    private final Stage stage;
    
    public ResourceConnectException(ResourceFamily family, String resourceName, Stage stage,
                                    String message, Throwable cause) {
        super(stage.errorCode, 
            String.format("%s %s: %s: %s", family.getDisplayName(), resourceName, stage.description, message),
            cause);
        this.family = family;
        this.resourceName = resourceName;
        this.stage = stage;
    }
    
    public static ResourceConnectException credentials(String resourceName, Throwable cause) {
        return new ResourceConnectException(ResourceFamily.OBJECT_STORAGE, resourceName, 
            Stage.CREDENTIALS, cause.getMessage(), cause);
    }
    
    public static ResourceConnectException providerConfig(String resourceName, Throwable cause) {
        return new ResourceConnectException(ResourceFamily.OBJECT_STORAGE, resourceName,
            Stage.PROVIDER_CONFIG, cause.getMessage(), cause);
    }
    
    public static ResourceConnectException connect(ResourceFamily family, String resourceName, Throwable cause) {
        return new ResourceConnectException(family, resourceName, Stage.CONNECT, cause.getMessage(), cause);
    }
    
    public static ResourceConnectException unsupportedDriver(String resourceName, String driver) {
        return new ResourceConnectException(ResourceFamily.DATABASE, resourceName, Stage.DRIVER,
            "unknown driver '" + driver + "'", null);
    }
    
    public ResourceFamily getFamily() {
        return family;
    }
    
    public String getResourceName() {
        return resourceName;
    }
    
    public Stage getStage() {
        return stage;
    }
    
    /**
     * Step of the bring-up that failed.
     */
    public enum Stage {
        DRIVER("driver lookup failed", ErrorCode.DRIVER_NOT_SUPPORTED),
        CREDENTIALS("loading credentials failed", ErrorCode.CREDENTIALS_LOAD_FAILED),
        PROVIDER_CONFIG("building provider config failed", ErrorCode.PROVIDER_CONFIG_INVALID),
        CONNECT("connect failed", ErrorCode.CONNECT_FAILED);
        
        private final String description;
        private final ErrorCode errorCode;
        
        Stage(String description, ErrorCode errorCode) {
            this.description = description;
            this.errorCode = errorCode;
        }
    }
}
