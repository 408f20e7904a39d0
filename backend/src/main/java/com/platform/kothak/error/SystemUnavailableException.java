package com.platform.kothak.error;

/**
 * Exception for failures of a connected Redis or object storage handle.
 */
public class SystemUnavailableException extends KothakException {
    
    private final String systemName;
    
    public SystemUnavailableException(ErrorCode errorCode, String systemName, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.systemName = systemName;
    }
    
    public static SystemUnavailableException redis(String name, String message, Throwable cause) {
        return new SystemUnavailableException(ErrorCode.REDIS_ERROR, name, message, cause);
    }
    
    public static SystemUnavailableException objectStorage(String name, String message, Throwable cause) {
        return new SystemUnavailableException(ErrorCode.OBJECT_STORAGE_ERROR, name, message, cause);
    }
    
    public String getSystemName() {
        return systemName;
    }
}
