package com.platform.kothak.error;

/**
 * Raised when the resource configuration cannot be defaulted or validated.
 * Always fatal: bring-up does not start.
 */
public class ConfigurationException extends KothakException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ConfigurationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.CONFIGURATION_ERROR,
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
