package com.platform.kothak.error;

/**
 * Standardized error codes for resource bring-up.
 *
 * Format: KT-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Configuration errors
 * - 2xx: Bring-up errors (provider, credentials, connect)
 * - 3xx: Lookup errors
 * - 4xx: Shutdown errors
 * - 5xx: Aggregated bring-up outcome
 * - 6xx: Errors raised by a connected handle
 */
public enum ErrorCode {
    
    // ==================== Configuration Errors (1xx) ====================
    
    CONFIGURATION_ERROR("KT-100", "Invalid resource configuration", ErrorCategory.FATAL),
    
    // ==================== Bring-up Errors (2xx) ====================
    
    PROVIDER_NOT_FOUND("KT-200", "Object storage provider not found", ErrorCategory.RECOVERABLE),
    CONNECT_FAILED("KT-210", "Resource connection failed", ErrorCategory.RECOVERABLE),
    CREDENTIALS_LOAD_FAILED("KT-211", "Failed to load credentials", ErrorCategory.RECOVERABLE),
    PROVIDER_CONFIG_INVALID("KT-212", "Failed to build provider configuration", ErrorCategory.RECOVERABLE),
    DRIVER_NOT_SUPPORTED("KT-213", "Database driver not supported", ErrorCategory.RECOVERABLE),
    
    // ==================== Lookup Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("KT-300", "Resource not found", ErrorCategory.RECOVERABLE),
    
    // ==================== Shutdown Errors (4xx) ====================
    
    CLOSE_FAILED("KT-400", "Failed to close resources", ErrorCategory.RECOVERABLE),
    
    // ==================== Outcome (5xx) ====================
    
    BRING_UP_INCOMPLETE("KT-500", "One or more resources failed to come up", ErrorCategory.FATAL),
    
    // ==================== Handle Errors (6xx) ====================
    
    REDIS_ERROR("KT-610", "Redis error", ErrorCategory.RECOVERABLE),
    OBJECT_STORAGE_ERROR("KT-620", "Object storage error", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Scoped to one resource or one lookup; the process can carry on.
         */
        RECOVERABLE,
        
        /**
         * The process should not start serving.
         */
        FATAL
    }
}
