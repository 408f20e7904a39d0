package com.platform.kothak.error;

/**
 * Base exception for all Kothak exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class KothakException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected KothakException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected KothakException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected KothakException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
