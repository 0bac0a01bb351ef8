package com.platform.scaffold.error;

/**
 * Base exception for all scaffold exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ScaffoldException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ScaffoldException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected ScaffoldException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ScaffoldException(ErrorCode errorCode, String message, Throwable cause) {
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
