package com.platform.fleetsync.error;

/**
 * Base exception for all fleet sync exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class FleetSyncException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected FleetSyncException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected FleetSyncException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected FleetSyncException(ErrorCode errorCode, String message, Throwable cause) {
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
