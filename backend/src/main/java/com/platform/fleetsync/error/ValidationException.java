package com.platform.fleetsync.error;

/**
 * Exception for validation errors, including malformed stored settings and
 * configuration blobs.
 */
public class ValidationException extends FleetSyncException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    /**
     * Malformed configuration blob at the given path.
     */
    public static ValidationException configuration(String path, String message) {
        return new ValidationException(ErrorCode.INVALID_CONFIGURATION, path, message);
    }
    
    private ValidationException(ErrorCode errorCode, String field, String message) {
        super(errorCode, String.format("Invalid configuration at '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = null;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
