package com.platform.fleetsync.error;

/**
 * Standardized error codes for the fleet sync engine.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: FS-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Device authentication errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Device communication errors (network, protocol)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("FS-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("FS-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("FS-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("FS-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    CONSTRAINT_VIOLATION("FS-104", "Constraint violation", ErrorCategory.RECOVERABLE),
    INVALID_CONFIGURATION("FS-110", "Malformed configuration blob", ErrorCategory.RECOVERABLE),
    INCOMPATIBLE_TEMPLATE("FS-111", "Template not compatible with device", ErrorCategory.RECOVERABLE),
    INVALID_NETWORK_RANGE("FS-112", "Invalid network range", ErrorCategory.RECOVERABLE),
    
    // ==================== Device Auth Errors (2xx) ====================
    
    DEVICE_AUTH_REQUIRED("FS-200", "Device requires authentication", ErrorCategory.RECOVERABLE),
    DEVICE_AUTH_FAILED("FS-201", "Device rejected credentials", ErrorCategory.RECOVERABLE),
    CREDENTIAL_RECOVERY_FAILED("FS-210", "No working credential for device", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("FS-300", "Resource not found", ErrorCategory.RECOVERABLE),
    DEVICE_NOT_FOUND("FS-301", "Device not found", ErrorCategory.RECOVERABLE),
    TEMPLATE_NOT_FOUND("FS-302", "Configuration template not found", ErrorCategory.RECOVERABLE),
    SCHEDULE_NOT_FOUND("FS-303", "Drift schedule not found", ErrorCategory.RECOVERABLE),
    TREND_NOT_FOUND("FS-304", "Drift trend not found", ErrorCategory.RECOVERABLE),
    CONFIGURATION_NOT_FOUND("FS-305", "Stored configuration not found", ErrorCategory.RECOVERABLE),
    RESOURCE_CONFLICT("FS-310", "Resource conflict", ErrorCategory.RECOVERABLE),
    DUPLICATE_RESOURCE("FS-311", "Duplicate resource", ErrorCategory.RECOVERABLE),
    OPTIMISTIC_LOCK_FAILURE("FS-312", "Concurrent modification", ErrorCategory.RECOVERABLE),
    
    // ==================== Device Communication Errors (4xx) ====================
    
    DATABASE_ERROR("FS-400", "Database error", ErrorCategory.FATAL),
    DEVICE_UNREACHABLE("FS-410", "Device unreachable", ErrorCategory.RECOVERABLE),
    DEVICE_TIMEOUT("FS-411", "Device operation timed out", ErrorCategory.RECOVERABLE),
    OPERATION_CANCELLED("FS-412", "Device operation cancelled", ErrorCategory.RECOVERABLE),
    DEVICE_PROTOCOL_ERROR("FS-420", "Malformed or unexpected device response", ErrorCategory.FATAL),
    DEVICE_RPC_ERROR("FS-421", "Device returned an RPC error", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("FS-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("FS-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("FS-902", "Configuration error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("FS-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
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
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the call cannot succeed as issued.
         */
        FATAL
    }
}
