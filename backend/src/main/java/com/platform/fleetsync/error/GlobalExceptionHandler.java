package com.platform.fleetsync.error;

import com.platform.fleetsync.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to ErrorResponse, logs them with a severity matching
 * the error category and counts them by error code.
 * 
 * RULES:
 * - Never return HTTP 200 on failure
 * - Always include error code for client action
 * - Device failures carry the device context (ip, operation)
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Fleet Sync Exceptions ====================
    
    @ExceptionHandler(FleetSyncException.class)
    public ResponseEntity<ErrorResponse> handleFleetSyncException(
            FleetSyncException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, traceId);
        recordMetric(errorCode);
        
        return ResponseEntity.status(status).body(baseResponse(errorCode, ex.getMessage(), status, request, traceId)
            .build());
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Resource not found: {} ({})", 
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND, request, traceId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "resourceId", ex.getResourceId()
            ))
            .build();
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse.ErrorResponseBuilder builder =
            baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST, request, traceId);
        
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(builder.build());
    }
    
    @ExceptionHandler(DeviceCommunicationException.class)
    public ResponseEntity<ErrorResponse> handleDeviceCommunication(
            DeviceCommunicationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        HttpStatus status = mapErrorCodeToStatus(ex.getErrorCode());
        
        log.warn("[{}] Device call failed: {} {} on {} - {}", 
            traceId, ex.getErrorCode().getCode(), ex.getOperation(), ex.getDeviceIp(), ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("deviceIp", ex.getDeviceIp());
        metadata.put("operation", ex.getOperation());
        metadata.put("generation", ex.getGeneration());
        if (ex.getStatusCode() > 0) {
            metadata.put("deviceStatus", ex.getStatusCode());
        }
        
        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), status, request, traceId)
            .metadata(metadata)
            .build();
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(CredentialRecoveryException.class)
    public ResponseEntity<ErrorResponse> handleCredentialRecovery(
            CredentialRecoveryException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Credential recovery failed for device {} after {} attempt(s)",
            traceId, ex.getDeviceId(), ex.getAttempts());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_GATEWAY,
                request, traceId)
            .metadata(Map.of(
                "deviceId", ex.getDeviceId(),
                "attempts", ex.getAttempts()
            ))
            .build();
        
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }
    
    // ==================== Spring Validation ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .collect(Collectors.toList());
        
        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = baseResponse(ErrorCode.VALIDATION_ERROR, "Validation failed",
                HttpStatus.BAD_REQUEST, request, traceId)
            .fieldErrors(fieldErrors)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(cv -> ErrorResponse.FieldError.builder()
                .field(getFieldName(cv))
                .message(cv.getMessage())
                .rejectedValue(cv.getInvalidValue())
                .build())
            .collect(Collectors.toList());
        
        log.warn("[{}] Constraint violation: {} violations", traceId, fieldErrors.size());
        recordMetric(ErrorCode.CONSTRAINT_VIOLATION);
        
        ErrorResponse response = baseResponse(ErrorCode.CONSTRAINT_VIOLATION, "Constraint violation",
                HttpStatus.BAD_REQUEST, request, traceId)
            .fieldErrors(fieldErrors)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Database Errors ====================
    
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLocking(
            OptimisticLockingFailureException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Optimistic locking failure: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.OPTIMISTIC_LOCK_FAILURE);
        
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
            baseResponse(ErrorCode.OPTIMISTIC_LOCK_FAILURE, "Resource was modified by another request. Please retry.",
                HttpStatus.CONFLICT, request, traceId).build());
    }
    
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(
            DataIntegrityViolationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Data integrity violation: {}", traceId, ex.getMostSpecificCause().getMessage());
        recordMetric(ErrorCode.RESOURCE_CONFLICT);
        
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
            baseResponse(ErrorCode.RESOURCE_CONFLICT, "Resource conflict", HttpStatus.CONFLICT, request, traceId)
                .detail(ex.getMostSpecificCause().getMessage())
                .build());
    }
    
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(
            DataAccessException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Database error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.DATABASE_ERROR);
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            baseResponse(ErrorCode.DATABASE_ERROR, "Database operation failed",
                HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
                .detail(ex.getMostSpecificCause().getMessage())
                .build());
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        return ResponseEntity.badRequest().body(
            baseResponse(ErrorCode.INVALID_REQUEST, "Invalid request body", HttpStatus.BAD_REQUEST, request, traceId)
                .detail(ex.getMostSpecificCause().getMessage())
                .build());
    }
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Missing parameter: {}", traceId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);
        
        return ResponseEntity.badRequest().body(
            baseResponse(ErrorCode.MISSING_REQUIRED_FIELD,
                String.format("Missing required parameter: %s", ex.getParameterName()),
                HttpStatus.BAD_REQUEST, request, traceId).build());
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);
        
        return ResponseEntity.badRequest().body(
            baseResponse(ErrorCode.INVALID_FIELD_VALUE,
                String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
                HttpStatus.BAD_REQUEST, request, traceId).build());
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            baseResponse(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
                .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
                .build());
    }
    
    // ==================== Helpers ====================
    
    private ErrorResponse.ErrorResponseBuilder baseResponse(ErrorCode errorCode, String message, HttpStatus status,
            HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }
    
    private void logError(FleetSyncException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("fleetsync.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, DEVICE_NOT_FOUND, TEMPLATE_NOT_FOUND, SCHEDULE_NOT_FOUND,
                 TREND_NOT_FOUND, CONFIGURATION_NOT_FOUND -> 
                HttpStatus.NOT_FOUND;
            case RESOURCE_CONFLICT, DUPLICATE_RESOURCE, OPTIMISTIC_LOCK_FAILURE -> 
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE,
                 CONSTRAINT_VIOLATION, INVALID_CONFIGURATION, INCOMPATIBLE_TEMPLATE, INVALID_NETWORK_RANGE ->
                HttpStatus.BAD_REQUEST;
            case DEVICE_AUTH_REQUIRED, DEVICE_AUTH_FAILED, CREDENTIAL_RECOVERY_FAILED,
                 DEVICE_PROTOCOL_ERROR, DEVICE_RPC_ERROR, DEVICE_UNREACHABLE ->
                HttpStatus.BAD_GATEWAY;
            case DEVICE_TIMEOUT, OPERATION_CANCELLED ->
                HttpStatus.GATEWAY_TIMEOUT;
            default -> 
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
    
    private String getFieldName(ConstraintViolation<?> cv) {
        String path = cv.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot > 0 ? path.substring(lastDot + 1) : path;
    }
}
