package com.platform.scaffold.error;

import com.platform.scaffold.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to standardized ErrorResponse.
 * Logs all errors with appropriate severity.
 * Tracks error metrics.
 * 
 * RULES:
 * - Never swallow exceptions (always log)
 * - Never return HTTP 200 on failure
 * - Always include error code for client action
 * - Server misconfiguration is 5xx, never a client error
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    static final String BEARER_CHALLENGE = "Bearer";
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Scaffold Exceptions ====================
    
    @ExceptionHandler(ScaffoldException.class)
    public ResponseEntity<ErrorResponse> handleScaffoldException(
            ScaffoldException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, traceId);
        recordMetric(errorCode);
        
        return ResponseEntity.status(status)
            .body(ErrorResponse.of(errorCode, ex.getMessage(), status.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(MissingCredentialException.class)
    public ResponseEntity<ErrorResponse> handleMissingCredential(
            MissingCredentialException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] {} - {}", traceId, ex.getErrorCode().getCode(), ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
            .header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE)
            .body(ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
                HttpStatus.UNAUTHORIZED.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Resource not found: {} ({})", 
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.NOT_FOUND.value(), request.getRequestURI(), traceId);
        response.setMetadata(Map.of(
            "resourceType", ex.getResourceType(),
            "resourceId", ex.getResourceId()
        ));
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        
        if (ex.getField() != null) {
            response.setFieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(response);
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
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Validation failed",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        
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
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.CONSTRAINT_VIOLATION, "Constraint violation",
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Database Errors ====================
    
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(
            DataAccessException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        // FATAL: Database errors are serious. Driver messages stay in the log only.
        log.error("[{}] FATAL: Database error: {}", traceId, ex.getMostSpecificCause().getMessage(), ex);
        recordMetric(ErrorCode.DATABASE_ERROR);
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(ErrorCode.DATABASE_ERROR, ErrorCode.DATABASE_ERROR.getDefaultMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId));
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Invalid request body",
                HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Missing parameter: {}", traceId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);
        
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(ErrorCode.MISSING_REQUIRED_FIELD,
                String.format("Missing required parameter: %s", ex.getParameterName()),
                HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);
        
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(ErrorCode.INVALID_FIELD_VALUE,
                String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
                HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.METHOD_NOT_ALLOWED);
        
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
            .body(ErrorResponse.of(ErrorCode.METHOD_NOT_ALLOWED,
                String.format("Method %s not supported for this endpoint", ex.getMethod()),
                HttpStatus.METHOD_NOT_ALLOWED.value(), request.getRequestURI(), traceId));
    }
    
    /**
     * Routes of a feature that was not composed in end up here: they are absent, not forbidden.
     */
    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Endpoint not found: {} {}", traceId, request.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.ENDPOINT_NOT_FOUND);
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponse.of(ErrorCode.ENDPOINT_NOT_FOUND, "Not Found",
                HttpStatus.NOT_FOUND.value(), request.getRequestURI(), traceId));
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        // FATAL: Unexpected errors are always fatal
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(ErrorCode.UNEXPECTED_ERROR,
                ex.getClass().getSimpleName() + ": " + ex.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId));
    }
    
    // ==================== Helpers ====================
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("trace_id");
        if (traceId == null) {
            traceId = MDC.get("correlationId");
        }
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }
    
    private void logError(ScaffoldException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("scaffold.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, ENDPOINT_NOT_FOUND -> 
                HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE,
                 CONSTRAINT_VIOLATION, DUPLICATE_RESOURCE ->
                HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> 
                HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> 
                HttpStatus.FORBIDDEN;
            case METHOD_NOT_ALLOWED ->
                HttpStatus.METHOD_NOT_ALLOWED;
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
