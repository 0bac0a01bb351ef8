package com.platform.scaffold.error;

/**
 * Standardized error codes for the scaffold.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: SC-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Authentication/Authorization errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: System errors (database)
 * - 9xx: Internal and configuration errors
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("SC-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("SC-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("SC-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("SC-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    CONSTRAINT_VIOLATION("SC-104", "Constraint violation", ErrorCategory.RECOVERABLE),
    
    // ==================== Auth Errors (2xx) ====================
    
    UNAUTHORIZED("SC-200", "Missing bearer token", ErrorCategory.RECOVERABLE),
    FORBIDDEN("SC-201", "Invalid bearer token", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("SC-300", "Resource not found", ErrorCategory.RECOVERABLE),
    ENDPOINT_NOT_FOUND("SC-301", "Endpoint not found", ErrorCategory.RECOVERABLE),
    DUPLICATE_RESOURCE("SC-311", "Duplicate resource", ErrorCategory.RECOVERABLE),
    METHOD_NOT_ALLOWED("SC-320", "Method not allowed", ErrorCategory.RECOVERABLE),
    
    // ==================== System Errors (4xx) ====================
    
    DATABASE_ERROR("SC-400", "Database error", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    UNEXPECTED_ERROR("SC-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("SC-902", "Configuration error", ErrorCategory.FATAL),
    AUTH_NOT_CONFIGURED("SC-903", "Bearer token authentication is not configured", ErrorCategory.FATAL);
    
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
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the operator must fix the server or its configuration.
         */
        FATAL
    }
}
