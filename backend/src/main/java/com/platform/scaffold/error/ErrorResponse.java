package com.platform.scaffold.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error response model.
 * All API errors return this structure for consistency.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Unique error code (e.g., SC-300).
     */
    private String code;
    
    /**
     * Short error category message.
     */
    private String message;
    
    /**
     * Human-readable reason, e.g. "User 42 not found".
     */
    private String detail;
    
    /**
     * Whether this error is fatal (operator action required) or recoverable.
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    /**
     * Request path that caused the error.
     */
    private String path;
    
    /**
     * Trace ID for correlating with logs.
     */
    private String traceId;
    
    private List<FieldError> fieldErrors;
    
    private Map<String, Object> metadata;
    
    /**
     * Field-level validation error.
     */
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
    
    /**
     * Create from ErrorCode with a detail message.
     */
    public static ErrorResponse of(ErrorCode errorCode, String detail, int status, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(errorCode.getDefaultMessage())
            .detail(detail)
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }
}
