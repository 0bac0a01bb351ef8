package com.platform.scaffold.error;

/**
 * Exception for validation errors.
 */
public class ValidationException extends ScaffoldException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
