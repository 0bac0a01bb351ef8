package com.platform.scaffold.error;

/**
 * A unique field of a resource collides with an existing record.
 */
public class DuplicateResourceException extends ScaffoldException {
    
    private final String resourceType;
    
    public DuplicateResourceException(String resourceType, String fields) {
        super(ErrorCode.DUPLICATE_RESOURCE, 
            String.format("%s with this %s already exists", resourceType, fields));
        this.resourceType = resourceType;
    }
    
    public DuplicateResourceException(String resourceType, String fields, Throwable cause) {
        super(ErrorCode.DUPLICATE_RESOURCE, 
            String.format("%s with this %s already exists", resourceType, fields), cause);
        this.resourceType = resourceType;
    }
    
    public String getResourceType() {
        return resourceType;
    }
}
