package com.platform.scaffold.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends ScaffoldException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(String resourceType, Object resourceId) {
        super(ErrorCode.RESOURCE_NOT_FOUND, 
            String.format("%s %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
