package com.flashback.common.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Thrown when a resource addressed by id does not exist (or no longer exists)
 */
public class ResourceNotFoundException extends BusinessException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String message) {
        super(message, ERROR_CODE, HttpStatus.NOT_FOUND);
        this.resourceType = null;
        this.resourceId = null;
    }

    public ResourceNotFoundException(String resourceName, UUID id) {
        super(String.format("%s not found with ID: %s", resourceName, id), ERROR_CODE, HttpStatus.NOT_FOUND);
        this.resourceType = resourceName;
        this.resourceId = id != null ? id.toString() : null;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
