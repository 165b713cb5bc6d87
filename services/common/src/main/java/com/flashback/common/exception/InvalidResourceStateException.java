package com.flashback.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an operation is attempted on a resource that is in a state that does not allow it
 */
public class InvalidResourceStateException extends BusinessException {

    public static final String ERROR_CODE = "INVALID_STATE";

    private final String resourceType;
    private final String currentState;
    private final String expectedState;

    public InvalidResourceStateException(String message) {
        super(message, ERROR_CODE, HttpStatus.CONFLICT);
        this.resourceType = null;
        this.currentState = null;
        this.expectedState = null;
    }

    public InvalidResourceStateException(String resourceName, String currentState, String requiredState) {
        super(String.format("%s is in invalid state: %s. Required state: %s",
                resourceName, currentState, requiredState), ERROR_CODE, HttpStatus.CONFLICT);
        this.resourceType = resourceName;
        this.currentState = currentState;
        this.expectedState = requiredState;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getExpectedState() {
        return expectedState;
    }
}
