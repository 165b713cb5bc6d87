package com.flashback.liveness.exception;

import com.flashback.common.exception.InvalidResourceStateException;
import com.flashback.liveness.domain.LivenessState;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A session operation was invoked in a state that does not allow it. This is a caller bug,
 * never a liveness outcome.
 */
public class LivenessSessionStateException extends InvalidResourceStateException {

    private final String operation;
    private final LivenessState state;

    public LivenessSessionStateException(String operation, LivenessState state, LivenessState... allowed) {
        super("Liveness session (" + operation + ")", state.name(), Arrays.stream(allowed)
                .map(Enum::name)
                .collect(Collectors.joining(" or ")));
        this.operation = operation;
        this.state = state;
        withMetadata("operation", operation);
    }

    public LivenessSessionStateException(String operation, LivenessState state, String message) {
        super(message);
        this.operation = operation;
        this.state = state;
        withMetadata("operation", operation);
    }

    public String getOperation() {
        return operation;
    }

    public LivenessState getState() {
        return state;
    }
}
