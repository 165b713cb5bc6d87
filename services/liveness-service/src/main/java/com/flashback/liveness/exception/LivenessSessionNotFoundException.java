package com.flashback.liveness.exception;

import com.flashback.common.exception.ResourceNotFoundException;

import java.util.UUID;

public class LivenessSessionNotFoundException extends ResourceNotFoundException {

    public LivenessSessionNotFoundException(UUID sessionId) {
        super("Liveness session", sessionId);
    }
}
