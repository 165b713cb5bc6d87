package com.flashback.liveness.exception;

import com.flashback.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

/**
 * The service already hosts the configured maximum number of active sessions.
 */
public class LivenessCapacityExceededException extends BusinessException {

    public static final String ERROR_CODE = "LIVENESS_CAPACITY_EXCEEDED";

    public LivenessCapacityExceededException(int maxActiveSessions) {
        super("Too many active liveness sessions (limit " + maxActiveSessions + "). Please retry shortly.",
                ERROR_CODE, HttpStatus.TOO_MANY_REQUESTS);
    }
}
