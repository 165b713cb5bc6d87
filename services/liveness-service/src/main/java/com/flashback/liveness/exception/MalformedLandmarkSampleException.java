package com.flashback.liveness.exception;

import com.flashback.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

/**
 * A sample claimed to contain a face but its landmark set cannot be used (wrong point count,
 * missing or non-finite points). The session moves to ERROR when this is thrown.
 */
public class MalformedLandmarkSampleException extends BusinessException {

    public static final String ERROR_CODE = "MALFORMED_LANDMARK_SAMPLE";

    public MalformedLandmarkSampleException(String message) {
        super(message, ERROR_CODE, HttpStatus.BAD_REQUEST);
    }
}
