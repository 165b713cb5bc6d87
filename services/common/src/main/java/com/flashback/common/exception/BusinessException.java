package com.flashback.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for every rule or contract violation raised by a Flashback service.
 *
 * <p>Each instance carries a unique error id (logged and returned to the client so the two
 * can be correlated), a stable string error code, the HTTP status the API layer should
 * answer with, and optional metadata for log enrichment.</p>
 */
@Getter
public class BusinessException extends RuntimeException {

    public static final String DEFAULT_ERROR_CODE = "BUSINESS_ERROR";

    private final String errorId;
    private final String errorCode;
    private final HttpStatus status;
    private final LocalDateTime timestamp;
    private final Map<String, Object> metadata;

    public BusinessException(String message) {
        this(message, DEFAULT_ERROR_CODE, HttpStatus.BAD_REQUEST, null);
    }

    public BusinessException(String message, Throwable cause) {
        this(message, DEFAULT_ERROR_CODE, HttpStatus.BAD_REQUEST, cause);
    }

    public BusinessException(String message, String errorCode) {
        this(message, errorCode, HttpStatus.BAD_REQUEST, null);
    }

    public BusinessException(String message, String errorCode, HttpStatus status) {
        this(message, errorCode, status, null);
    }

    public BusinessException(String message, String errorCode, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : DEFAULT_ERROR_CODE;
        this.status = status != null ? status : HttpStatus.BAD_REQUEST;
        this.timestamp = LocalDateTime.now();
        this.metadata = new HashMap<>();
    }

    /**
     * Add a metadata entry (fluent). Null keys and values are ignored.
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }
}
