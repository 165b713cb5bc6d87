package com.flashback.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class BusinessExceptionTest {

    @Test
    @DisplayName("Defaults to a generic code and 400")
    void shouldApplyDefaults() {
        BusinessException ex = new BusinessException("Something went wrong");

        assertThat(ex.getErrorCode()).isEqualTo(BusinessException.DEFAULT_ERROR_CODE);
        assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getErrorId()).isNotBlank();
        assertThat(ex.getTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("Metadata ignores nulls and is read-only")
    void shouldCollectMetadata() {
        BusinessException ex = new BusinessException("Boom", "CODE")
                .withMetadata("key", "value")
                .withMetadata("ignored", null)
                .withMetadata(null, "ignored");

        assertThat(ex.getMetadata()).containsOnly(entry("key", "value"));
        assertThatThrownBy(() -> ex.getMetadata().put("other", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Not-found carries the resource and id")
    void shouldDescribeMissingResource() {
        UUID id = UUID.randomUUID();

        ResourceNotFoundException ex = new ResourceNotFoundException("Liveness session", id);

        assertThat(ex.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ex.getErrorCode()).isEqualTo(ResourceNotFoundException.ERROR_CODE);
        assertThat(ex.getMessage()).isEqualTo("Liveness session not found with ID: " + id);
    }

    @Test
    @DisplayName("Invalid state names the current and required state")
    void shouldDescribeInvalidState() {
        InvalidResourceStateException ex = new InvalidResourceStateException("Session", "IDLE", "RUNNING");

        assertThat(ex.getStatus()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ex.getCurrentState()).isEqualTo("IDLE");
        assertThat(ex.getExpectedState()).isEqualTo("RUNNING");
        assertThat(ex.getMessage()).contains("IDLE").contains("RUNNING");
    }
}
