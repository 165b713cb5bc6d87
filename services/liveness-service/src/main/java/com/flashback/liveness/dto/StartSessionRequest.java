package com.flashback.liveness.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting a liveness session. Every field is optional; omitted fields fall back
 * to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartSessionRequest {

    @Min(value = 1000, message = "Duration must be at least 1000 ms")
    @Max(value = 60000, message = "Duration must not exceed 60000 ms")
    private Long durationMs;

    @Min(value = 20, message = "Frame interval must be at least 20 ms")
    @Max(value = 5000, message = "Frame interval must not exceed 5000 ms")
    private Long frameIntervalMs;

    /**
     * Session start on the capture clock (epoch millis). Defaults to the server clock.
     */
    private Long startedAt;
}
