package com.flashback.liveness.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One face-mesh sample from the capture loop.
 *
 * <p>{@code landmarks} holds one {@code [x, y]} or {@code [x, y, z]} entry per mesh point in
 * normalized image coordinates. It may be empty when {@code faceFound} is false.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LandmarkFrameRequest {

    @NotNull(message = "Timestamp is required")
    private Long timestamp; // epoch millis, capture clock

    @NotNull(message = "faceFound is required")
    private Boolean faceFound;

    @Size(max = 1000, message = "Too many landmarks")
    private List<@Size(min = 2, max = 3, message = "Each landmark needs 2 or 3 coordinates") List<Double>> landmarks;
}
