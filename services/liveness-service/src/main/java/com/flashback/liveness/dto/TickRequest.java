package com.flashback.liveness.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickRequest {

    /**
     * Tick time on the capture clock (epoch millis). Defaults to the server clock.
     */
    private Long timestamp;
}
