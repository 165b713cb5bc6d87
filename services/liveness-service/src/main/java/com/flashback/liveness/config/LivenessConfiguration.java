package com.flashback.liveness.config;

import com.flashback.liveness.detection.LivenessThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(LivenessProperties.class)
public class LivenessConfiguration {

    /**
     * Wall clock for session start and tick times. Replaced with a fixed clock in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LivenessThresholds livenessThresholds(LivenessProperties properties) {
        LivenessThresholds thresholds = properties.toThresholds();
        log.info("Liveness thresholds loaded: {}", thresholds);
        return thresholds;
    }
}
