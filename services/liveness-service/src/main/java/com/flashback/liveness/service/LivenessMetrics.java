package com.flashback.liveness.service;

import com.flashback.liveness.domain.LivenessState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Micrometer instruments for liveness sessions
 */
@Component
public class LivenessMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter sessionsStarted;
    private final Counter sessionsEvicted;
    private final Timer frameProcessing;

    public LivenessMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.sessionsStarted = Counter.builder("liveness.sessions.started")
                .description("Liveness sessions started")
                .register(meterRegistry);
        this.sessionsEvicted = Counter.builder("liveness.sessions.evicted")
                .description("Liveness sessions removed after their time-to-live")
                .register(meterRegistry);
        this.frameProcessing = Timer.builder("liveness.frame.processing")
                .description("Time spent processing one landmark sample")
                .register(meterRegistry);
    }

    public void recordStarted() {
        sessionsStarted.increment();
    }

    public void recordCompleted(LivenessState outcome) {
        meterRegistry.counter("liveness.sessions.completed",
                        "outcome", outcome.name().toLowerCase(Locale.ROOT))
                .increment();
    }

    public void recordEvicted(int count) {
        sessionsEvicted.increment(count);
    }

    public <T> T timeFrame(Supplier<T> frameProcessor) {
        return frameProcessing.record(frameProcessor);
    }
}
