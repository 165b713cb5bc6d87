package com.flashback.liveness.service;

import com.flashback.liveness.config.LivenessProperties;
import com.flashback.liveness.detection.LivenessSession;
import com.flashback.liveness.detection.LivenessThresholds;
import com.flashback.liveness.domain.FrameObservation;
import com.flashback.liveness.domain.LandmarkSample;
import com.flashback.liveness.domain.LivenessResult;
import com.flashback.liveness.domain.Point3D;
import com.flashback.liveness.dto.LandmarkFrameRequest;
import com.flashback.liveness.dto.LivenessResultResponse;
import com.flashback.liveness.dto.SessionStatusResponse;
import com.flashback.liveness.dto.StartSessionRequest;
import com.flashback.liveness.events.LivenessEvent;
import com.flashback.liveness.exception.LivenessCapacityExceededException;
import com.flashback.liveness.exception.LivenessSessionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hosts liveness sessions for remote capture clients.
 *
 * <p>Sessions are independent and kept in memory only. Every operation on one session runs while
 * holding that session's monitor, so concurrent deliveries for the same session are serialized
 * and different sessions proceed in parallel.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LivenessSessionService {

    private final LivenessThresholds thresholds;
    private final LivenessProperties properties;
    private final LivenessMetrics metrics;
    private final LivenessGuidanceService guidanceService;
    private final Clock clock;

    private final Map<UUID, HostedSession> sessions = new ConcurrentHashMap<>();
    // reserved before registration; never above max-active-sessions
    private final AtomicInteger reservedSlots = new AtomicInteger();

    public SessionStatusResponse startSession(StartSessionRequest request) {
        int maxActive = properties.getHosting().getMaxActiveSessions();
        if (reservedSlots.incrementAndGet() > maxActive) {
            reservedSlots.decrementAndGet();
            log.warn("Rejecting new liveness session: limit of {} active sessions reached", maxActive);
            throw new LivenessCapacityExceededException(maxActive);
        }
        try {
            return register(request);
        } catch (RuntimeException e) {
            reservedSlots.decrementAndGet();
            throw e;
        }
    }

    private SessionStatusResponse register(StartSessionRequest request) {
        StartSessionRequest effective = request != null ? request : new StartSessionRequest();
        Duration duration = effective.getDurationMs() != null
                ? Duration.ofMillis(effective.getDurationMs()) : thresholds.getSessionDuration();
        Duration frameInterval = effective.getFrameIntervalMs() != null
                ? Duration.ofMillis(effective.getFrameIntervalMs()) : thresholds.getFrameInterval();
        Instant startedAt = effective.getStartedAt() != null
                ? Instant.ofEpochMilli(effective.getStartedAt()) : clock.instant();

        LivenessSession session = new LivenessSession(thresholds);
        session.start(startedAt, duration, frameInterval);
        HostedSession hosted = new HostedSession(session, clock.instant());
        sessions.put(session.getId(), hosted);
        metrics.recordStarted();

        synchronized (hosted) {
            return toStatus(hosted, null, session.drainEvents(), startedAt);
        }
    }

    public SessionStatusResponse ingestFrame(UUID sessionId, LandmarkFrameRequest request) {
        HostedSession hosted = find(sessionId);
        LandmarkSample sample = toSample(request);
        synchronized (hosted) {
            try {
                FrameObservation observation = metrics.timeFrame(() -> hosted.session.ingest(sample));
                log.debug("Session {}: frame at {} processed, state={}", sessionId, sample.getTimestamp(),
                        hosted.session.getState().name());
                return toStatus(hosted, observation, hosted.session.drainEvents(), sample.getTimestamp());
            } finally {
                recordOutcome(hosted);
            }
        }
    }

    public SessionStatusResponse tick(UUID sessionId, Long timestampMillis) {
        HostedSession hosted = find(sessionId);
        Instant now = timestampMillis != null ? Instant.ofEpochMilli(timestampMillis) : clock.instant();
        synchronized (hosted) {
            hosted.session.tick(now);
            recordOutcome(hosted);
            return toStatus(hosted, null, hosted.session.drainEvents(), now);
        }
    }

    public SessionStatusResponse cancel(UUID sessionId) {
        HostedSession hosted = find(sessionId);
        synchronized (hosted) {
            hosted.session.cancel();
            recordOutcome(hosted);
            return toStatus(hosted, null, hosted.session.drainEvents(), clock.instant());
        }
    }

    public SessionStatusResponse getStatus(UUID sessionId) {
        HostedSession hosted = find(sessionId);
        synchronized (hosted) {
            return toStatus(hosted, null, null, clock.instant());
        }
    }

    public List<LivenessEvent> drainEvents(UUID sessionId) {
        HostedSession hosted = find(sessionId);
        synchronized (hosted) {
            return hosted.session.drainEvents();
        }
    }

    /**
     * Hand out the verdict of a finished session. The session stays registered until it is
     * discarded or evicted so that a repeated request is reported as a conflict.
     */
    public LivenessResultResponse finalizeResult(UUID sessionId) {
        HostedSession hosted = find(sessionId);
        LivenessResult result;
        synchronized (hosted) {
            result = hosted.session.finalizeVerdict();
        }
        log.info("Liveness verdict for session {} handed out: outcome={}, live={}",
                sessionId, result.getOutcome().name(), result.isLive());
        return toResult(sessionId, result);
    }

    /**
     * Remove a session. A running session is cancelled first.
     */
    public void discard(UUID sessionId) {
        HostedSession hosted = find(sessionId);
        synchronized (hosted) {
            if (!hosted.session.getState().isTerminal()) {
                hosted.session.cancel();
                recordOutcome(hosted);
            }
            if (sessions.remove(sessionId, hosted)) {
                reservedSlots.decrementAndGet();
            }
        }
        log.info("Liveness session {} discarded", sessionId);
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${flashback.liveness.hosting.eviction-interval:PT30S}")
    public void scheduledEviction() {
        evictExpiredSessions();
    }

    /**
     * Drop sessions older than the configured time-to-live, whatever their state. Running
     * sessions are cancelled on the way out.
     *
     * @return number of sessions removed
     */
    public int evictExpiredSessions() {
        Instant cutoff = clock.instant().minus(properties.getHosting().getSessionTtl());
        int evicted = 0;
        for (Map.Entry<UUID, HostedSession> entry : sessions.entrySet()) {
            HostedSession hosted = entry.getValue();
            if (hosted.createdAt.isBefore(cutoff)) {
                synchronized (hosted) {
                    if (!hosted.session.getState().isTerminal()) {
                        hosted.session.cancel();
                        recordOutcome(hosted);
                    }
                }
                if (sessions.remove(entry.getKey(), hosted)) {
                    reservedSlots.decrementAndGet();
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} expired liveness sessions, {} remain", evicted, sessions.size());
            metrics.recordEvicted(evicted);
        }
        return evicted;
    }

    private HostedSession find(UUID sessionId) {
        HostedSession hosted = sessions.get(sessionId);
        if (hosted == null) {
            throw new LivenessSessionNotFoundException(sessionId);
        }
        return hosted;
    }

    private void recordOutcome(HostedSession hosted) {
        if (hosted.session.getState().isTerminal() && !hosted.outcomeRecorded) {
            hosted.outcomeRecorded = true;
            metrics.recordCompleted(hosted.session.getState());
        }
    }

    private LandmarkSample toSample(LandmarkFrameRequest request) {
        Instant timestamp = Instant.ofEpochMilli(request.getTimestamp());
        if (!Boolean.TRUE.equals(request.getFaceFound())) {
            return LandmarkSample.noFace(timestamp);
        }
        List<List<Double>> landmarks = request.getLandmarks() != null ? request.getLandmarks() : List.of();
        List<Point3D> points = new ArrayList<>(landmarks.size());
        for (List<Double> coordinates : landmarks) {
            points.add(toPoint(coordinates));
        }
        return LandmarkSample.withFace(points, timestamp);
    }

    private static Point3D toPoint(List<Double> coordinates) {
        if (coordinates == null || coordinates.size() < 2) {
            return null;
        }
        double x = coordinateOrNaN(coordinates.get(0));
        double y = coordinateOrNaN(coordinates.get(1));
        double z = coordinates.size() > 2 ? coordinateOrNaN(coordinates.get(2)) : 0.0;
        return new Point3D(x, y, z);
    }

    private static double coordinateOrNaN(Double value) {
        return value != null ? value : Double.NaN;
    }

    private SessionStatusResponse toStatus(HostedSession hosted, FrameObservation lastFrame,
                                           List<LivenessEvent> events, Instant now) {
        LivenessSession session = hosted.session;
        return SessionStatusResponse.builder()
                .sessionId(session.getId())
                .state(session.getState())
                .startedAt(session.getStartedAt().orElse(null))
                .durationMs(session.getDuration().map(Duration::toMillis).orElse(null))
                .frameIntervalMs(session.getFrameInterval().map(Duration::toMillis).orElse(null))
                .progressPercent(session.getProgressPercent(now))
                .blinkCount(session.getBlinkCount())
                .headMoved(session.hasHeadMoved())
                .headMovementCount(session.getHeadMovementCount())
                .mouthActivityCount(session.getMouthActivityCount())
                .framesTotal(session.getFramesTotal())
                .framesWithFace(session.getFramesWithFace())
                .consecutiveMisses(session.getConsecutiveMisses())
                .faceDetectionRate(session.getFaceDetectionRate())
                .verdictAvailable(session.getState().isVerdictAvailable() && !session.isVerdictConsumed())
                .terminationReason(session.getTerminationReason().orElse(null))
                .lastFrame(lastFrame)
                .events(events)
                .build();
    }

    private LivenessResultResponse toResult(UUID sessionId, LivenessResult result) {
        return LivenessResultResponse.builder()
                .sessionId(sessionId)
                .outcome(result.getOutcome())
                .live(result.isLive())
                .confidence(result.getConfidence())
                .reason(result.getReason())
                .detectedBlinks(result.getDetectedBlinks())
                .headMoved(result.isHeadMoved())
                .mouthActivityCount(result.getMouthActivityCount())
                .faceDetectionRate(result.getFaceDetectionRate())
                .faceDetected(result.isFaceDetected())
                .facePosition(result.getFacePosition())
                .framesTotal(result.getFramesTotal())
                .framesWithFace(result.getFramesWithFace())
                .failedFactors(result.getFailedFactors())
                .retryHints(guidanceService.retryHints(result))
                .completedAt(result.getCompletedAt())
                .build();
    }

    private static final class HostedSession {
        private final LivenessSession session;
        private final Instant createdAt;
        private boolean outcomeRecorded;

        private HostedSession(LivenessSession session, Instant createdAt) {
            this.session = session;
            this.createdAt = createdAt;
        }
    }
}
