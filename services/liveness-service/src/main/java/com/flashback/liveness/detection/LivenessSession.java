package com.flashback.liveness.detection;

import com.flashback.liveness.detection.LivenessVerdictCalculator.CompletionCause;
import com.flashback.liveness.domain.FrameObservation;
import com.flashback.liveness.domain.LandmarkSample;
import com.flashback.liveness.domain.LivenessResult;
import com.flashback.liveness.domain.LivenessState;
import com.flashback.liveness.domain.Point3D;
import com.flashback.liveness.events.BlinkEvent;
import com.flashback.liveness.events.FaceLostEvent;
import com.flashback.liveness.events.LivenessEvent;
import com.flashback.liveness.events.MouthActivityEvent;
import com.flashback.liveness.events.MovementEvent;
import com.flashback.liveness.events.ProgressTick;
import com.flashback.liveness.events.SessionCompletedEvent;
import com.flashback.liveness.exception.LivenessSessionStateException;
import com.flashback.liveness.exception.MalformedLandmarkSampleException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One bounded-duration liveness evaluation.
 *
 * <p>The session owns its four signal trackers and drives them from landmark samples delivered
 * by the caller. The caller also drives the clock: {@link #tick(Instant)} is invoked on the
 * sampling cadence (about every 200 ms) and closes the window once the configured duration has
 * elapsed. There is no background timer and no internal threading.</p>
 *
 * <h3>States</h3>
 * <ol>
 *   <li><b>IDLE</b>: created or reset; {@link #start} moves to RUNNING</li>
 *   <li><b>RUNNING</b>: {@link #ingest} and {@link #tick} are accepted</li>
 *   <li><b>PASSED / FAILED / TIMED_OUT</b>: evaluated, {@link #finalizeVerdict()} hands out the
 *       result exactly once</li>
 *   <li><b>CANCELLED / ERROR</b>: no verdict; {@link #finalizeVerdict()} is rejected</li>
 * </ol>
 *
 * <h3>Caller contract</h3>
 * <ul>
 *   <li>Not thread-safe. Deliveries for one session must be serialized; independent sessions
 *       share nothing and may run in parallel.</li>
 *   <li>Samples must arrive in non-decreasing timestamp order. Out-of-order delivery is not
 *       detected and breaks cooldown and hysteresis timing.</li>
 * </ul>
 */
@Slf4j
public class LivenessSession {

    private final UUID id;
    private final LivenessThresholds thresholds;

    private final BlinkTracker blinkTracker;
    private final HeadMovementTracker headMovementTracker;
    private final MouthActivityTracker mouthActivityTracker;
    private final FacePresenceTracker facePresenceTracker;
    private final FrameHistory history;
    private final LivenessVerdictCalculator verdictCalculator;

    private final List<LivenessEvent> pendingEvents = new ArrayList<>();

    private LivenessState state = LivenessState.IDLE;
    private Instant startedAt;
    private Instant lastSeenAt;
    private Duration duration;
    private Duration frameInterval;
    private LivenessResult verdict;
    private boolean verdictConsumed;
    private String terminationReason;

    public LivenessSession(LivenessThresholds thresholds) {
        this(UUID.randomUUID(), thresholds);
    }

    public LivenessSession(UUID id, LivenessThresholds thresholds) {
        this.id = id;
        this.thresholds = thresholds.validate();
        this.blinkTracker = new BlinkTracker(thresholds);
        this.headMovementTracker = new HeadMovementTracker(thresholds);
        this.mouthActivityTracker = new MouthActivityTracker(thresholds);
        this.facePresenceTracker = new FacePresenceTracker();
        this.history = new FrameHistory(thresholds.getHistoryCapacity());
        this.verdictCalculator = new LivenessVerdictCalculator(thresholds);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Start sampling with the configured duration and frame interval.
     */
    public void start(Instant now) {
        start(now, thresholds.getSessionDuration(), thresholds.getFrameInterval());
    }

    /**
     * Start sampling.
     *
     * @param now               session start time, on the same clock as sample timestamps
     * @param duration          length of the sampling window
     * @param frameIntervalHint expected gap between frames; informational only
     */
    public void start(Instant now, Duration duration, Duration frameIntervalHint) {
        requireState("start", LivenessState.IDLE);
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be positive");
        }
        if (frameIntervalHint == null || frameIntervalHint.isZero() || frameIntervalHint.isNegative()) {
            throw new IllegalArgumentException("frameIntervalHint must be positive");
        }

        resetSignals();
        this.startedAt = now;
        this.lastSeenAt = now;
        this.duration = duration;
        this.frameInterval = frameIntervalHint;
        transitionTo(LivenessState.RUNNING);

        log.info("Liveness session {} started: duration={}ms, frameInterval={}ms, expected frames={}",
                id, duration.toMillis(), frameIntervalHint.toMillis(), expectedFrameCount());
    }

    /**
     * Process one landmark sample.
     *
     * <p>A sample without a face, or with a degenerate eye contour, counts as a missed frame.
     * Crossing the consecutive-miss ceiling ends the session as FAILED ("face lost").</p>
     *
     * @return the signals derived from the sample
     * @throws LivenessSessionStateException    if the session is not RUNNING
     * @throws MalformedLandmarkSampleException if a face-found sample has an unusable landmark
     *                                          set; the session moves to ERROR
     */
    public FrameObservation ingest(LandmarkSample sample) {
        requireState("ingest", LivenessState.RUNNING);
        if (sample == null) {
            throw fail("Landmark sample must not be null");
        }

        Instant now = sample.getTimestamp();
        lastSeenAt = now;
        if (!sample.isFaceFound()) {
            return recordMiss(now);
        }

        validate(sample);

        if (FaceGeometry.isDegenerateEye(sample, FaceMeshLandmarks.LEFT_EYE)
                || FaceGeometry.isDegenerateEye(sample, FaceMeshLandmarks.RIGHT_EYE)) {
            log.debug("Session {}: degenerate eye contour at {}, counting frame as a miss", id, now);
            return recordMiss(now);
        }

        facePresenceTracker.update(true);

        double leftEar = FaceGeometry.eyeAspectRatio(sample, FaceMeshLandmarks.LEFT_EYE);
        double rightEar = FaceGeometry.eyeAspectRatio(sample, FaceMeshLandmarks.RIGHT_EYE);
        double mouthOpening = FaceGeometry.mouthOpening(sample,
                FaceMeshLandmarks.UPPER_INNER_LIP, FaceMeshLandmarks.LOWER_INNER_LIP);
        Point3D nose = sample.point(FaceMeshLandmarks.NOSE_TIP);

        Optional<BlinkEvent> blink = blinkTracker.update(leftEar, rightEar, now);
        blink.ifPresent(pendingEvents::add);

        boolean movementLatched = headMovementTracker.update(nose.x(), now);
        if (movementLatched) {
            pendingEvents.add(new MovementEvent(now, headMovementTracker.getLastDelta()));
        }

        boolean mouthActivity = mouthActivityTracker.update(mouthOpening, now);
        if (mouthActivity) {
            pendingEvents.add(new MouthActivityEvent(now, mouthActivityTracker.getCount(), mouthOpening));
        }

        FrameObservation observation = new FrameObservation(now, true, leftEar, rightEar, mouthOpening,
                nose.x(), nose.y(), blink.isPresent(), movementLatched, mouthActivity);
        history.add(observation);
        return observation;
    }

    /**
     * Advance the session clock. Emits a {@link ProgressTick} and, once the window has
     * elapsed, evaluates the verdict. Ticks on an already finished session are ignored.
     *
     * @return the state after the tick
     * @throws LivenessSessionStateException if the session was never started
     */
    public LivenessState tick(Instant now) {
        if (state == LivenessState.IDLE) {
            throw stateViolation("tick", LivenessState.RUNNING);
        }
        if (state.isTerminal()) {
            log.debug("Session {}: tick ignored in terminal state {}", id, state.name());
            return state;
        }

        lastSeenAt = now;
        Duration elapsed = elapsed(now);
        pendingEvents.add(new ProgressTick(now, elapsed.toMillis(), progressPercent(elapsed)));

        if (elapsed.compareTo(duration) >= 0) {
            complete(CompletionCause.WINDOW_ELAPSED, now);
        }
        return state;
    }

    /**
     * Abort a running session. The trackers are discarded and no verdict will be produced.
     * Releasing the camera stays with the caller.
     */
    public void cancel() {
        requireState("cancel", LivenessState.RUNNING);
        resetSignals();
        terminationReason = "Cancelled by caller";
        transitionTo(LivenessState.CANCELLED);
        pendingEvents.add(new SessionCompletedEvent(lastSeenAt, LivenessState.CANCELLED, false, terminationReason));
        log.info("Liveness session {} cancelled", id);
    }

    /**
     * Hand out the verdict. Callable exactly once, and only after normal completion
     * (PASSED, FAILED or TIMED_OUT).
     *
     * @throws LivenessSessionStateException if the session has no verdict or it was already taken
     */
    public LivenessResult finalizeVerdict() {
        if (!state.isVerdictAvailable()) {
            throw stateViolation("finalize", LivenessState.PASSED, LivenessState.FAILED, LivenessState.TIMED_OUT);
        }
        if (verdictConsumed) {
            log.warn("Session {}: verdict requested twice", id);
            throw new LivenessSessionStateException("finalize", state,
                    "Liveness session verdict has already been finalized");
        }
        verdictConsumed = true;
        return verdict;
    }

    /**
     * Return a finished session to IDLE so it can be started again.
     */
    public void reset() {
        if (!state.isTerminal()) {
            throw stateViolation("reset", LivenessState.PASSED, LivenessState.FAILED, LivenessState.TIMED_OUT,
                    LivenessState.CANCELLED, LivenessState.ERROR);
        }
        resetSignals();
        pendingEvents.clear();
        startedAt = null;
        lastSeenAt = null;
        duration = null;
        frameInterval = null;
        verdict = null;
        verdictConsumed = false;
        terminationReason = null;
        transitionTo(LivenessState.IDLE);
    }

    /**
     * @return events queued since the previous call, oldest first
     */
    public List<LivenessEvent> drainEvents() {
        List<LivenessEvent> drained = List.copyOf(pendingEvents);
        pendingEvents.clear();
        return drained;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public UUID getId() {
        return id;
    }

    public LivenessState getState() {
        return state;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Duration> getDuration() {
        return Optional.ofNullable(duration);
    }

    public Optional<Duration> getFrameInterval() {
        return Optional.ofNullable(frameInterval);
    }

    public int getBlinkCount() {
        return blinkTracker.getCount();
    }

    public boolean hasHeadMoved() {
        return headMovementTracker.hasMoved();
    }

    /** @return head movements counted so far, including those after the first one latched */
    public int getHeadMovementCount() {
        return headMovementTracker.getMovementCount();
    }

    public int getMouthActivityCount() {
        return mouthActivityTracker.getCount();
    }

    public int getFramesTotal() {
        return facePresenceTracker.getFramesTotal();
    }

    public int getFramesWithFace() {
        return facePresenceTracker.getFramesWithFace();
    }

    public int getConsecutiveMisses() {
        return facePresenceTracker.getConsecutiveMisses();
    }

    public double getFaceDetectionRate() {
        return facePresenceTracker.detectionRate();
    }

    public boolean isVerdictConsumed() {
        return verdictConsumed;
    }

    /**
     * @return why the session ended without a verdict (CANCELLED or ERROR), if it did
     */
    public Optional<String> getTerminationReason() {
        return Optional.ofNullable(terminationReason);
    }

    public List<FrameObservation> recentFrames() {
        return history.snapshot();
    }

    public int getProgressPercent(Instant now) {
        if (state == LivenessState.IDLE) {
            return 0;
        }
        if (state.isTerminal()) {
            return 100;
        }
        return progressPercent(elapsed(now));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private FrameObservation recordMiss(Instant now) {
        facePresenceTracker.update(false);
        FrameObservation observation = FrameObservation.missed(now);
        history.add(observation);

        int misses = facePresenceTracker.getConsecutiveMisses();
        if (misses > thresholds.getMaxConsecutiveMisses()) {
            log.warn("Liveness session {}: face lost after {} consecutive missed frames", id, misses);
            pendingEvents.add(new FaceLostEvent(now, misses));
            complete(CompletionCause.FACE_LOST, now);
        }
        return observation;
    }

    private void complete(CompletionCause cause, Instant now) {
        verdict = verdictCalculator.evaluate(
                blinkTracker.getCount(),
                headMovementTracker.hasMoved(),
                mouthActivityTracker.getCount(),
                facePresenceTracker,
                history.dominantFacePosition(),
                cause,
                now);
        transitionTo(verdict.getOutcome());
        pendingEvents.add(new SessionCompletedEvent(now, verdict.getOutcome(), verdict.isLive(), verdict.getReason()));

        log.info("Liveness session {} completed: outcome={}, live={}, confidence={}, blinks={}, headMoved={}, "
                        + "mouthActivity={}, faceRate={}",
                id, verdict.getOutcome().name(), verdict.isLive(), String.format("%.2f", verdict.getConfidence()),
                verdict.getDetectedBlinks(), verdict.isHeadMoved(), verdict.getMouthActivityCount(),
                String.format("%.2f", verdict.getFaceDetectionRate()));
    }

    private void validate(LandmarkSample sample) {
        if (sample.size() != thresholds.getExpectedLandmarkCount()) {
            throw fail(String.format("Landmark sample has %d points, expected %d",
                    sample.size(), thresholds.getExpectedLandmarkCount()));
        }
        for (int i = 0; i < sample.size(); i++) {
            Point3D point = sample.point(i);
            if (point == null || !point.isFinite()) {
                throw fail("Landmark " + i + " is missing or not a finite coordinate");
            }
        }
    }

    private MalformedLandmarkSampleException fail(String message) {
        terminationReason = message;
        transitionTo(LivenessState.ERROR);
        pendingEvents.add(new SessionCompletedEvent(lastSeenAt, LivenessState.ERROR, false, message));
        log.warn("Liveness session {} moved to ERROR: {}", id, message);
        MalformedLandmarkSampleException exception = new MalformedLandmarkSampleException(message);
        exception.withMetadata("sessionId", id);
        return exception;
    }

    private void requireState(String operation, LivenessState required) {
        if (state != required) {
            throw stateViolation(operation, required);
        }
    }

    private LivenessSessionStateException stateViolation(String operation, LivenessState... allowed) {
        log.warn("Session {}: {} rejected in state {}", id, operation, state.name());
        return new LivenessSessionStateException(operation, state, allowed);
    }

    private void transitionTo(LivenessState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal liveness state transition " + state.name() + " -> " + target.name());
        }
        state = target;
    }

    private void resetSignals() {
        blinkTracker.reset();
        headMovementTracker.reset();
        mouthActivityTracker.reset();
        facePresenceTracker.reset();
        history.clear();
    }

    private Duration elapsed(Instant now) {
        Duration elapsed = Duration.between(startedAt, now);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private int progressPercent(Duration elapsed) {
        long percent = elapsed.toMillis() * 100 / duration.toMillis();
        return (int) Math.min(100, percent);
    }

    private long expectedFrameCount() {
        return duration.toMillis() / frameInterval.toMillis();
    }
}
