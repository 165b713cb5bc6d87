package com.flashback.liveness.detection;

import com.flashback.liveness.LandmarkSamples;
import com.flashback.liveness.domain.FacePosition;
import com.flashback.liveness.domain.FrameObservation;
import com.flashback.liveness.domain.LandmarkSample;
import com.flashback.liveness.domain.LivenessFactor;
import com.flashback.liveness.domain.LivenessResult;
import com.flashback.liveness.domain.LivenessState;
import com.flashback.liveness.domain.Point3D;
import com.flashback.liveness.events.FaceLostEvent;
import com.flashback.liveness.events.LivenessEvent;
import com.flashback.liveness.events.LivenessEventType;
import com.flashback.liveness.events.ProgressTick;
import com.flashback.liveness.events.SessionCompletedEvent;
import com.flashback.liveness.exception.LivenessSessionStateException;
import com.flashback.liveness.exception.MalformedLandmarkSampleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

import static com.flashback.liveness.LandmarkSamples.CLOSED_EAR;
import static com.flashback.liveness.LandmarkSamples.OPEN_EAR;
import static com.flashback.liveness.LandmarkSamples.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("LivenessSession")
class LivenessSessionTest {

    private static final int FRAMES = 40;
    private static final long FRAME_MS = 200;

    private LivenessSession session;

    @BeforeEach
    void setUp() {
        session = new LivenessSession(LivenessThresholds.defaults());
    }

    /**
     * Forty frames over eight seconds with two blinks, one head turn and two mouth openings.
     */
    private static LandmarkSample liveFrame(int i) {
        double ear = (i == 5 || i == 15) ? CLOSED_EAR : OPEN_EAR;
        double noseX = i >= 10 ? 0.55 : 0.50;
        double mouth = (i == 20 || i == 30) ? 0.06 : 0.0;
        return LandmarkSamples.face(at(i * FRAME_MS), ear, mouth, noseX);
    }

    private void runFrames(IntFunction<LandmarkSample> frames) {
        for (int i = 0; i < FRAMES; i++) {
            session.ingest(frames.apply(i));
            session.tick(at(i * FRAME_MS));
        }
    }

    private static List<LivenessEventType> typesOf(List<LivenessEvent> events) {
        return events.stream().map(LivenessEvent::type).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Complete runs")
    class CompleteRuns {

        @Test
        @DisplayName("Live subject passes once the window elapses")
        void shouldPassLiveSubject() {
            // Given
            session.start(at(0));

            // When
            runFrames(LivenessSessionTest::liveFrame);
            assertThat(session.getState()).isEqualTo(LivenessState.RUNNING);
            LivenessState state = session.tick(at(8000));

            // Then
            assertThat(state).isEqualTo(LivenessState.PASSED);
            LivenessResult result = session.finalizeVerdict();
            assertThat(result.isLive()).isTrue();
            assertThat(result.getConfidence()).isCloseTo(1.0, within(1e-9));
            assertThat(result.getDetectedBlinks()).isEqualTo(2);
            assertThat(result.isHeadMoved()).isTrue();
            assertThat(result.getMouthActivityCount()).isEqualTo(2);
            assertThat(result.getFaceDetectionRate()).isEqualTo(1.0);
            assertThat(result.getFacePosition()).isEqualTo(FacePosition.CENTER);
            assertThat(result.getCompletedAt()).isEqualTo(at(8000));
        }

        @Test
        @DisplayName("Still photo fails on blink, movement and mouth")
        void shouldFailStillPhoto() {
            session.start(at(0));

            runFrames(i -> LandmarkSamples.neutral(at(i * FRAME_MS)));
            session.tick(at(8000));

            LivenessResult result = session.finalizeVerdict();
            assertThat(session.getState()).isEqualTo(LivenessState.FAILED);
            assertThat(result.isLive()).isFalse();
            assertThat(result.getFailedFactors()).containsExactly(
                    LivenessFactor.BLINK, LivenessFactor.HEAD_MOVEMENT, LivenessFactor.MOUTH_ACTIVITY);
            assertThat(result.getConfidence()).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("Queues typed events in processing order")
        void shouldQueueEvents() {
            session.start(at(0));

            runFrames(LivenessSessionTest::liveFrame);
            session.tick(at(8000));

            List<LivenessEvent> events = session.drainEvents();
            List<LivenessEventType> types = typesOf(events);
            assertThat(types).filteredOn(t -> t == LivenessEventType.BLINK).hasSize(2);
            assertThat(types).filteredOn(t -> t == LivenessEventType.MOVEMENT).hasSize(1);
            assertThat(types).filteredOn(t -> t == LivenessEventType.MOUTH_ACTIVITY).hasSize(2);
            assertThat(types).filteredOn(t -> t == LivenessEventType.PROGRESS).hasSize(FRAMES + 1);
            assertThat(types).last().isEqualTo(LivenessEventType.SESSION_COMPLETED);
            assertThat(types.indexOf(LivenessEventType.BLINK)).isLessThan(types.indexOf(LivenessEventType.MOVEMENT));

            SessionCompletedEvent completed = (SessionCompletedEvent) events.get(events.size() - 1);
            assertThat(completed.outcome()).isEqualTo(LivenessState.PASSED);
            assertThat(completed.live()).isTrue();

            assertThat(session.drainEvents()).isEmpty();
        }

        @Test
        @DisplayName("Progress ticks report elapsed share of the window")
        void shouldReportProgress() {
            session.start(at(0));

            session.tick(at(2000));

            List<LivenessEvent> events = session.drainEvents();
            assertThat(events).singleElement().isInstanceOf(ProgressTick.class);
            ProgressTick tick = (ProgressTick) events.get(0);
            assertThat(tick.elapsedMillis()).isEqualTo(2000);
            assertThat(tick.percent()).isEqualTo(25);
            assertThat(session.getProgressPercent(at(4000))).isEqualTo(50);
        }

        @Test
        @DisplayName("A window without any frame times out")
        void shouldTimeOutWithoutFrames() {
            session.start(at(0));

            assertThat(session.tick(at(8000))).isEqualTo(LivenessState.TIMED_OUT);

            LivenessResult result = session.finalizeVerdict();
            assertThat(result.isLive()).isFalse();
            assertThat(result.getOutcome()).isEqualTo(LivenessState.TIMED_OUT);
            assertThat(session.getProgressPercent(at(9000))).isEqualTo(100);
        }

        @Test
        @DisplayName("Custom duration closes the window early")
        void shouldHonourCustomDuration() {
            session.start(at(0), Duration.ofSeconds(2), Duration.ofMillis(100));

            session.ingest(LandmarkSamples.neutral(at(100)));

            assertThat(session.tick(at(2000))).isEqualTo(LivenessState.FAILED);
            assertThat(session.getDuration()).contains(Duration.ofSeconds(2));
            assertThat(session.getFrameInterval()).contains(Duration.ofMillis(100));
        }
    }

    @Nested
    @DisplayName("Face presence")
    class FacePresence {

        @Test
        @DisplayName("Crossing the miss ceiling fails the session before the window ends")
        void shouldFailWhenFaceLost() {
            // Given
            session.start(at(0));
            session.ingest(LandmarkSamples.neutral(at(0)));

            // When eleven consecutive frames have no face
            for (int i = 1; i <= 11; i++) {
                session.ingest(LandmarkSample.noFace(at(i * FRAME_MS)));
            }

            // Then
            assertThat(session.getState()).isEqualTo(LivenessState.FAILED);
            List<LivenessEvent> events = session.drainEvents();
            assertThat(events).filteredOn(e -> e instanceof FaceLostEvent)
                    .singleElement()
                    .satisfies(e -> assertThat(((FaceLostEvent) e).consecutiveMisses()).isEqualTo(11));

            LivenessResult result = session.finalizeVerdict();
            assertThat(result.isLive()).isFalse();
            assertThat(result.getReason()).startsWith("Face lost");
            assertThat(result.getCompletedAt()).isEqualTo(at(2200));
        }

        @Test
        @DisplayName("Misses up to the ceiling keep the session running")
        void shouldTolerateMissesUpToCeiling() {
            session.start(at(0));

            for (int i = 0; i < 10; i++) {
                session.ingest(LandmarkSample.noFace(at(i * FRAME_MS)));
            }

            assertThat(session.getState()).isEqualTo(LivenessState.RUNNING);
            assertThat(session.getConsecutiveMisses()).isEqualTo(10);
            assertThat(session.getFaceDetectionRate()).isZero();
        }

        @Test
        @DisplayName("A degenerate eye contour counts as a missed frame")
        void shouldTreatDegenerateEyeAsMiss() {
            session.start(at(0));

            FrameObservation observation = session.ingest(LandmarkSamples.degenerateEyes(at(0)));

            assertThat(observation.faceFound()).isFalse();
            assertThat(session.getState()).isEqualTo(LivenessState.RUNNING);
            assertThat(session.getFramesTotal()).isEqualTo(1);
            assertThat(session.getFramesWithFace()).isZero();
        }
    }

    @Nested
    @DisplayName("Malformed samples")
    class MalformedSamples {

        @Test
        @DisplayName("Wrong point count moves the session to ERROR")
        void shouldRejectWrongPointCount() {
            session.start(at(0));
            List<Point3D> points = LandmarkSamples.points(OPEN_EAR, 0.0, 0.5).subList(0, 400);

            assertThatThrownBy(() -> session.ingest(LandmarkSample.withFace(points, at(0))))
                    .isInstanceOf(MalformedLandmarkSampleException.class)
                    .hasMessageContaining("400");

            assertThat(session.getState()).isEqualTo(LivenessState.ERROR);
            assertThat(session.getTerminationReason()).hasValueSatisfying(r -> assertThat(r).contains("468"));
            assertThatThrownBy(session::finalizeVerdict).isInstanceOf(LivenessSessionStateException.class);
        }

        @Test
        @DisplayName("Missing or non-finite points move the session to ERROR")
        void shouldRejectMissingPoint() {
            session.start(at(0));
            List<Point3D> points = new ArrayList<>(LandmarkSamples.points(OPEN_EAR, 0.0, 0.5));
            points.set(100, null);

            assertThatThrownBy(() -> session.ingest(LandmarkSample.withFace(points, at(0))))
                    .isInstanceOf(MalformedLandmarkSampleException.class)
                    .satisfies(e -> assertThat(((MalformedLandmarkSampleException) e).getMetadata())
                            .containsEntry("sessionId", session.getId()));

            assertThat(session.getState()).isEqualTo(LivenessState.ERROR);
        }

        @Test
        @DisplayName("NaN coordinates are rejected")
        void shouldRejectNaN() {
            session.start(at(0));
            List<Point3D> points = new ArrayList<>(LandmarkSamples.points(OPEN_EAR, 0.0, 0.5));
            points.set(1, new Point3D(Double.NaN, 0.5, 0.0));

            assertThatThrownBy(() -> session.ingest(LandmarkSample.withFace(points, at(0))))
                    .isInstanceOf(MalformedLandmarkSampleException.class);
        }
    }

    @Nested
    @DisplayName("Caller contract")
    class CallerContract {

        @Test
        @DisplayName("Ingest before start is rejected")
        void shouldRejectIngestWhenIdle() {
            assertThatThrownBy(() -> session.ingest(LandmarkSamples.neutral(at(0))))
                    .isInstanceOf(LivenessSessionStateException.class)
                    .satisfies(e -> assertThat(((LivenessSessionStateException) e).getState())
                            .isEqualTo(LivenessState.IDLE));
        }

        @Test
        @DisplayName("Tick before start is rejected")
        void shouldRejectTickWhenIdle() {
            assertThatThrownBy(() -> session.tick(at(0))).isInstanceOf(LivenessSessionStateException.class);
        }

        @Test
        @DisplayName("Starting twice is rejected")
        void shouldRejectDoubleStart() {
            session.start(at(0));

            assertThatThrownBy(() -> session.start(at(10))).isInstanceOf(LivenessSessionStateException.class);
        }

        @Test
        @DisplayName("Cancelled session has no verdict")
        void shouldRejectFinalizeAfterCancel() {
            session.start(at(0));
            session.ingest(LandmarkSamples.neutral(at(0)));

            session.cancel();

            assertThat(session.getState()).isEqualTo(LivenessState.CANCELLED);
            assertThat(session.getBlinkCount()).isZero();
            assertThat(session.getFramesTotal()).isZero();
            assertThat(typesOf(session.drainEvents())).containsExactly(LivenessEventType.SESSION_COMPLETED);
            assertThatThrownBy(session::finalizeVerdict).isInstanceOf(LivenessSessionStateException.class);
        }

        @Test
        @DisplayName("Verdict is handed out only once")
        void shouldRejectSecondFinalize() {
            session.start(at(0));
            session.tick(at(8000));
            session.finalizeVerdict();

            assertThatThrownBy(session::finalizeVerdict)
                    .isInstanceOf(LivenessSessionStateException.class)
                    .hasMessageContaining("already been finalized");
            assertThat(session.isVerdictConsumed()).isTrue();
        }

        @Test
        @DisplayName("Frames after completion are rejected and ticks ignored")
        void shouldRejectIngestAfterCompletion() {
            session.start(at(0));
            session.tick(at(8000));
            session.drainEvents();

            assertThat(session.tick(at(8200))).isEqualTo(LivenessState.TIMED_OUT);
            assertThat(session.drainEvents()).isEmpty();
            assertThatThrownBy(() -> session.ingest(LandmarkSamples.neutral(at(8200))))
                    .isInstanceOf(LivenessSessionStateException.class);
        }

        @Test
        @DisplayName("Reset returns a finished session to IDLE for another attempt")
        void shouldResetFinishedSession() {
            session.start(at(0));
            session.cancel();

            session.reset();

            assertThat(session.getState()).isEqualTo(LivenessState.IDLE);
            assertThat(session.getStartedAt()).isEmpty();
            assertThat(session.getTerminationReason()).isEmpty();
            session.start(at(10_000));
            assertThat(session.getState()).isEqualTo(LivenessState.RUNNING);
        }

        @Test
        @DisplayName("Reset of a running session is rejected")
        void shouldRejectResetWhileRunning() {
            session.start(at(0));

            assertThatThrownBy(session::reset).isInstanceOf(LivenessSessionStateException.class);
        }
    }

    @Test
    @DisplayName("Recent frames keep the configured history")
    void shouldKeepRecentFrames() {
        session.start(at(0));

        for (int i = 0; i < 15; i++) {
            session.ingest(LandmarkSamples.neutral(at(i * FRAME_MS)));
        }

        List<FrameObservation> frames = session.recentFrames();
        assertThat(frames).hasSize(10);
        assertThat(frames.get(0).timestamp()).isEqualTo(at(5 * FRAME_MS));
        assertThat(frames.get(9).averageEar()).isCloseTo(OPEN_EAR, within(1e-9));
    }
}
