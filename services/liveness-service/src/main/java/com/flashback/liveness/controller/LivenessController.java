package com.flashback.liveness.controller;

import com.flashback.common.api.ApiResponse;
import com.flashback.liveness.dto.LandmarkFrameRequest;
import com.flashback.liveness.dto.LivenessGuidanceResponse;
import com.flashback.liveness.dto.LivenessResultResponse;
import com.flashback.liveness.dto.SessionStatusResponse;
import com.flashback.liveness.dto.StartSessionRequest;
import com.flashback.liveness.dto.TickRequest;
import com.flashback.liveness.events.LivenessEvent;
import com.flashback.liveness.service.LivenessGuidanceService;
import com.flashback.liveness.service.LivenessSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for remote liveness sessions
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/liveness")
@RequiredArgsConstructor
@Validated
@Tag(name = "Liveness", description = "Face liveness session APIs")
public class LivenessController {

    private final LivenessSessionService sessionService;
    private final LivenessGuidanceService guidanceService;

    @GetMapping("/guidance")
    @Operation(summary = "Get instructions and tips shown before a liveness check")
    public ResponseEntity<ApiResponse<LivenessGuidanceResponse>> getGuidance() {
        return ResponseEntity.ok(ApiResponse.success(guidanceService.getGuidance()));
    }

    @PostMapping("/sessions")
    @Operation(summary = "Start a liveness session")
    public ResponseEntity<ApiResponse<SessionStatusResponse>> startSession(
            @Valid @RequestBody(required = false) StartSessionRequest request) {

        SessionStatusResponse status = sessionService.startSession(request);
        log.info("Liveness session {} opened", status.getSessionId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(status, "Liveness session started"));
    }

    @PostMapping("/sessions/{sessionId}/frames")
    @Operation(summary = "Deliver one landmark sample")
    public ResponseEntity<ApiResponse<SessionStatusResponse>> ingestFrame(
            @PathVariable UUID sessionId,
            @Valid @RequestBody LandmarkFrameRequest request) {

        return ResponseEntity.ok(ApiResponse.success(sessionService.ingestFrame(sessionId, request)));
    }

    @PostMapping("/sessions/{sessionId}/tick")
    @Operation(summary = "Advance the session clock")
    public ResponseEntity<ApiResponse<SessionStatusResponse>> tick(
            @PathVariable UUID sessionId,
            @RequestBody(required = false) TickRequest request) {

        Long timestamp = request != null ? request.getTimestamp() : null;
        return ResponseEntity.ok(ApiResponse.success(sessionService.tick(sessionId, timestamp)));
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    @Operation(summary = "Cancel a running session")
    public ResponseEntity<ApiResponse<SessionStatusResponse>> cancel(@PathVariable UUID sessionId) {
        log.info("Cancelling liveness session {}", sessionId);
        return ResponseEntity.ok(ApiResponse.success(sessionService.cancel(sessionId), "Liveness session cancelled"));
    }

    @GetMapping("/sessions/{sessionId}")
    @Operation(summary = "Get session status")
    public ResponseEntity<ApiResponse<SessionStatusResponse>> getStatus(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.getStatus(sessionId)));
    }

    @GetMapping("/sessions/{sessionId}/events")
    @Operation(summary = "Drain events queued since the last call")
    public ResponseEntity<ApiResponse<List<LivenessEvent>>> drainEvents(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.drainEvents(sessionId)));
    }

    @PostMapping("/sessions/{sessionId}/result")
    @Operation(summary = "Take the verdict of a finished session (once)")
    public ResponseEntity<ApiResponse<LivenessResultResponse>> finalizeResult(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(ApiResponse.success(sessionService.finalizeResult(sessionId)));
    }

    @DeleteMapping("/sessions/{sessionId}")
    @Operation(summary = "Discard a session")
    public ResponseEntity<Void> discard(@PathVariable UUID sessionId) {
        sessionService.discard(sessionId);
        return ResponseEntity.noContent().build();
    }
}
