package com.flashback.liveness.domain;

/**
 * Lifecycle of a liveness session.
 *
 * <h3>Status Flow:</h3>
 * <pre>
 * IDLE → RUNNING → PASSED | FAILED | TIMED_OUT   (evaluated, verdict available)
 *              ↘ CANCELLED                       (caller aborted, no verdict)
 *              ↘ ERROR                           (caller contract violation, no verdict)
 * </pre>
 *
 * <p>Every state other than IDLE and RUNNING is terminal. A terminal session can only be
 * {@linkplain #canTransitionTo(LivenessState) reset} back to IDLE for a retry.</p>
 */
public enum LivenessState {

    IDLE("Waiting to start", false, false),

    RUNNING("Sampling frames", false, false),

    /** All hard pass conditions were met when the window closed. */
    PASSED("Liveness confirmed", true, true),

    /** Evaluated negative: conditions unmet at timeout, or the face was lost. */
    FAILED("Liveness not confirmed", true, true),

    /** The window closed without a single frame having been delivered. */
    TIMED_OUT("No frames received", true, true),

    CANCELLED("Cancelled by caller", true, false),

    /** Unrecoverable input such as a landmark sample with the wrong point count. */
    ERROR("Malformed input", true, false);

    private final String description;
    private final boolean terminal;
    private final boolean verdictAvailable;

    LivenessState(String description, boolean terminal, boolean verdictAvailable) {
        this.description = description;
        this.terminal = terminal;
        this.verdictAvailable = verdictAvailable;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * @return true if the session reached this state through normal completion and
     *         therefore holds a {@link LivenessResult}
     */
    public boolean isVerdictAvailable() {
        return verdictAvailable;
    }

    /**
     * Validates a state machine transition.
     *
     * <ul>
     *   <li>IDLE → RUNNING</li>
     *   <li>RUNNING → PASSED, FAILED, TIMED_OUT, CANCELLED, ERROR</li>
     *   <li>any terminal state → IDLE (reset)</li>
     * </ul>
     *
     * @throws IllegalArgumentException if target is null
     */
    public boolean canTransitionTo(LivenessState target) {
        if (target == null) {
            throw new IllegalArgumentException("Target state cannot be null");
        }
        if (this == target) {
            return false;
        }
        switch (this) {
            case IDLE:
                return target == RUNNING;
            case RUNNING:
                return target.isTerminal();
            default:
                return target == IDLE;
        }
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
