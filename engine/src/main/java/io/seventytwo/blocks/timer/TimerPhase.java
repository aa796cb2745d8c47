package io.seventytwo.blocks.timer;

/** Where the engine's single session is in its lifecycle. */
public enum TimerPhase {
    /** No session. */
    IDLE,
    /** Counting down toward the slot boundary. */
    RUNNING,
    /** Frozen by the user; the slot boundary still approaches. */
    PAUSED,
    /** The slot ended while paused. Waits for an explicit decision; no time is credited for the pause. */
    PAUSED_EXPIRY,
    /** The slot boundary was reached while running. Held until dismissed or continued. */
    COMPLETED;

    public boolean hasSession() {
        return this != IDLE;
    }

    /** Phases in which time is still being accounted to the session. */
    public boolean isLive() {
        return this == RUNNING || this == PAUSED;
    }
}
