package io.seventytwo.blocks.timer;

import io.seventytwo.blocks.api.RunSnapshot;
import io.seventytwo.blocks.api.Segment;

/**
 * Receives engine events. Called on the engine's execution context while it holds its lock, so
 * implementations must return quickly and hand slow work off elsewhere. Exceptions are logged and
 * otherwise ignored.
 */
public interface TimerListener {
    default void onTick(int timeLeft, double progressPercent) {}

    default void onSegmentBoundary(Segment segment) {}

    /** Mid-slot break reminder; the session keeps running. */
    default void onBreakNotify() {}

    default void onSnapshot(RunSnapshot snapshot) {}

    default void onComplete(CompletionEvent event) {}

    /** Automatic continuation was refused until the user checks in. */
    default void onCheckInRequired() {}

    /** The slot ended while paused; the user should decide what happens to the session. */
    default void onPausedExpiry(TimerView view) {}

    default void onStateChanged(TimerView view) {}
}
