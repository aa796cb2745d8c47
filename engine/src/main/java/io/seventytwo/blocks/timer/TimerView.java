package io.seventytwo.blocks.timer;

import io.seventytwo.blocks.api.Segment;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable picture of the engine at one instant. Fields describing the session are null or zero
 * while {@link TimerPhase#IDLE}.
 *
 * @param secondsUsed active seconds credited so far; frozen while paused
 * @param visualFill 0..1 fill of the slot's progress bar
 * @param progressPercent share of the session's real duration that has passed
 * @param segments every segment of the slot, earlier sessions and the in-progress tail included
 */
public record TimerView(
        TimerPhase phase,
        int blockIndex,
        @Nullable LocalDate date,
        @Nullable SessionMode mode,
        @Nullable Instant startedAt,
        @Nullable Instant endAt,
        int initialDurationSeconds,
        int timeLeft,
        int secondsUsed,
        int pausedSeconds,
        double visualFill,
        double progressPercent,
        List<Segment> segments,
        @Nullable Instant breakNotifyAt,
        int consecutiveAutoContinuations,
        boolean checkInRequired) {

    public TimerView {
        segments = List.copyOf(segments);
    }

    public static TimerView idle(int consecutiveAutoContinuations, boolean checkInRequired) {
        return new TimerView(
                TimerPhase.IDLE,
                -1,
                null,
                null,
                null,
                null,
                0,
                0,
                0,
                0,
                0,
                0,
                List.of(),
                null,
                consecutiveAutoContinuations,
                checkInRequired);
    }

    public boolean isBreak() {
        return mode != null && mode.isBreak();
    }

    /** Category currently being recorded; null during a break. */
    public @Nullable String category() {
        return mode == null || mode.isBreak() ? null : mode.workContext().category();
    }

    public @Nullable String label() {
        return mode == null || mode.isBreak() ? null : mode.workContext().label();
    }
}
