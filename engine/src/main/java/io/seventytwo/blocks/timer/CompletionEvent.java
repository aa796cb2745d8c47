package io.seventytwo.blocks.timer;

import io.seventytwo.blocks.api.Segment;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A session ended and its time should be recorded.
 *
 * @param secondsUsed credited seconds; equals {@code initialDurationSeconds} on natural completion
 * @param segments every segment of the slot, earlier sessions included
 * @param visualFill exactly 1.0 on natural completion, the actual fill otherwise
 * @param natural true when the slot boundary was reached while running
 * @param completedAt the slot boundary for natural completion, otherwise when the session was stopped
 */
public record CompletionEvent(
        int blockIndex,
        LocalDate date,
        boolean isBreak,
        int secondsUsed,
        int initialDurationSeconds,
        List<Segment> segments,
        double visualFill,
        boolean natural,
        @Nullable String category,
        @Nullable String label,
        Instant completedAt) {

    public CompletionEvent {
        segments = List.copyOf(segments);
    }
}
