package io.seventytwo.blocks.timer;

import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.api.SegmentKind;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Request to start a session on a slot.
 *
 * @param existingSegments segments recorded on this slot by earlier sessions
 * @param existingVisualFill fill already shown for this slot; derived from {@code existingSegments} when null
 */
public record StartRequest(
        int blockIndex,
        LocalDate date,
        SegmentKind mode,
        WorkContext workContext,
        List<Segment> existingSegments,
        @Nullable Double existingVisualFill) {

    public StartRequest {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(workContext, "workContext");
        existingSegments = List.copyOf(existingSegments);
        if (existingVisualFill != null && (existingVisualFill.isNaN() || existingVisualFill < 0)) {
            throw new IllegalArgumentException("existingVisualFill must be non-negative, got: " + existingVisualFill);
        }
    }

    public static StartRequest work(int blockIndex, LocalDate date, @Nullable String category, @Nullable String label) {
        return new StartRequest(
                blockIndex, date, SegmentKind.WORK, new WorkContext(category, label), List.of(), null);
    }

    public static StartRequest rest(int blockIndex, LocalDate date) {
        return new StartRequest(blockIndex, date, SegmentKind.BREAK, WorkContext.NONE, List.of(), null);
    }

    public StartRequest withExistingSegments(List<Segment> segments) {
        return new StartRequest(blockIndex, date, mode, workContext, segments, existingVisualFill);
    }

    public StartRequest withExistingVisualFill(double fill) {
        return new StartRequest(blockIndex, date, mode, workContext, existingSegments, fill);
    }
}
