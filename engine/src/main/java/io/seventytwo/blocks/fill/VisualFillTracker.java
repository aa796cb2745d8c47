package io.seventytwo.blocks.fill;

import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.calendar.BlockCalendar;
import java.time.Duration;
import java.util.List;

/**
 * Converts live seconds into the 0..1 proportion a slot's progress bar should show.
 *
 * <p>The scale factor is the remaining visual space divided by the remaining real time, taken at the
 * moment a session starts or resumes. A session that begins late in a slot, or on top of earlier
 * segments, therefore still reaches a full bar exactly at the slot boundary.
 *
 * @param previousVisualProportion fill already taken before the live window, 0..1
 * @param scaleFactor fill added per live second
 */
public record VisualFillTracker(double previousVisualProportion, double scaleFactor) {
    public static final double FULL = 1.0;
    /** One full slot's worth of seconds fills the bar; used when nothing better is known. */
    public static final double BASELINE_SCALE = 1.0 / BlockCalendar.SLOT_SECONDS;

    public VisualFillTracker {
        if (Double.isNaN(previousVisualProportion) || previousVisualProportion < 0 || previousVisualProportion > FULL) {
            throw new IllegalArgumentException(
                    "previousVisualProportion must be within 0..1, got: " + previousVisualProportion);
        }
        if (Double.isNaN(scaleFactor) || Double.isInfinite(scaleFactor) || scaleFactor < 0) {
            throw new IllegalArgumentException("scaleFactor must be a non-negative number, got: " + scaleFactor);
        }
    }

    /**
     * Tracker for a window starting with {@code previousVisualProportion} already filled and
     * {@code remainingReal} left until the slot boundary.
     */
    public static VisualFillTracker begin(double previousVisualProportion, Duration remainingReal) {
        double previous = clamp(previousVisualProportion);
        double seconds = BlockCalendar.preciseSeconds(remainingReal);
        double scale = seconds > 0 ? (FULL - previous) / seconds : BASELINE_SCALE;
        return new VisualFillTracker(previous, scale);
    }

    /** Fill taken by earlier segments at the fixed one-slot-per-1200-seconds rate, capped at 1. */
    public static double baselineProportion(List<Segment> segments) {
        return Math.min(FULL, Segment.totalSeconds(segments) * BASELINE_SCALE);
    }

    /** Fill after {@code liveSeconds} seconds of the live window. */
    public double currentFill(int liveSeconds) {
        if (liveSeconds < 0) {
            throw new IllegalArgumentException("liveSeconds must be non-negative, got: " + liveSeconds);
        }
        return clamp(previousVisualProportion + liveSeconds * scaleFactor);
    }

    public double remainingVisual() {
        return FULL - previousVisualProportion;
    }

    /** Starts a new window at exactly {@code fillAtPause}, rescaled over what is left of the slot. */
    public VisualFillTracker rebase(double fillAtPause, Duration remainingReal) {
        if (fillAtPause < previousVisualProportion) {
            throw new IllegalStateException(
                    "fill would drop from " + previousVisualProportion + " to " + fillAtPause + " on resume");
        }
        return begin(fillAtPause, remainingReal);
    }

    private static double clamp(double proportion) {
        return Math.max(0.0, Math.min(FULL, proportion));
    }
}
