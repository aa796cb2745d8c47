package io.seventytwo.blocks.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Periodic projection of the active timer session, detailed enough to rebuild the session after the
 * host process was lost.
 *
 * @param runId identifies the session across snapshots
 * @param blockIndex slot index, 0..71
 * @param date logical day the slot belongs to
 * @param startedAt when the session started
 * @param endAt slot boundary; the session completes here
 * @param initialDurationSeconds whole seconds between {@code startedAt} and {@code endAt}, rounded up
 * @param pausedSeconds wall-clock seconds spent paused, never credited as work
 * @param pausedSecondsUsed active seconds frozen at the last pause; null while running
 * @param previousSegments segments recorded before the live window (earlier sessions and pre-pause runs)
 * @param segments live segments including the in-progress tail
 * @param currentSegmentStart active-seconds offset at which the in-progress segment began
 * @param currentMode kind of the in-progress segment
 * @param currentCategory category shown for the session
 * @param currentLabel label shown for the session
 * @param lastWorkCategory work category restored when a break ends
 * @param lastWorkLabel work label restored when a break ends
 * @param previousVisualProportion visual fill already taken before the live window
 * @param scaleFactor visual fill per live second
 * @param breakNotifyAt pending mid-slot break reminder, if any
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunSnapshot(
        String runId,
        int blockIndex,
        LocalDate date,
        Instant startedAt,
        Instant endAt,
        int initialDurationSeconds,
        int pausedSeconds,
        @Nullable Integer pausedSecondsUsed,
        List<Segment> previousSegments,
        List<Segment> segments,
        int currentSegmentStart,
        SegmentKind currentMode,
        @Nullable String currentCategory,
        @Nullable String currentLabel,
        @Nullable String lastWorkCategory,
        @Nullable String lastWorkLabel,
        double previousVisualProportion,
        double scaleFactor,
        @Nullable Instant breakNotifyAt) {

    public RunSnapshot {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(endAt, "endAt");
        if (blockIndex < 0 || blockIndex > 71) {
            throw new IllegalArgumentException("blockIndex must be within 0..71, got: " + blockIndex);
        }
        if (initialDurationSeconds < 0) {
            throw new IllegalArgumentException(
                    "initialDurationSeconds must be non-negative, got: " + initialDurationSeconds);
        }
        if (pausedSeconds < 0) {
            throw new IllegalArgumentException("pausedSeconds must be non-negative, got: " + pausedSeconds);
        }
        if (currentSegmentStart < 0) {
            throw new IllegalArgumentException(
                    "currentSegmentStart must be non-negative, got: " + currentSegmentStart);
        }
        // older records may omit these
        previousSegments = previousSegments == null ? List.of() : List.copyOf(previousSegments);
        segments = segments == null ? List.of() : List.copyOf(segments);
        currentMode = currentMode == null ? SegmentKind.WORK : currentMode;
    }

    @JsonIgnore
    public boolean isPaused() {
        return pausedSecondsUsed != null;
    }

    /** Previous segments followed by the live ones, in timeline order. */
    public List<Segment> allSegments() {
        var all = new ArrayList<Segment>(previousSegments.size() + segments.size());
        all.addAll(previousSegments);
        all.addAll(segments);
        return List.copyOf(all);
    }
}
