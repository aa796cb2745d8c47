package io.seventytwo.blocks.segments;

import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.api.SegmentKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Ordered, append-only record of the typed segments of one live window of a session, plus the single
 * open segment that is still growing.
 *
 * <p>All positions are active seconds since the session started. The window begins at
 * {@link #windowStart()}; finalized segments tile it without gaps and the open segment runs from the
 * end of the last one to the current elapsed position. The open segment is never stored; it is
 * synthesized by {@link #liveView(int)}.
 *
 * <p>Not thread-safe; owned by the timer session.
 */
public final class SegmentLedger {
    /** Label-only edits shorter than this do not create a boundary. */
    public static final int DEFAULT_MIN_LABEL_SEGMENT_SECONDS = 10;

    private final List<Segment> segments = new ArrayList<>();
    private int windowStart;
    private int openStart;
    private SegmentKind openKind;
    private @Nullable String openCategory;
    private @Nullable String openLabel;

    public SegmentLedger(SegmentKind kind, @Nullable String category, @Nullable String label) {
        this(0, kind, category, label);
    }

    public SegmentLedger(int windowStart, SegmentKind kind, @Nullable String category, @Nullable String label) {
        if (windowStart < 0) {
            throw new IllegalArgumentException("windowStart must be non-negative, got: " + windowStart);
        }
        this.windowStart = windowStart;
        this.openStart = windowStart;
        this.openKind = Objects.requireNonNull(kind, "kind");
        this.openCategory = category;
        this.openLabel = label;
    }

    /**
     * Rebuilds a ledger from a persisted live view: segments starting before {@code currentSegmentStart}
     * are finalized, anything from there on is the open segment and is re-derived from the clock.
     */
    public static SegmentLedger restore(
            List<Segment> liveView,
            int currentSegmentStart,
            SegmentKind currentKind,
            @Nullable String category,
            @Nullable String label) {
        int start = liveView.isEmpty()
                ? currentSegmentStart
                : Math.min(liveView.get(0).startOffset(), currentSegmentStart);
        var ledger = new SegmentLedger(start, currentKind, category, label);
        for (var segment : liveView) {
            if (segment.startOffset() < currentSegmentStart) {
                ledger.append(segment);
            }
        }
        if (ledger.openStart != currentSegmentStart) {
            throw new IllegalStateException("snapshot segments end at " + ledger.openStart
                    + " but the current segment starts at " + currentSegmentStart);
        }
        return ledger;
    }

    /** Adds a finalized segment; it must begin exactly where the previous one ended. */
    public void append(Segment segment) {
        if (segment.startOffset() != openStart) {
            throw new IllegalStateException(
                    "segment at offset " + segment.startOffset() + " does not continue the ledger at " + openStart);
        }
        segments.add(segment);
        openStart = segment.endOffset();
    }

    /**
     * Finalizes the open segment if it has any duration and opens a new one of {@code newKind} at
     * {@code elapsed}.
     *
     * @return the finalized segment, empty if the open segment was zero seconds long
     */
    public Optional<Segment> splitAt(
            int elapsed, SegmentKind newKind, @Nullable String newCategory, @Nullable String newLabel) {
        var closed = closeOpen(elapsed);
        openStart = elapsed;
        openKind = newKind;
        openCategory = newCategory;
        openLabel = newLabel;
        verifyTiling(elapsed);
        return closed;
    }

    /** Closes the open segment at {@code elapsed} and keeps going with the same kind and tags. */
    public Optional<Segment> finalizeAt(int elapsed) {
        return splitAt(elapsed, openKind, openCategory, openLabel);
    }

    /**
     * Applies a category/label change to the open segment. A boundary is created only when the open
     * segment already has some duration and either the category changed or the segment has lasted at
     * least {@code minLabelSeconds}; otherwise the open segment simply takes the new tags.
     *
     * @return the finalized segment if a boundary was created
     */
    public Optional<Segment> retag(
            int elapsed, @Nullable String newCategory, @Nullable String newLabel, int minLabelSeconds) {
        boolean categoryChanged = !Objects.equals(newCategory, openCategory);
        boolean labelChanged = !Objects.equals(newLabel, openLabel);
        if (!categoryChanged && !labelChanged) {
            return Optional.empty();
        }
        int duration = openDuration(elapsed);
        boolean labelOnly = labelChanged && !categoryChanged;
        boolean boundary = duration > 0 && (!labelOnly || duration >= minLabelSeconds);
        if (boundary) {
            return splitAt(elapsed, openKind, newCategory, newLabel);
        }
        openCategory = newCategory;
        openLabel = newLabel;
        return Optional.empty();
    }

    /**
     * Finalizes at {@code elapsed}, hands over every finalized segment and starts a fresh window there.
     */
    public List<Segment> drain(int elapsed) {
        finalizeAt(elapsed);
        var drained = List.copyOf(segments);
        segments.clear();
        windowStart = elapsed;
        openStart = elapsed;
        return drained;
    }

    /** Finalized segments plus the in-progress tail, without committing a boundary. */
    public List<Segment> liveView(int elapsed) {
        int duration = openDuration(elapsed);
        if (duration == 0) {
            return List.copyOf(segments);
        }
        var view = new ArrayList<Segment>(segments.size() + 1);
        view.addAll(segments);
        view.add(new Segment(openKind, duration, openCategory, openLabel, openStart));
        return List.copyOf(view);
    }

    /** Seconds covered by the live window at {@code elapsed}, tail included. */
    public int liveSeconds(int elapsed) {
        return Segment.totalSeconds(segments) + openDuration(elapsed);
    }

    public List<Segment> segments() {
        return List.copyOf(segments);
    }

    public int windowStart() {
        return windowStart;
    }

    public int currentSegmentStart() {
        return openStart;
    }

    public SegmentKind currentKind() {
        return openKind;
    }

    public @Nullable String currentCategory() {
        return openCategory;
    }

    public @Nullable String currentLabel() {
        return openLabel;
    }

    private Optional<Segment> closeOpen(int elapsed) {
        int duration = openDuration(elapsed);
        if (duration == 0) {
            return Optional.empty();
        }
        var segment = new Segment(openKind, duration, openCategory, openLabel, openStart);
        segments.add(segment);
        return Optional.of(segment);
    }

    private int openDuration(int elapsed) {
        int duration = elapsed - openStart;
        if (duration < 0) {
            throw new IllegalStateException(
                    "elapsed " + elapsed + " is before the open segment start " + openStart);
        }
        return duration;
    }

    private void verifyTiling(int elapsed) {
        int covered = Segment.totalSeconds(segments);
        if (covered != elapsed - windowStart) {
            throw new IllegalStateException("segments cover " + covered + "s but the window spans "
                    + (elapsed - windowStart) + "s");
        }
    }
}
