package io.seventytwo.blocks.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A contiguous, typed stretch of a block session.
 *
 * @param kind work or break
 * @param seconds duration in whole seconds
 * @param category category id; always null for break segments
 * @param label free-form label; always null for break segments
 * @param startOffset active seconds since the session started at which this segment began
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Segment(
        SegmentKind kind, int seconds, @Nullable String category, @Nullable String label, int startOffset) {

    public Segment {
        Objects.requireNonNull(kind, "kind");
        if (seconds < 0) {
            throw new IllegalArgumentException("seconds must be non-negative, got: " + seconds);
        }
        if (startOffset < 0) {
            throw new IllegalArgumentException("startOffset must be non-negative, got: " + startOffset);
        }
        if (kind == SegmentKind.BREAK) {
            category = null;
            label = null;
        }
    }

    public static Segment work(int seconds, @Nullable String category, @Nullable String label, int startOffset) {
        return new Segment(SegmentKind.WORK, seconds, category, label, startOffset);
    }

    public static Segment breakTime(int seconds, int startOffset) {
        return new Segment(SegmentKind.BREAK, seconds, null, null, startOffset);
    }

    public int endOffset() {
        return startOffset + seconds;
    }

    @JsonIgnore
    public boolean isWork() {
        return kind == SegmentKind.WORK;
    }

    public static int totalSeconds(List<Segment> segments) {
        int total = 0;
        for (var segment : segments) {
            total += segment.seconds();
        }
        return total;
    }

    public static int totalSeconds(List<Segment> segments, SegmentKind kind) {
        int total = 0;
        for (var segment : segments) {
            if (segment.kind() == kind) {
                total += segment.seconds();
            }
        }
        return total;
    }
}
