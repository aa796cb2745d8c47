package io.seventytwo.blocks.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Persisted state of one slot on one logical day, as stored by a {@link BlockRepository}.
 *
 * @param progress work seconds as a percentage of a full 1200-second slot, capped at 100
 * @param breakProgress break seconds as a percentage of a full slot, capped at 100
 * @param activeRunSnapshot latest snapshot of a session still writing to this block
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Block(
        LocalDate date,
        int blockIndex,
        boolean muted,
        @Nullable String category,
        @Nullable String label,
        @Nullable String note,
        BlockStatus status,
        double progress,
        double breakProgress,
        List<Segment> segments,
        int usedSeconds,
        @Nullable RunSnapshot activeRunSnapshot,
        @Nullable Instant updatedAt) {

    public Block {
        Objects.requireNonNull(date, "date");
        if (blockIndex < 0 || blockIndex > 71) {
            throw new IllegalArgumentException("blockIndex must be within 0..71, got: " + blockIndex);
        }
        if (usedSeconds < 0) {
            throw new IllegalArgumentException("usedSeconds must be non-negative, got: " + usedSeconds);
        }
        status = status == null ? BlockStatus.IDLE : status;
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public static Block empty(LocalDate date, int blockIndex) {
        return new Block(date, blockIndex, false, null, null, null, BlockStatus.IDLE, 0, 0, List.of(), 0, null, null);
    }

    public Block withStatus(BlockStatus newStatus) {
        return new Block(
                date,
                blockIndex,
                muted,
                category,
                label,
                note,
                newStatus,
                progress,
                breakProgress,
                segments,
                usedSeconds,
                activeRunSnapshot,
                updatedAt);
    }

    public Block withMuted(boolean newMuted) {
        return new Block(
                date,
                blockIndex,
                newMuted,
                category,
                label,
                note,
                status,
                progress,
                breakProgress,
                segments,
                usedSeconds,
                activeRunSnapshot,
                updatedAt);
    }

    public Block withTags(@Nullable String newCategory, @Nullable String newLabel) {
        return new Block(
                date,
                blockIndex,
                muted,
                newCategory,
                newLabel,
                note,
                status,
                progress,
                breakProgress,
                segments,
                usedSeconds,
                activeRunSnapshot,
                updatedAt);
    }

    public Block withUsage(List<Segment> newSegments, int newUsedSeconds, double newProgress, double newBreakProgress) {
        return new Block(
                date,
                blockIndex,
                muted,
                category,
                label,
                note,
                status,
                newProgress,
                newBreakProgress,
                newSegments,
                newUsedSeconds,
                activeRunSnapshot,
                updatedAt);
    }

    public Block withActiveRunSnapshot(@Nullable RunSnapshot snapshot) {
        return new Block(
                date,
                blockIndex,
                muted,
                category,
                label,
                note,
                status,
                progress,
                breakProgress,
                segments,
                usedSeconds,
                snapshot,
                updatedAt);
    }

    public Block withUpdatedAt(Instant when) {
        return new Block(
                date,
                blockIndex,
                muted,
                category,
                label,
                note,
                status,
                progress,
                breakProgress,
                segments,
                usedSeconds,
                activeRunSnapshot,
                when);
    }

    /**
     * True when real work data was recorded. Progress alone does not count since it can be stale.
     */
    @JsonIgnore
    public boolean hasRealUsage() {
        return !segments.isEmpty() || usedSeconds > 0 || activeRunSnapshot != null;
    }
}
