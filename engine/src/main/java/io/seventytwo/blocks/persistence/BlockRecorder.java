package io.seventytwo.blocks.persistence;

import io.seventytwo.blocks.api.Block;
import io.seventytwo.blocks.api.BlockRepository;
import io.seventytwo.blocks.api.BlockStatus;
import io.seventytwo.blocks.api.RunSnapshot;
import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.api.SegmentKind;
import io.seventytwo.blocks.calendar.BlockCalendar;
import io.seventytwo.blocks.timer.CompletionEvent;
import io.seventytwo.blocks.timer.TimerListener;
import io.seventytwo.blocks.timer.TimerPhase;
import io.seventytwo.blocks.timer.TimerView;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.Executor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Writes engine events into the block store: running totals on every snapshot, final totals and
 * status on completion. Work is handed to {@code executor} so the engine never waits on storage;
 * failures are logged and the next event writes again.
 *
 * <p>The first write of a run to a slot also activates the surrounding night through the
 * {@link NightSlotActivator}.
 */
public class BlockRecorder implements TimerListener {
    private static final Logger logger = LogManager.getLogger(BlockRecorder.class);

    /** A completion this close to the initial duration counts as reaching the boundary. */
    static final int NATURAL_COMPLETION_TOLERANCE_SECONDS = 5;
    /** Share of a full slot after which a stopped session still marks the block done. */
    static final double DONE_PROGRESS_PERCENT = 95.0;

    private final BlockRepository repository;
    private final NightSlotActivator nightSlots;
    private final Executor executor;
    private final Clock clock;

    private @Nullable RunSnapshot activeRun;

    public BlockRecorder(BlockRepository repository, NightSlotActivator nightSlots, Executor executor, Clock clock) {
        this.repository = repository;
        this.nightSlots = nightSlots;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public void onSnapshot(RunSnapshot snapshot) {
        boolean firstWrite;
        synchronized (this) {
            firstWrite = activeRun == null
                    || activeRun.blockIndex() != snapshot.blockIndex()
                    || !activeRun.date().equals(snapshot.date());
            activeRun = snapshot;
        }
        executor.execute(() -> {
            if (firstWrite) {
                activateNight(snapshot.date(), snapshot.blockIndex());
            }
            recordSnapshot(snapshot);
        });
    }

    @Override
    public void onComplete(CompletionEvent event) {
        synchronized (this) {
            activeRun = null;
        }
        executor.execute(() -> recordCompletion(event));
    }

    /** A session dropped without being recorded leaves its totals but no longer claims the block. */
    @Override
    public void onStateChanged(TimerView view) {
        if (view.phase() != TimerPhase.IDLE) {
            return;
        }
        RunSnapshot dropped;
        synchronized (this) {
            dropped = activeRun;
            activeRun = null;
        }
        if (dropped != null) {
            executor.execute(() -> releaseBlock(dropped.date(), dropped.blockIndex()));
        }
    }

    void recordSnapshot(RunSnapshot snapshot) {
        try {
            var block = loadOrEmpty(snapshot.date(), snapshot.blockIndex());
            var segments = snapshot.allSegments();
            int workSeconds = Segment.totalSeconds(segments, SegmentKind.WORK);
            int breakSeconds = Segment.totalSeconds(segments, SegmentKind.BREAK);
            var updated = block.withUsage(
                            segments,
                            Segment.totalSeconds(segments),
                            percentOfSlot(workSeconds),
                            percentOfSlot(breakSeconds))
                    .withStatus(activated(block.status()))
                    .withMuted(false)
                    .withTags(
                            orElse(snapshot.lastWorkCategory(), block.category()),
                            orElse(snapshot.lastWorkLabel(), block.label()))
                    .withActiveRunSnapshot(snapshot)
                    .withUpdatedAt(clock.instant());
            repository.save(updated);
            logger.debug(
                    "Recorded snapshot of slot {}: {}s work, {}s break",
                    snapshot.blockIndex(),
                    workSeconds,
                    breakSeconds);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to record snapshot of slot {} on {}", snapshot.blockIndex(), snapshot.date(), e);
        }
    }

    void recordCompletion(CompletionEvent event) {
        try {
            var block = loadOrEmpty(event.date(), event.blockIndex());
            int usedSeconds = Math.max(event.secondsUsed(), Segment.totalSeconds(event.segments()));
            double progress = percentOfSlot(usedSeconds);
            boolean reachedBoundary = event.natural()
                    || event.secondsUsed() >= event.initialDurationSeconds() - NATURAL_COMPLETION_TOLERANCE_SECONDS;
            var status = reachedBoundary || progress >= DONE_PROGRESS_PERCENT
                    ? BlockStatus.DONE
                    : activated(block.status());
            var updated = block.withUsage(
                            event.segments(),
                            usedSeconds,
                            progress,
                            percentOfSlot(Segment.totalSeconds(event.segments(), SegmentKind.BREAK)))
                    .withStatus(status)
                    .withTags(orElse(event.category(), block.category()), orElse(event.label(), block.label()))
                    .withActiveRunSnapshot(null)
                    .withUpdatedAt(event.completedAt());
            repository.save(updated);
            logger.info(
                    "Recorded slot {} of {}: {}s used, {}% ({})",
                    event.blockIndex(),
                    event.date(),
                    usedSeconds,
                    Math.round(progress),
                    status.wireName());
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to record completion of slot {} on {}", event.blockIndex(), event.date(), e);
        }
    }

    private void releaseBlock(LocalDate date, int blockIndex) {
        try {
            var block = loadOrEmpty(date, blockIndex);
            if (block.activeRunSnapshot() == null) {
                return;
            }
            repository.save(block.withActiveRunSnapshot(null).withUpdatedAt(clock.instant()));
            logger.debug("Released slot {} of {} after its session was discarded", blockIndex, date);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to release slot {} on {}", blockIndex, date, e);
        }
    }

    void activateNight(LocalDate date, int blockIndex) {
        try {
            nightSlots.activate(date, blockIndex, clock.instant());
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to activate the night around slot {} on {}", blockIndex, date, e);
        }
    }

    private Block loadOrEmpty(LocalDate date, int blockIndex) throws IOException {
        return repository.find(date, blockIndex).orElseGet(() -> Block.empty(date, blockIndex));
    }

    private static BlockStatus activated(BlockStatus status) {
        return status == BlockStatus.IDLE ? BlockStatus.PLANNED : status;
    }

    static double percentOfSlot(int seconds) {
        return Math.min(100.0, seconds * 100.0 / BlockCalendar.SLOT_SECONDS);
    }

    private static @Nullable String orElse(@Nullable String preferred, @Nullable String fallback) {
        return preferred != null ? preferred : fallback;
    }
}
