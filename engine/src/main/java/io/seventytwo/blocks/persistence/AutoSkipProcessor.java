package io.seventytwo.blocks.persistence;

import io.seventytwo.blocks.api.Block;
import io.seventytwo.blocks.api.BlockRepository;
import io.seventytwo.blocks.api.BlockStatus;
import io.seventytwo.blocks.calendar.BlockCalendar;
import io.seventytwo.blocks.timer.TimerView;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Settles slots of a logical day that have already ended: those with recorded usage become
 * {@link BlockStatus#DONE}, the rest {@link BlockStatus#SKIPPED}.
 *
 * <p>Muted slots, slots before the day-start hour, and the slot a session is still writing to are
 * never touched.
 */
public class AutoSkipProcessor {
    private static final Logger logger = LogManager.getLogger(AutoSkipProcessor.class);

    private final BlockRepository repository;
    private final BlockCalendar calendar;

    public AutoSkipProcessor(BlockRepository repository, BlockCalendar calendar) {
        this.repository = repository;
        this.calendar = calendar;
    }

    /**
     * Settles the ended slots of {@code logicalDate}.
     *
     * @param active the engine's current view; its slot is left alone while a session exists
     * @return the blocks that were changed
     */
    public List<Block> process(LocalDate logicalDate, Instant now, @Nullable TimerView active) throws IOException {
        var stored = new HashMap<Integer, Block>();
        for (var block : repository.load(logicalDate)) {
            stored.put(block.blockIndex(), block);
        }
        int firstDaySlot = calendar.dayStartHour() * BlockCalendar.SLOTS_PER_HOUR;
        var changed = new ArrayList<Block>();
        for (int index = firstDaySlot; index < BlockCalendar.SLOTS_PER_DAY; index++) {
            if (isActive(active, logicalDate, index)) {
                continue;
            }
            if (!calendar.slot(logicalDate, index).hasEnded(now)) {
                continue;
            }
            var block = stored.getOrDefault(index, Block.empty(logicalDate, index));
            if (block.muted() || block.status().isSettled()) {
                continue;
            }
            var status = block.hasRealUsage() ? BlockStatus.DONE : BlockStatus.SKIPPED;
            var updated = block.withStatus(status).withUpdatedAt(now);
            repository.save(updated);
            changed.add(updated);
        }
        if (!changed.isEmpty()) {
            logger.info("Settled {} ended slots of {}", changed.size(), logicalDate);
        }
        return changed;
    }

    private static boolean isActive(@Nullable TimerView active, LocalDate date, int index) {
        return active != null
                && active.phase().hasSession()
                && active.blockIndex() == index
                && Objects.equals(active.date(), date);
    }
}
