package io.seventytwo.blocks.persistence;

import io.seventytwo.blocks.api.Block;
import io.seventytwo.blocks.api.BlockRepository;
import io.seventytwo.blocks.api.BlockStatus;
import io.seventytwo.blocks.calendar.BlockCalendar;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Opens up the night once a session runs in it. Starting in a slot before the day-start hour settles
 * the earlier muted night slots of the same logical day and un-mutes the later ones, so the rest of
 * the night can be used without activating each slot by hand.
 *
 * <p>Slots that are already settled, not muted, or outside the night are left alone. The session's
 * own slot is the recorder's business.
 */
public class NightSlotActivator {
    private static final Logger logger = LogManager.getLogger(NightSlotActivator.class);

    private final BlockRepository repository;
    private final BlockCalendar calendar;

    public NightSlotActivator(BlockRepository repository, BlockCalendar calendar) {
        this.repository = repository;
        this.calendar = calendar;
    }

    public boolean isNightSlot(int blockIndex) {
        return blockIndex < calendar.dayStartHour() * BlockCalendar.SLOTS_PER_HOUR;
    }

    /**
     * Activates the night around {@code blockIndex}; a no-op for day slots.
     *
     * @return the blocks that were changed
     */
    public List<Block> activate(LocalDate logicalDate, int blockIndex, Instant now) throws IOException {
        if (!isNightSlot(blockIndex)) {
            return List.of();
        }
        var changed = new ArrayList<Block>();
        for (var block : repository.load(logicalDate)) {
            int index = block.blockIndex();
            if (index == blockIndex || !isNightSlot(index) || !block.muted() || block.status().isSettled()) {
                continue;
            }
            Block updated;
            if (index > blockIndex) {
                updated = block.withMuted(false);
            } else if (block.hasRealUsage()) {
                updated = block.withStatus(BlockStatus.DONE).withMuted(false);
            } else {
                updated = block.withStatus(BlockStatus.SKIPPED);
            }
            updated = updated.withUpdatedAt(now);
            repository.save(updated);
            changed.add(updated);
        }
        if (!changed.isEmpty()) {
            logger.info(
                    "Session on night slot {} of {} activated {} other night slots",
                    blockIndex,
                    logicalDate,
                    changed.size());
        }
        return changed;
    }
}
