package io.seventytwo.blocks.api;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Storage for blocks, keyed by logical day and slot index. The engine treats every failure here as
 * non-fatal; callers may retry a save independently.
 */
public interface BlockRepository {

    /** All stored blocks of the given logical day, in no particular order. */
    List<Block> load(LocalDate date) throws IOException;

    /** Inserts or replaces the block with the same date and index. */
    void save(Block block) throws IOException;

    default Optional<Block> find(LocalDate date, int blockIndex) throws IOException {
        return load(date).stream().filter(b -> b.blockIndex() == blockIndex).findFirst();
    }
}
