package io.seventytwo.blocks.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import io.seventytwo.blocks.api.Block;
import io.seventytwo.blocks.api.BlockRepository;
import io.seventytwo.blocks.util.AtomicFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Stores blocks as one JSON array per logical day, {@code blocks-YYYY-MM-DD.json} under the data
 * directory. Writes replace the whole file atomically.
 */
public class JsonBlockRepository implements BlockRepository {
    private static final Logger logger = LogManager.getLogger(JsonBlockRepository.class);
    private static final TypeReference<List<Block>> BLOCK_LIST = new TypeReference<>() {};

    private final Path dataDir;

    public JsonBlockRepository(Path dataDir) {
        this.dataDir = dataDir;
    }

    Path fileFor(LocalDate date) {
        return dataDir.resolve("blocks-" + date + ".json");
    }

    @Override
    public synchronized List<Block> load(LocalDate date) throws IOException {
        var file = fileFor(date);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<Block> blocks = JsonMappers.mapper().readValue(file.toFile(), BLOCK_LIST);
        for (var block : blocks) {
            if (!block.date().equals(date)) {
                throw new IOException("Block " + block.blockIndex() + " in " + file + " belongs to " + block.date());
            }
        }
        return List.copyOf(blocks);
    }

    @Override
    public synchronized void save(Block block) throws IOException {
        var blocks = new ArrayList<>(load(block.date()));
        blocks.removeIf(b -> b.blockIndex() == block.blockIndex());
        blocks.add(block);
        blocks.sort(Comparator.comparingInt(Block::blockIndex));
        var file = fileFor(block.date());
        AtomicFiles.writeString(file, JsonMappers.mapper().writeValueAsString(blocks));
        logger.trace("Saved block {} of {} ({})", block.blockIndex(), block.date(), block.status());
    }
}
