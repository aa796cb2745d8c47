package io.seventytwo.blocks.persistence;

import io.seventytwo.blocks.api.RunSnapshot;
import io.seventytwo.blocks.api.SnapshotPublisher;
import io.seventytwo.blocks.timer.TimerListener;
import io.seventytwo.blocks.timer.TimerPhase;
import io.seventytwo.blocks.timer.TimerView;
import io.seventytwo.blocks.util.AtomicFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Mirrors the live run into {@code current-run.json} for widgets and for recovery after the process
 * was lost. The file is removed once no session is running or paused.
 */
public class JsonSnapshotPublisher implements SnapshotPublisher, TimerListener {
    private static final Logger logger = LogManager.getLogger(JsonSnapshotPublisher.class);

    public static final String FILE_NAME = "current-run.json";

    private final Path file;
    private final Executor executor;

    public JsonSnapshotPublisher(Path dataDir, Executor executor) {
        this.file = dataDir.resolve(FILE_NAME);
        this.executor = executor;
    }

    public Path file() {
        return file;
    }

    @Override
    public void publish(RunSnapshot snapshot) {
        executor.execute(() -> write(snapshot));
    }

    @Override
    public void onStateChanged(TimerView view) {
        if (view.phase() == TimerPhase.IDLE || view.phase() == TimerPhase.COMPLETED) {
            executor.execute(this::clear);
        }
    }

    /** The last published run, if any. An unreadable file is logged and treated as absent. */
    public Optional<RunSnapshot> read() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonMappers.mapper().readValue(file.toFile(), RunSnapshot.class));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Ignoring unreadable run snapshot {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private synchronized void write(RunSnapshot snapshot) {
        try {
            AtomicFiles.writeString(file, JsonMappers.mapper().writeValueAsString(snapshot));
        } catch (IOException e) {
            logger.warn("Failed to write run snapshot {}", file, e);
        }
    }

    private synchronized void clear() {
        try {
            if (Files.deleteIfExists(file)) {
                logger.debug("Removed run snapshot {}", file);
            }
        } catch (IOException e) {
            logger.warn("Failed to remove run snapshot {}", file, e);
        }
    }
}
