package io.seventytwo.blocks.host;

import io.seventytwo.blocks.api.Block;
import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.api.SegmentKind;
import io.seventytwo.blocks.calendar.BlockCalendar;
import io.seventytwo.blocks.config.TimerSettings;
import io.seventytwo.blocks.continuation.AutoContinueController;
import io.seventytwo.blocks.persistence.AutoSkipProcessor;
import io.seventytwo.blocks.persistence.BlockRecorder;
import io.seventytwo.blocks.persistence.JsonBlockRepository;
import io.seventytwo.blocks.persistence.JsonSnapshotPublisher;
import io.seventytwo.blocks.persistence.NightSlotActivator;
import io.seventytwo.blocks.timer.BackgroundRecoveryCoordinator;
import io.seventytwo.blocks.timer.ExecutorTimerScheduler;
import io.seventytwo.blocks.timer.StartRequest;
import io.seventytwo.blocks.timer.TimerScheduler;
import io.seventytwo.blocks.timer.TimerScheduler.Handle;
import io.seventytwo.blocks.timer.TimerStateMachine;
import io.seventytwo.blocks.timer.WorkContext;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Composition root: builds one engine and wires the file store, recorder, snapshot mirror,
 * notifications, auto-continue and the auto-skip sweep around it. Consumers get the engine from
 * {@link #engine()}.
 */
public final class BlockTimerApp implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(BlockTimerApp.class);

    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final Clock clock;
    private final TimerScheduler scheduler;
    private final ExecutorService persistenceExecutor;
    private final JsonBlockRepository repository;
    private final JsonSnapshotPublisher snapshotPublisher;
    private final TimerStateMachine engine;
    private final BackgroundRecoveryCoordinator coordinator;
    private final AutoContinueController autoContinue;
    private final AutoSkipProcessor autoSkip;

    private @Nullable Handle sweepHandle;

    public BlockTimerApp(Path dataDir, TimerSettings settings, Clock clock) {
        this(
                dataDir,
                settings,
                clock,
                new ExecutorTimerScheduler(clock),
                Executors.newSingleThreadExecutor(r -> {
                    var t = new Thread(r, "BlockTimer-Persistence");
                    t.setDaemon(true);
                    return t;
                }));
    }

    BlockTimerApp(
            Path dataDir,
            TimerSettings settings,
            Clock clock,
            TimerScheduler scheduler,
            ExecutorService persistenceExecutor) {
        this.clock = clock;
        this.scheduler = scheduler;
        this.persistenceExecutor = persistenceExecutor;
        this.repository = new JsonBlockRepository(dataDir);
        this.snapshotPublisher = new JsonSnapshotPublisher(dataDir, persistenceExecutor);

        var calendar = new BlockCalendar(settings.zone(), settings.dayStartHour());
        this.engine = new TimerStateMachine(
                clock,
                scheduler,
                new LoggingNotificationScheduler(scheduler, calendar),
                snapshotPublisher,
                settings);
        this.coordinator = new BackgroundRecoveryCoordinator(engine);
        this.autoContinue = new AutoContinueController(
                engine,
                repository,
                scheduler,
                clock,
                settings.autoContinueDelay(),
                settings.autoContinueEnabled());
        this.autoSkip = new AutoSkipProcessor(repository, engine.calendar());

        var nightSlots = new NightSlotActivator(repository, engine.calendar());
        engine.addListener(new BlockRecorder(repository, nightSlots, persistenceExecutor, clock));
        engine.addListener(snapshotPublisher);
        engine.addListener(autoContinue);
    }

    /**
     * Recovers a run left behind by a previous process, then starts the periodic auto-skip sweep.
     *
     * @return true if a run was recovered
     */
    public boolean open() {
        boolean recovered = snapshotPublisher
                .read()
                .map(snapshot -> {
                    logger.info(
                            "Recovering run {} on slot {} of {}",
                            snapshot.runId(),
                            snapshot.blockIndex(),
                            snapshot.date());
                    return coordinator.recover(snapshot);
                })
                .orElse(false);
        sweep();
        sweepHandle = scheduler.scheduleAtFixedRate(this::sweep, SWEEP_INTERVAL);
        return recovered;
    }

    /** Starts a session on the slot containing now, on top of whatever the slot already recorded. */
    public boolean startCurrentSlot(SegmentKind mode, @Nullable String category, @Nullable String label) {
        var slot = engine.calendar().slotAt(clock.instant());
        var request = new StartRequest(
                slot.index(),
                slot.date(),
                mode,
                new WorkContext(category, label),
                existingSegments(slot.date(), slot.index()),
                null);
        return engine.start(request);
    }

    /**
     * Settles ended slots of the current logical day. Runs on the persistence executor behind any
     * pending block writes. Failures are logged; the next sweep retries.
     */
    public void sweep() {
        var now = clock.instant();
        var view = engine.view();
        try {
            persistenceExecutor.execute(() -> {
                try {
                    autoSkip.process(engine.calendar().logicalDate(now), now, view);
                } catch (IOException | RuntimeException e) {
                    logger.warn("Auto-skip sweep failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Skipping auto-skip sweep after shutdown");
        }
    }

    public TimerStateMachine engine() {
        return engine;
    }

    public BackgroundRecoveryCoordinator coordinator() {
        return coordinator;
    }

    public AutoContinueController autoContinue() {
        return autoContinue;
    }

    public JsonBlockRepository repository() {
        return repository;
    }

    /** Publishes the live run one last time and stops all background work. */
    @Override
    public void close() {
        coordinator.onSuspend();
        if (sweepHandle != null) {
            sweepHandle.cancel();
            sweepHandle = null;
        }
        scheduler.close();
        persistenceExecutor.shutdown();
        try {
            if (!persistenceExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Pending block writes did not finish in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for block writes");
        }
    }

    private List<Segment> existingSegments(LocalDate date, int index) {
        try {
            return repository.find(date, index).map(Block::segments).orElse(List.of());
        } catch (IOException e) {
            logger.warn("Could not load slot {} of {}; starting without its earlier segments", index, date, e);
            return List.of();
        }
    }
}
