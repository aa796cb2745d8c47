package io.seventytwo.blocks.continuation;

import io.seventytwo.blocks.api.Block;
import io.seventytwo.blocks.api.BlockRepository;
import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.api.SegmentKind;
import io.seventytwo.blocks.timer.CompletionEvent;
import io.seventytwo.blocks.timer.ContinuationTrigger;
import io.seventytwo.blocks.timer.TimerListener;
import io.seventytwo.blocks.timer.TimerPhase;
import io.seventytwo.blocks.timer.TimerScheduler;
import io.seventytwo.blocks.timer.TimerScheduler.Handle;
import io.seventytwo.blocks.timer.TimerStateMachine;
import io.seventytwo.blocks.timer.TimerView;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Counts down after a slot completes and continues into the next slot when nobody responded. The
 * countdown is measured from the moment the slot actually ended, so a completion noticed late (after
 * the host was suspended) continues sooner or at once.
 *
 * <p>The user's own choices go through {@link #continueNow()}, {@link #takeBreak()} and
 * {@link #dismiss()}; each cancels the countdown and counts as an explicit action.
 */
public class AutoContinueController implements TimerListener {
    private static final Logger logger = LogManager.getLogger(AutoContinueController.class);

    private final TimerStateMachine engine;
    private final BlockRepository repository;
    private final TimerScheduler scheduler;
    private final Clock clock;
    private final Duration delay;
    private final boolean enabled;

    private @Nullable Handle pending;
    private @Nullable Instant deadline;
    private long sequence;

    public AutoContinueController(
            TimerStateMachine engine,
            BlockRepository repository,
            TimerScheduler scheduler,
            Clock clock,
            Duration delay,
            boolean enabled) {
        this.engine = engine;
        this.repository = repository;
        this.scheduler = scheduler;
        this.clock = clock;
        this.delay = delay;
        this.enabled = enabled;
    }

    @Override
    public void onComplete(CompletionEvent event) {
        if (!event.natural() || !enabled) {
            return;
        }
        var at = event.completedAt().plus(delay);
        synchronized (this) {
            cancelPending();
            long token = ++sequence;
            deadline = at;
            pending = scheduler.scheduleAt(() -> fire(token), at);
        }
        logger.info("Slot {} completed; continuing automatically at {}", event.blockIndex(), at);
    }

    @Override
    public void onStateChanged(TimerView view) {
        if (view.phase() != TimerPhase.COMPLETED) {
            synchronized (this) {
                cancelPending();
            }
        }
    }

    @Override
    public void onCheckInRequired() {
        logger.info("Automatic continuation paused until the user checks in");
    }

    /** When the countdown runs out, if one is pending. */
    public synchronized Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Whole seconds left on the countdown; empty when none is pending. */
    public Optional<Long> secondsRemaining() {
        return deadline().map(at -> Math.max(0, Duration.between(clock.instant(), at).toSeconds()));
    }

    public boolean continueNow() {
        synchronized (this) {
            cancelPending();
        }
        return engine.continueToCurrentSlot(ContinuationTrigger.EXPLICIT, null, existingSegmentsOfCurrentSlot());
    }

    public boolean takeBreak() {
        synchronized (this) {
            cancelPending();
        }
        return engine.continueToCurrentSlot(
                ContinuationTrigger.EXPLICIT, SegmentKind.BREAK, existingSegmentsOfCurrentSlot());
    }

    public boolean dismiss() {
        synchronized (this) {
            cancelPending();
        }
        return engine.dismiss();
    }

    // the engine is called without holding this monitor; it calls back into onStateChanged
    private void fire(long token) {
        synchronized (this) {
            if (pending == null || token != sequence) {
                return;
            }
            pending = null;
            deadline = null;
        }
        boolean continued =
                engine.continueToCurrentSlot(ContinuationTrigger.AUTOMATIC, null, existingSegmentsOfCurrentSlot());
        logger.debug("Automatic continuation {}", continued ? "started" : "did not start");
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel();
            pending = null;
            logger.debug("Auto-continue countdown cancelled");
        }
        deadline = null;
    }

    private List<Segment> existingSegmentsOfCurrentSlot() {
        var slot = engine.calendar().slotAt(clock.instant());
        try {
            return repository.find(slot.date(), slot.index()).map(Block::segments).orElse(List.of());
        } catch (IOException e) {
            logger.warn("Could not load slot {} of {}; continuing without its earlier segments",
                    slot.index(), slot.date(), e);
            return List.of();
        }
    }
}
