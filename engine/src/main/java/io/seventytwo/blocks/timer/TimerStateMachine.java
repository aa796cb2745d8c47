package io.seventytwo.blocks.timer;

import io.seventytwo.blocks.api.NotificationScheduler;
import io.seventytwo.blocks.api.RunSnapshot;
import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.api.SegmentKind;
import io.seventytwo.blocks.api.SnapshotPublisher;
import io.seventytwo.blocks.calendar.BlockCalendar;
import io.seventytwo.blocks.checkin.CheckInCounter;
import io.seventytwo.blocks.config.TimerSettings;
import io.seventytwo.blocks.fill.VisualFillTracker;
import io.seventytwo.blocks.timer.TimerScheduler.Handle;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns the single timing session of a slot: counts down to the slot boundary, splits active time into
 * typed segments, tracks the visual fill, and handles pausing, completion and continuation into the
 * next slot.
 *
 * <p>All public methods are {@code synchronized}; periodic callbacks from the {@link TimerScheduler}
 * re-enter through the same lock and carry the generation of the session that scheduled them, so a
 * callback that outlives its session is ignored. Illegal calls are logged and answered with
 * {@code false} rather than thrown. Listener and collaborator failures are logged and never roll back
 * engine state.
 */
public class TimerStateMachine {
    private static final Logger logger = LogManager.getLogger(TimerStateMachine.class);

    private final Clock clock;
    private final BlockCalendar calendar;
    private final TimerScheduler scheduler;
    private final NotificationScheduler notifications;
    private final SnapshotPublisher snapshotPublisher;
    private final TimerSettings settings;
    private final CheckInCounter checkIn;
    private final List<TimerListener> listeners = new CopyOnWriteArrayList<>();

    private @Nullable TimerSession session;
    private long generation;
    private @Nullable Handle tickHandle;
    private @Nullable Handle snapshotHandle;
    private @Nullable Handle expiryHandle;

    public TimerStateMachine(
            Clock clock,
            TimerScheduler scheduler,
            NotificationScheduler notifications,
            SnapshotPublisher snapshotPublisher,
            TimerSettings settings) {
        this.clock = clock;
        this.calendar = new BlockCalendar(settings.zone(), settings.dayStartHour());
        this.scheduler = scheduler;
        this.notifications = notifications;
        this.snapshotPublisher = snapshotPublisher;
        this.settings = settings;
        this.checkIn = new CheckInCounter(settings.checkInThreshold());
    }

    public BlockCalendar calendar() {
        return calendar;
    }

    public TimerSettings settings() {
        return settings;
    }

    public void addListener(TimerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TimerListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts a session on the slot containing now.
     *
     * @return false if a session is still active, the slot is not the current one, or a work session
     *     has no visual room left on the slot
     */
    public synchronized boolean start(StartRequest request) {
        var current = session;
        if (current != null && current.phase != TimerPhase.COMPLETED) {
            logger.warn("Ignoring start of slot {}: a session on slot {} is {}",
                    request.blockIndex(), current.blockIndex, current.phase);
            return false;
        }
        var now = clock.instant();
        var rejection = rejectionReason(request, now);
        if (rejection != null) {
            logger.warn("Ignoring start of slot {} on {}: {}", request.blockIndex(), request.date(), rejection);
            return false;
        }
        if (current != null) {
            teardown(current);
        }
        checkIn.recordExplicitAction();
        begin(request, now);
        return true;
    }

    /** Brings the session up to date with the clock. Completes it once the slot boundary is reached. */
    public synchronized void tick() {
        var s = session;
        if (s == null || s.phase != TimerPhase.RUNNING) {
            return;
        }
        var now = clock.instant();
        s.refreshTimeLeft(now);
        fire("onTick", l -> l.onTick(s.timeLeft, s.progressPercent()));
        if (s.timeLeft == 0) {
            completeNaturally(s);
            return;
        }
        var notifyAt = s.breakNotifyAt;
        if (notifyAt != null && !now.isBefore(notifyAt)) {
            s.breakNotifyAt = null;
            logger.info("Break on slot {} reached its reminder", s.blockIndex);
            fire("onBreakNotify", TimerListener::onBreakNotify);
        }
    }

    /**
     * Switches between work and break. The work context is carried across so switching back to work
     * restores the previous category and label.
     */
    public synchronized boolean switchMode(SegmentKind kind) {
        var s = requirePhase("switch mode", TimerPhase.RUNNING);
        if (s == null) {
            return false;
        }
        if (s.mode.kind() == kind) {
            logger.debug("Session on slot {} is already in {} mode", s.blockIndex, kind);
            return false;
        }
        var now = clock.instant();
        if (completeIfBoundaryPassed(s, now)) {
            return false;
        }
        int used = s.secondsUsed();
        var newMode = SessionMode.of(kind, s.mode.workContext());
        var closed = s.ledger.splitAt(
                used, kind, TimerSession.ledgerCategory(newMode), TimerSession.ledgerLabel(newMode));
        s.mode = newMode;
        s.breakNotifyAt = newMode.isBreak() ? breakReminderAt(s, now) : null;
        checkIn.recordExplicitAction();
        logger.info("Slot {} switched to {} at {}s", s.blockIndex, kind.wireName(), used);
        emitBoundary(closed);
        scheduleNotifications(s);
        publishSnapshot(s);
        emitStateChanged();
        return true;
    }

    /**
     * Changes the category and label work time is attributed to. During a break only the work context
     * restored afterwards changes.
     */
    public synchronized boolean updateCategory(@Nullable String category, @Nullable String label) {
        var s = requirePhase("update category", TimerPhase.RUNNING, TimerPhase.PAUSED);
        if (s == null) {
            return false;
        }
        var context = new WorkContext(category, label);
        if (context.equals(s.mode.workContext())) {
            return false;
        }
        if (s.mode.isBreak()) {
            s.mode = s.mode.withWorkContext(context);
            emitStateChanged();
            return true;
        }
        var now = clock.instant();
        if (s.phase == TimerPhase.RUNNING && completeIfBoundaryPassed(s, now)) {
            return false;
        }
        var closed = s.ledger.retag(s.secondsUsed(), category, label, settings.minLabelSegmentSeconds());
        s.mode = s.mode.withWorkContext(context);
        logger.debug("Slot {} now attributed to category={} label={}", s.blockIndex, category, label);
        emitBoundary(closed);
        publishSnapshot(s);
        emitStateChanged();
        return true;
    }

    /** Freezes active time. The slot boundary keeps approaching; reaching it leads to paused expiry. */
    public synchronized boolean pause() {
        var s = requirePhase("pause", TimerPhase.RUNNING);
        if (s == null) {
            return false;
        }
        var now = clock.instant();
        if (completeIfBoundaryPassed(s, now)) {
            return false;
        }
        int used = s.secondsUsed();
        var closed = s.ledger.finalizeAt(used);
        s.pausedSecondsUsed = used;
        s.phase = TimerPhase.PAUSED;
        cancelCadence();
        cancelNotifications(s);
        scheduleExpiry(s);
        logger.info("Paused slot {} at {}s with {}s left", s.blockIndex, used, s.timeLeft);
        emitBoundary(closed);
        publishSnapshot(s);
        emitStateChanged();
        return true;
    }

    /**
     * Resumes a paused session. The fill continues from exactly where it stood at the pause and is
     * rescaled to reach 1.0 at the boundary.
     *
     * @return false if not paused, or if the boundary passed meanwhile (the session then enters
     *     {@link TimerPhase#PAUSED_EXPIRY})
     */
    public synchronized boolean resume() {
        var s = requirePhase("resume", TimerPhase.PAUSED);
        if (s == null) {
            return false;
        }
        var now = clock.instant();
        cancelExpiry();
        if (s.boundaryPassed(now)) {
            enterPausedExpiry(s, now);
            return false;
        }
        double fillAtPause = s.currentFill();
        int pausedUsed = s.secondsUsed();
        s.refreshTimeLeft(now);
        int pausedSeconds = s.initialDurationSeconds - s.timeLeft - pausedUsed;
        if (pausedSeconds < s.pausedSeconds) {
            throw new IllegalStateException("paused time of run " + s.runId + " would shrink from "
                    + s.pausedSeconds + "s to " + pausedSeconds + "s");
        }
        s.pausedSeconds = pausedSeconds;
        s.previousSegments.addAll(s.ledger.drain(pausedUsed));
        s.pausedSecondsUsed = null;
        s.fill = s.fill.rebase(fillAtPause, s.remainingReal(now));
        s.phase = TimerPhase.RUNNING;
        startCadence(s);
        scheduleNotifications(s);
        logger.info("Resumed slot {} after {}s paused in total, {}s left", s.blockIndex, s.pausedSeconds, s.timeLeft);
        publishSnapshot(s);
        emitStateChanged();
        return true;
    }

    /**
     * Ends the session early with its actual partial values.
     *
     * @param markComplete whether to emit {@link TimerListener#onComplete} so the time gets recorded
     */
    public synchronized boolean stop(boolean markComplete) {
        var s = requirePhase("stop", TimerPhase.RUNNING, TimerPhase.PAUSED, TimerPhase.PAUSED_EXPIRY);
        if (s == null) {
            return false;
        }
        var now = clock.instant();
        Optional<Segment> closed = Optional.empty();
        if (s.phase == TimerPhase.RUNNING) {
            s.refreshTimeLeft(now);
            closed = s.ledger.finalizeAt(s.secondsUsed());
        }
        var event = partialCompletion(s, now);
        teardown(s);
        checkIn.recordExplicitAction();
        logger.info("Stopped slot {} after {}s (recorded: {})", s.blockIndex, event.secondsUsed(), markComplete);
        emitBoundary(closed);
        if (markComplete) {
            fire("onComplete", l -> l.onComplete(event));
        }
        emitStateChanged();
        return true;
    }

    /**
     * Clears a completed or expired session. An expired paused session is recorded with its partial
     * values first.
     */
    public synchronized boolean dismiss() {
        var s = requirePhase("dismiss", TimerPhase.COMPLETED, TimerPhase.PAUSED_EXPIRY);
        if (s == null) {
            return false;
        }
        var now = clock.instant();
        @Nullable CompletionEvent expired = s.phase == TimerPhase.PAUSED_EXPIRY ? partialCompletion(s, now) : null;
        teardown(s);
        checkIn.recordExplicitAction();
        logger.debug("Dismissed session on slot {}", s.blockIndex);
        if (expired != null) {
            fire("onComplete", l -> l.onComplete(expired));
        }
        emitStateChanged();
        return true;
    }

    /** Moves the pending break reminder to {@code delay} from now. */
    public synchronized boolean snoozeBreakReminder(Duration delay) {
        var s = requirePhase("snooze the break reminder", TimerPhase.RUNNING);
        if (s == null) {
            return false;
        }
        if (!s.mode.isBreak()) {
            logger.warn("Ignoring break reminder snooze on slot {}: not on a break", s.blockIndex);
            return false;
        }
        var at = clock.instant().plus(delay);
        if (!at.isBefore(s.endAt)) {
            logger.debug("Break reminder for slot {} would land after the slot ends; dropping it", s.blockIndex);
            s.breakNotifyAt = null;
            publishSnapshot(s);
            return false;
        }
        s.breakNotifyAt = at;
        scheduleNotifications(s);
        publishSnapshot(s);
        return true;
    }

    /** Continues into the slot containing now with the previous session's mode. */
    public boolean continueToCurrentSlot(ContinuationTrigger trigger, List<Segment> existingSegments) {
        return continueToCurrentSlot(trigger, null, existingSegments);
    }

    /**
     * Starts a session on the slot containing now after the previous one completed or expired while
     * paused. An expired paused session is recorded with its partial values first.
     *
     * @param kind mode of the new session; null keeps the previous session's mode
     * @param existingSegments segments already recorded on the target slot
     * @return false if nothing can be continued, the target slot is full, or an automatic continuation
     *     was refused because a check-in is required
     */
    public synchronized boolean continueToCurrentSlot(
            ContinuationTrigger trigger, @Nullable SegmentKind kind, List<Segment> existingSegments) {
        var s = requirePhase("continue", TimerPhase.COMPLETED, TimerPhase.PAUSED_EXPIRY);
        if (s == null) {
            return false;
        }
        var now = clock.instant();
        var slot = calendar.slotAt(now);
        var request = new StartRequest(
                slot.index(),
                slot.date(),
                kind != null ? kind : s.mode.kind(),
                s.mode.workContext(),
                existingSegments,
                null);
        var rejection = rejectionReason(request, now);
        if (rejection != null) {
            logger.warn("Cannot continue into slot {}: {}", slot.index(), rejection);
            return false;
        }
        if (trigger == ContinuationTrigger.AUTOMATIC) {
            if (!checkIn.tryAutoContinue()) {
                fire("onCheckInRequired", TimerListener::onCheckInRequired);
                emitStateChanged();
                return false;
            }
        } else {
            checkIn.recordExplicitAction();
        }
        @Nullable CompletionEvent expired = s.phase == TimerPhase.PAUSED_EXPIRY ? partialCompletion(s, now) : null;
        teardown(s);
        if (expired != null) {
            fire("onComplete", l -> l.onComplete(expired));
        }
        logger.info("Continuing ({}) from slot {} into slot {}", trigger, s.blockIndex, slot.index());
        begin(request, now);
        return true;
    }

    /** The user checked in; automatic continuation may resume. */
    public synchronized void acknowledgeCheckIn() {
        checkIn.recordExplicitAction();
        emitStateChanged();
    }

    public synchronized TimerView view() {
        var s = session;
        if (s == null) {
            return TimerView.idle(checkIn.consecutiveAutoContinuations(), checkIn.isCheckInRequired());
        }
        if (s.phase == TimerPhase.RUNNING) {
            s.refreshTimeLeft(clock.instant());
        }
        return s.toView(checkIn.consecutiveAutoContinuations(), checkIn.isCheckInRequired());
    }

    /** Latest snapshot of the active session, if one is running or paused. */
    public synchronized Optional<RunSnapshot> snapshot() {
        var s = session;
        if (s == null || !s.phase.isLive()) {
            return Optional.empty();
        }
        return Optional.of(s.toSnapshot());
    }

    // ---- host lifecycle, driven by BackgroundRecoveryCoordinator ----

    /** Publishes the live session and stops local callbacks; absolute deadlines remain authoritative. */
    synchronized void suspend() {
        var s = session;
        if (s == null || !s.phase.isLive()) {
            return;
        }
        if (s.phase == TimerPhase.RUNNING) {
            s.refreshTimeLeft(clock.instant());
        }
        publishSnapshot(s);
        cancelCadence();
        cancelExpiry();
        logger.debug("Suspended callbacks for slot {}", s.blockIndex);
    }

    /** Re-derives the session from the clock after the host ran again. */
    synchronized void reconcile() {
        var s = session;
        if (s == null) {
            return;
        }
        var now = clock.instant();
        switch (s.phase) {
            case RUNNING -> {
                if (completeIfBoundaryPassed(s, now)) {
                    logger.info("Slot {} ended while suspended; completed with full credit", s.blockIndex);
                    return;
                }
                startCadence(s);
                tick();
            }
            case PAUSED -> {
                if (s.boundaryPassed(now)) {
                    enterPausedExpiry(s, now);
                } else {
                    scheduleExpiry(s);
                }
            }
            default -> logger.debug("Nothing to reconcile in phase {}", s.phase);
        }
    }

    /**
     * Rebuilds a session from a snapshot after the process was lost.
     *
     * @throws IllegalStateException if the snapshot's segments are inconsistent
     */
    synchronized boolean restore(RunSnapshot snapshot) {
        if (session != null) {
            logger.warn("Ignoring restore of run {}: a session is already active", snapshot.runId());
            return false;
        }
        var s = TimerSession.restore(++generation, snapshot);
        var now = clock.instant();
        s.refreshTimeLeft(now);
        logger.debug("Run {} had {}s of active time when restored", s.runId, s.secondsUsed());
        session = s;
        if (s.phase == TimerPhase.PAUSED) {
            if (s.boundaryPassed(now)) {
                enterPausedExpiry(s, now);
            } else {
                scheduleExpiry(s);
                emitStateChanged();
            }
            logger.info("Restored paused run {} on slot {}", s.runId, s.blockIndex);
            return true;
        }
        if (completeIfBoundaryPassed(s, now)) {
            logger.info("Restored run {} ended while the process was gone; completed with full credit", s.runId);
            return true;
        }
        startCadence(s);
        scheduleNotifications(s);
        logger.info("Restored running run {} on slot {} with {}s left", s.runId, s.blockIndex, s.timeLeft);
        tick();
        emitStateChanged();
        return true;
    }

    // ---- internals ----

    private @Nullable String rejectionReason(StartRequest request, Instant now) {
        var slot = calendar.slotAt(now);
        if (slot.index() != request.blockIndex() || !slot.date().equals(request.date())) {
            return "the current slot is " + slot.index() + " on " + slot.date();
        }
        if (BlockCalendar.secondsRoundedUp(slot.remaining(now)) <= 0) {
            return "no time left in the slot";
        }
        if (request.mode() == SegmentKind.WORK && previousFill(request) >= VisualFillTracker.FULL) {
            return "the slot is already full";
        }
        return null;
    }

    private static double previousFill(StartRequest request) {
        var explicit = request.existingVisualFill();
        return explicit != null ? explicit : VisualFillTracker.baselineProportion(request.existingSegments());
    }

    private void begin(StartRequest request, Instant now) {
        var endAt = calendar.slotAt(now).end();
        var s = TimerSession.begin(++generation, request, now, endAt, previousFill(request));
        if (s.mode.isBreak()) {
            s.breakNotifyAt = breakReminderAt(s, now);
        }
        session = s;
        startCadence(s);
        scheduleNotifications(s);
        logger.info(
                "Started {} on slot {} of {} with {}s left (fill {})",
                s.mode.kind().wireName(),
                s.blockIndex,
                s.date,
                s.initialDurationSeconds,
                s.fill.previousVisualProportion());
        publishSnapshot(s);
        emitStateChanged();
    }

    private @Nullable Instant breakReminderAt(TimerSession s, Instant now) {
        var at = now.plus(settings.breakReminder());
        return at.isBefore(s.endAt) ? at : null;
    }

    private boolean completeIfBoundaryPassed(TimerSession s, Instant now) {
        s.refreshTimeLeft(now);
        if (s.timeLeft > 0) {
            return false;
        }
        completeNaturally(s);
        return true;
    }

    private void completeNaturally(TimerSession s) {
        s.timeLeft = 0;
        var closed = s.ledger.finalizeAt(s.secondsUsed());
        cancelCadence();
        cancelExpiry();
        s.phase = TimerPhase.COMPLETED;
        s.finalFill = VisualFillTracker.FULL;
        var context = s.mode.workContext();
        var event = new CompletionEvent(
                s.blockIndex,
                s.date,
                s.mode.isBreak(),
                s.initialDurationSeconds,
                s.initialDurationSeconds,
                s.allSegments(),
                VisualFillTracker.FULL,
                true,
                context.category(),
                context.label(),
                s.endAt);
        logger.info("Slot {} of {} completed: {}s credited", s.blockIndex, s.date, s.initialDurationSeconds);
        emitBoundary(closed);
        fire("onComplete", l -> l.onComplete(event));
        emitStateChanged();
    }

    private void enterPausedExpiry(TimerSession s, Instant now) {
        s.refreshTimeLeft(now);
        s.finalFill = s.currentFill();
        s.phase = TimerPhase.PAUSED_EXPIRY;
        cancelExpiry();
        cancelNotifications(s);
        logger.info("Slot {} ended while paused at {}s", s.blockIndex, s.secondsUsed());
        var view = s.toView(checkIn.consecutiveAutoContinuations(), checkIn.isCheckInRequired());
        fire("onPausedExpiry", l -> l.onPausedExpiry(view));
        emitStateChanged();
    }

    private CompletionEvent partialCompletion(TimerSession s, Instant now) {
        var context = s.mode.workContext();
        return new CompletionEvent(
                s.blockIndex,
                s.date,
                s.mode.isBreak(),
                s.secondsUsed(),
                s.initialDurationSeconds,
                s.allSegments(),
                s.currentFill(),
                false,
                context.category(),
                context.label(),
                now);
    }

    /** Cancels every callback before the session is dropped. */
    private void teardown(TimerSession s) {
        cancelCadence();
        cancelExpiry();
        if (s.phase != TimerPhase.COMPLETED) {
            cancelNotifications(s);
        }
        session = null;
    }

    private void startCadence(TimerSession s) {
        cancelCadence();
        long gen = s.generation;
        tickHandle = scheduler.scheduleAtFixedRate(() -> tickFor(gen), settings.tickInterval());
        snapshotHandle = scheduler.scheduleAtFixedRate(() -> snapshotFor(gen), settings.snapshotInterval());
    }

    private void cancelCadence() {
        if (tickHandle != null) {
            tickHandle.cancel();
            tickHandle = null;
        }
        if (snapshotHandle != null) {
            snapshotHandle.cancel();
            snapshotHandle = null;
        }
    }

    private void scheduleExpiry(TimerSession s) {
        cancelExpiry();
        long gen = s.generation;
        expiryHandle = scheduler.scheduleAt(() -> pausedExpiryFor(gen), s.endAt);
    }

    private void cancelExpiry() {
        if (expiryHandle != null) {
            expiryHandle.cancel();
            expiryHandle = null;
        }
    }

    private synchronized void tickFor(long gen) {
        if (isStale(gen)) {
            return;
        }
        tick();
    }

    private synchronized void snapshotFor(long gen) {
        var s = session;
        if (isStale(gen) || s == null || s.phase != TimerPhase.RUNNING) {
            return;
        }
        s.refreshTimeLeft(clock.instant());
        if (s.timeLeft == 0) {
            completeNaturally(s);
            return;
        }
        publishSnapshot(s);
    }

    private synchronized void pausedExpiryFor(long gen) {
        var s = session;
        if (isStale(gen) || s == null || s.phase != TimerPhase.PAUSED) {
            return;
        }
        var now = clock.instant();
        if (s.boundaryPassed(now)) {
            enterPausedExpiry(s, now);
        } else {
            scheduleExpiry(s);
        }
    }

    private boolean isStale(long gen) {
        var s = session;
        if (s == null || s.generation != gen) {
            logger.debug("Ignoring callback of ended session generation {}", gen);
            return true;
        }
        return false;
    }

    private @Nullable TimerSession requirePhase(String action, TimerPhase... allowed) {
        var s = session;
        var phase = s == null ? TimerPhase.IDLE : s.phase;
        for (var p : allowed) {
            if (p == phase) {
                return s;
            }
        }
        logger.warn("Ignoring {} while {}", action, phase);
        return null;
    }

    private void scheduleNotifications(TimerSession s) {
        try {
            notifications.cancel(s.blockIndex);
            notifications.scheduleCompletion(s.endAt, s.blockIndex, s.mode.isBreak());
            var notifyAt = s.breakNotifyAt;
            if (notifyAt != null) {
                notifications.scheduleBreakReminder(notifyAt, s.blockIndex);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to schedule notifications for slot {}", s.blockIndex, e);
        }
    }

    private void cancelNotifications(TimerSession s) {
        try {
            notifications.cancel(s.blockIndex);
        } catch (RuntimeException e) {
            logger.warn("Failed to cancel notifications for slot {}", s.blockIndex, e);
        }
    }

    private void publishSnapshot(TimerSession s) {
        var snapshot = s.toSnapshot();
        try {
            snapshotPublisher.publish(snapshot);
        } catch (RuntimeException e) {
            logger.warn("Snapshot publisher failed for run {}", snapshot.runId(), e);
        }
        fire("onSnapshot", l -> l.onSnapshot(snapshot));
    }

    private void emitBoundary(Optional<Segment> closed) {
        closed.ifPresent(segment -> fire("onSegmentBoundary", l -> l.onSegmentBoundary(segment)));
    }

    private void emitStateChanged() {
        var s = session;
        var view = s == null
                ? TimerView.idle(checkIn.consecutiveAutoContinuations(), checkIn.isCheckInRequired())
                : s.toView(checkIn.consecutiveAutoContinuations(), checkIn.isCheckInRequired());
        fire("onStateChanged", l -> l.onStateChanged(view));
    }

    private void fire(String event, Consumer<TimerListener> call) {
        for (var listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed in {}", listener.getClass().getName(), event, e);
            }
        }
    }
}
