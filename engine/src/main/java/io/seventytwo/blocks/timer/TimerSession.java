package io.seventytwo.blocks.timer;

import io.seventytwo.blocks.api.RunSnapshot;
import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.calendar.BlockCalendar;
import io.seventytwo.blocks.fill.VisualFillTracker;
import io.seventytwo.blocks.segments.SegmentLedger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * The single mutable session owned by {@link TimerStateMachine}. Never handed out; callers see
 * {@link TimerView} and {@link RunSnapshot} projections.
 *
 * <p>Active seconds are {@code initialDurationSeconds - timeLeft - pausedSeconds} while running and
 * {@code pausedSecondsUsed} while paused.
 */
final class TimerSession {
    final String runId;
    final long generation;
    final int blockIndex;
    final LocalDate date;
    final Instant startedAt;
    final Instant endAt;
    final int initialDurationSeconds;

    SessionMode mode;
    TimerPhase phase = TimerPhase.RUNNING;
    int timeLeft;
    int pausedSeconds;
    @Nullable Integer pausedSecondsUsed;
    @Nullable Instant breakNotifyAt;
    VisualFillTracker fill;
    SegmentLedger ledger;
    /** Earlier sessions of the slot, then live windows of this session closed by a resume. */
    final List<Segment> previousSegments = new ArrayList<>();
    /** Set once the session reached a terminal phase; the fill stops tracking the clock. */
    @Nullable Double finalFill;

    TimerSession(
            String runId,
            long generation,
            int blockIndex,
            LocalDate date,
            Instant startedAt,
            Instant endAt,
            int initialDurationSeconds,
            SessionMode mode,
            VisualFillTracker fill,
            SegmentLedger ledger) {
        this.runId = runId;
        this.generation = generation;
        this.blockIndex = blockIndex;
        this.date = date;
        this.startedAt = startedAt;
        this.endAt = endAt;
        this.initialDurationSeconds = initialDurationSeconds;
        this.timeLeft = initialDurationSeconds;
        this.mode = mode;
        this.fill = fill;
        this.ledger = ledger;
    }

    static TimerSession begin(long generation, StartRequest request, Instant now, Instant endAt, double previousFill) {
        var remaining = Duration.between(now, endAt);
        var mode = SessionMode.of(request.mode(), request.workContext());
        var session = new TimerSession(
                UUID.randomUUID().toString(),
                generation,
                request.blockIndex(),
                request.date(),
                now,
                endAt,
                BlockCalendar.secondsRoundedUp(remaining),
                mode,
                VisualFillTracker.begin(previousFill, remaining),
                new SegmentLedger(mode.kind(), ledgerCategory(mode), ledgerLabel(mode)));
        session.previousSegments.addAll(request.existingSegments());
        return session;
    }

    static TimerSession restore(long generation, RunSnapshot snapshot) {
        var workContext = new WorkContext(snapshot.lastWorkCategory(), snapshot.lastWorkLabel());
        var mode = SessionMode.of(snapshot.currentMode(), workContext);
        var ledger = SegmentLedger.restore(
                snapshot.segments(),
                snapshot.currentSegmentStart(),
                mode.kind(),
                ledgerCategory(mode),
                ledgerLabel(mode));
        var session = new TimerSession(
                snapshot.runId(),
                generation,
                snapshot.blockIndex(),
                snapshot.date(),
                snapshot.startedAt(),
                snapshot.endAt(),
                snapshot.initialDurationSeconds(),
                mode,
                new VisualFillTracker(snapshot.previousVisualProportion(), snapshot.scaleFactor()),
                ledger);
        session.previousSegments.addAll(snapshot.previousSegments());
        session.pausedSeconds = snapshot.pausedSeconds();
        session.pausedSecondsUsed = snapshot.pausedSecondsUsed();
        session.breakNotifyAt = snapshot.breakNotifyAt();
        session.phase = snapshot.isPaused() ? TimerPhase.PAUSED : TimerPhase.RUNNING;
        return session;
    }

    static @Nullable String ledgerCategory(SessionMode mode) {
        return mode.isBreak() ? null : mode.workContext().category();
    }

    static @Nullable String ledgerLabel(SessionMode mode) {
        return mode.isBreak() ? null : mode.workContext().label();
    }

    /** Recomputes {@link #timeLeft} from the absolute boundary. */
    void refreshTimeLeft(Instant now) {
        timeLeft = BlockCalendar.secondsRoundedUp(Duration.between(now, endAt));
    }

    Duration remainingReal(Instant now) {
        var remaining = Duration.between(now, endAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    boolean boundaryPassed(Instant now) {
        return !now.isBefore(endAt);
    }

    int secondsUsed() {
        if (pausedSecondsUsed != null) {
            return pausedSecondsUsed;
        }
        int used = initialDurationSeconds - timeLeft - pausedSeconds;
        if (used < ledger.currentSegmentStart()) {
            throw new IllegalStateException("active seconds " + used + " fell behind the open segment at "
                    + ledger.currentSegmentStart() + " in run " + runId);
        }
        return used;
    }

    int liveSeconds() {
        return secondsUsed() - ledger.windowStart();
    }

    double currentFill() {
        if (finalFill != null) {
            return finalFill;
        }
        return fill.currentFill(liveSeconds());
    }

    double progressPercent() {
        if (initialDurationSeconds == 0) {
            return 100.0;
        }
        return (initialDurationSeconds - timeLeft) * 100.0 / initialDurationSeconds;
    }

    /** Earlier segments followed by the live window, including the in-progress tail. */
    List<Segment> allSegments() {
        var live = ledger.liveView(secondsUsed());
        var all = new ArrayList<Segment>(previousSegments.size() + live.size());
        all.addAll(previousSegments);
        all.addAll(live);
        return List.copyOf(all);
    }

    RunSnapshot toSnapshot() {
        int used = secondsUsed();
        return new RunSnapshot(
                runId,
                blockIndex,
                date,
                startedAt,
                endAt,
                initialDurationSeconds,
                pausedSeconds,
                pausedSecondsUsed,
                List.copyOf(previousSegments),
                ledger.liveView(used),
                ledger.currentSegmentStart(),
                mode.kind(),
                ledgerCategory(mode),
                ledgerLabel(mode),
                mode.workContext().category(),
                mode.workContext().label(),
                fill.previousVisualProportion(),
                fill.scaleFactor(),
                breakNotifyAt);
    }

    TimerView toView(int consecutiveAutoContinuations, boolean checkInRequired) {
        return new TimerView(
                phase,
                blockIndex,
                date,
                mode,
                startedAt,
                endAt,
                initialDurationSeconds,
                timeLeft,
                secondsUsed(),
                pausedSeconds,
                currentFill(),
                progressPercent(),
                allSegments(),
                breakNotifyAt,
                consecutiveAutoContinuations,
                checkInRequired);
    }
}
