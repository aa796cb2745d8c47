package io.seventytwo.blocks.timer;

import static io.seventytwo.blocks.testutil.TestTimes.DAY;
import static io.seventytwo.blocks.testutil.TestTimes.SLOT_30;
import static io.seventytwo.blocks.testutil.TestTimes.SLOT_30_START;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.api.SegmentKind;
import io.seventytwo.blocks.api.SnapshotPublisher;
import io.seventytwo.blocks.config.TimerSettings;
import io.seventytwo.blocks.testutil.ManualClock;
import io.seventytwo.blocks.testutil.ManualTimerScheduler;
import io.seventytwo.blocks.testutil.RecordingListener;
import io.seventytwo.blocks.testutil.RecordingNotificationScheduler;
import io.seventytwo.blocks.testutil.TestTimes;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimerStateMachineTest {
    private static final Instant SLOT_30_END = SLOT_30_START.plusSeconds(1200);

    private ManualClock clock;
    private ManualTimerScheduler scheduler;
    private RecordingNotificationScheduler notifications;
    private RecordingListener listener;
    private TimerStateMachine engine;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(SLOT_30_START);
        scheduler = new ManualTimerScheduler(clock);
        notifications = new RecordingNotificationScheduler();
        listener = new RecordingListener();
        engine = new TimerStateMachine(clock, scheduler, notifications, SnapshotPublisher.NONE, TestTimes.settings());
        engine.addListener(listener);
    }

    private boolean startWork(String category, String label) {
        return engine.start(StartRequest.work(SLOT_30, DAY, category, label));
    }

    @Test
    void startDuringTheRepeatedHourRunsToTheSecondPassBoundary() {
        var defaults = TestTimes.settings();
        var newYork = new TimerSettings(
                ZoneId.of("America/New_York"),
                defaults.dayStartHour(),
                defaults.checkInThreshold(),
                defaults.breakReminder(),
                defaults.autoContinueDelay(),
                defaults.autoContinueEnabled(),
                defaults.minLabelSegmentSeconds(),
                defaults.tickInterval(),
                defaults.snapshotInterval());
        var dstClock = new ManualClock(Instant.parse("2026-11-01T06:10:00Z"));
        var dstScheduler = new ManualTimerScheduler(dstClock);
        var dstListener = new RecordingListener();
        var dstEngine = new TimerStateMachine(
                dstClock, dstScheduler, new RecordingNotificationScheduler(), SnapshotPublisher.NONE, newYork);
        dstEngine.addListener(dstListener);

        assertTrue(dstEngine.start(StartRequest.work(3, LocalDate.of(2026, 10, 31), "deep", null)));
        assertEquals(600, dstEngine.view().timeLeft());

        dstScheduler.advanceSeconds(600);
        var completion = dstListener.lastCompletion();
        assertTrue(completion.natural());
        assertEquals(Instant.parse("2026-11-01T06:20:00Z"), completion.completedAt());
    }

    @Test
    void workThenBreakAtHalfwayFillsHalfTheSlot() {
        assertTrue(startWork("deep", "write"));
        scheduler.advanceSeconds(600);

        assertTrue(engine.switchMode(SegmentKind.BREAK));

        assertEquals(List.of(Segment.work(600, "deep", "write", 0)), listener.boundaries);
        var view = engine.view();
        assertEquals(0.5, view.visualFill(), 1e-9);
        assertEquals(600, view.secondsUsed());
        assertTrue(view.isBreak());
    }

    @Test
    void lateStartOnHalfFilledSlotReachesExactlyFullAtTheBoundary() {
        clock.set(SLOT_30_START.plusSeconds(600));
        var earlier = List.of(Segment.work(600, "deep", null, 0));
        var request = StartRequest.work(SLOT_30, DAY, "deep", null)
                .withExistingSegments(earlier)
                .withExistingVisualFill(0.5);
        assertTrue(engine.start(request));
        assertEquals(0.5 / 600, engine.snapshot().orElseThrow().scaleFactor(), 1e-15);

        scheduler.advanceSeconds(599);
        assertTrue(engine.view().visualFill() < 1.0);

        scheduler.advanceSeconds(1);
        var completion = listener.lastCompletion();
        assertTrue(completion.natural());
        assertEquals(1.0, completion.visualFill());
        assertEquals(600, completion.secondsUsed());
        assertEquals(600, completion.initialDurationSeconds());
        assertEquals(1200, Segment.totalSeconds(completion.segments()));
        assertEquals(SLOT_30_END, completion.completedAt());
        assertEquals(TimerPhase.COMPLETED, engine.view().phase());
        assertEquals(1.0, engine.view().visualFill());
    }

    @Test
    void resumeKeepsTheFillAndRescalesOverWhatIsLeft() {
        assertTrue(startWork("deep", null));
        scheduler.advanceSeconds(300);
        assertTrue(engine.pause());
        double fillAtPause = engine.view().visualFill();
        assertEquals(0.25, fillAtPause, 1e-9);

        scheduler.advanceSeconds(300);
        assertEquals(300, engine.view().secondsUsed());
        assertTrue(engine.resume());

        var view = engine.view();
        assertEquals(fillAtPause, view.visualFill());
        assertEquals(300, view.secondsUsed());
        assertEquals(300, view.pausedSeconds());
        assertEquals(600, view.timeLeft());
        var snapshot = engine.snapshot().orElseThrow();
        assertEquals(fillAtPause, snapshot.previousVisualProportion());
        assertEquals((1.0 - fillAtPause) / 600, snapshot.scaleFactor(), 1e-15);
        assertEquals(List.of(Segment.work(300, "deep", null, 0)), snapshot.previousSegments());

        scheduler.advanceSeconds(600);
        var completion = listener.lastCompletion();
        assertEquals(1.0, completion.visualFill());
        assertEquals(1200, completion.secondsUsed());
        assertEquals(900, Segment.totalSeconds(completion.segments()));
    }

    @Test
    void pauseAndImmediateResumeLeaveTheFillBitForBitUnchanged() {
        assertTrue(startWork("deep", null));
        scheduler.advanceSeconds(123);
        assertTrue(engine.pause());
        double before = engine.view().visualFill();

        assertTrue(engine.resume());

        assertEquals(Double.doubleToRawLongBits(before), Double.doubleToRawLongBits(engine.view().visualFill()));
    }

    @Test
    void pausedSessionExpiresAtTheBoundaryWithoutCredit() {
        assertTrue(startWork("deep", null));
        scheduler.advanceSeconds(100);
        assertTrue(engine.pause());
        assertEquals(0, scheduler.activePeriodicCount());
        assertTrue(notifications.pending.isEmpty());

        scheduler.advanceSeconds(1100);

        assertEquals(1, listener.pausedExpiries.size());
        var view = engine.view();
        assertEquals(TimerPhase.PAUSED_EXPIRY, view.phase());
        assertEquals(100, view.secondsUsed());
        assertTrue(listener.completions.isEmpty());

        assertFalse(engine.resume());
        assertEquals(TimerPhase.PAUSED_EXPIRY, engine.view().phase());
    }

    @Test
    void resumeAfterTheBoundaryEntersPausedExpiryEvenIfTheCallbackNeverRan() {
        assertTrue(startWork("deep", null));
        scheduler.advanceSeconds(100);
        assertTrue(engine.pause());
        scheduler.jump(Duration.ofSeconds(1500));

        assertFalse(engine.resume());

        assertEquals(TimerPhase.PAUSED_EXPIRY, engine.view().phase());
        assertEquals(1, listener.pausedExpiries.size());
    }

    @Test
    void stoppingAnExpiredSessionRecordsItsPartialTime() {
        assertTrue(startWork("deep", "notes"));
        scheduler.advanceSeconds(100);
        assertTrue(engine.pause());
        scheduler.advanceSeconds(1200);

        assertTrue(engine.stop(true));

        var completion = listener.lastCompletion();
        assertFalse(completion.natural());
        assertEquals(100, completion.secondsUsed());
        assertEquals("deep", completion.category());
        assertEquals("notes", completion.label());
        assertEquals(TimerPhase.IDLE, engine.view().phase());
    }

    @Test
    void dismissingAnExpiredSessionRecordsItAndGoesIdle() {
        assertTrue(startWork("deep", null));
        scheduler.advanceSeconds(100);
        assertTrue(engine.pause());
        scheduler.advanceSeconds(1200);

        assertTrue(engine.dismiss());

        assertEquals(1, listener.completions.size());
        assertEquals(100, listener.lastCompletion().secondsUsed());
        assertEquals(TimerPhase.IDLE, engine.view().phase());
    }

    @Test
    void labelOnlyChangeNeedsTenSecondsToOpenASegment() {
        assertTrue(startWork("a", "x"));
        scheduler.advanceSeconds(5);
        assertTrue(engine.updateCategory("a", "y"));
        assertTrue(listener.boundaries.isEmpty());

        scheduler.advanceSeconds(10);
        assertTrue(engine.updateCategory("a", "z"));
        assertEquals(List.of(Segment.work(15, "a", "y", 0)), listener.boundaries);

        scheduler.advanceSeconds(3);
        assertTrue(engine.updateCategory("b", "z"));
        assertEquals(Segment.work(3, "a", "z", 15), listener.boundaries.get(1));
        assertEquals("b", engine.view().category());
    }

    @Test
    void breakRemembersTheWorkContext() {
        assertTrue(startWork("code", "review"));
        scheduler.advanceSeconds(60);
        assertTrue(engine.switchMode(SegmentKind.BREAK));
        assertNull(engine.view().category());

        scheduler.advanceSeconds(30);
        assertTrue(engine.updateCategory("code", "tests"));
        assertEquals(1, listener.boundaries.size());

        scheduler.advanceSeconds(30);
        assertTrue(engine.switchMode(SegmentKind.WORK));

        var view = engine.view();
        assertEquals("code", view.category());
        assertEquals("tests", view.label());
        assertEquals(List.of(Segment.work(60, "code", "review", 0), Segment.breakTime(60, 60)), listener.boundaries);
    }

    @Test
    void modeSwitchPublishesASnapshotImmediately() {
        assertTrue(startWork("code", null));
        scheduler.advanceSeconds(2);
        int before = listener.snapshots.size();

        assertTrue(engine.switchMode(SegmentKind.BREAK));

        assertEquals(before + 1, listener.snapshots.size());
        var snapshot = listener.snapshots.get(listener.snapshots.size() - 1);
        assertEquals(SegmentKind.BREAK, snapshot.currentMode());
        assertEquals("code", snapshot.lastWorkCategory());
        assertNull(snapshot.currentCategory());
    }

    @Test
    void snapshotsFollowTheConfiguredCadence() {
        assertTrue(startWork("code", null));
        int afterStart = listener.snapshots.size();

        scheduler.advanceSeconds(20);

        assertEquals(afterStart + 4, listener.snapshots.size());
    }

    @Test
    void breakReminderFiresOnceAndTheBreakKeepsRunning() {
        assertTrue(engine.start(StartRequest.rest(SLOT_30, DAY)));
        assertTrue(notifications.pending.contains(new RecordingNotificationScheduler.Scheduled(
                "break-reminder", SLOT_30_START.plusSeconds(300), SLOT_30)));

        scheduler.advanceSeconds(299);
        assertEquals(0, listener.breakNotifications);
        scheduler.advanceSeconds(1);
        assertEquals(1, listener.breakNotifications);
        scheduler.advanceSeconds(60);
        assertEquals(1, listener.breakNotifications);
        assertEquals(TimerPhase.RUNNING, engine.view().phase());
        assertNull(engine.view().breakNotifyAt());
    }

    @Test
    void snoozeMovesTheBreakReminder() {
        assertTrue(engine.start(StartRequest.rest(SLOT_30, DAY)));
        scheduler.advanceSeconds(300);
        assertEquals(1, listener.breakNotifications);

        assertTrue(engine.snoozeBreakReminder(Duration.ofMinutes(2)));
        scheduler.advanceSeconds(120);

        assertEquals(2, listener.breakNotifications);
    }

    @Test
    void switchingBackToWorkClearsTheBreakReminder() {
        assertTrue(engine.start(StartRequest.rest(SLOT_30, DAY)));
        scheduler.advanceSeconds(60);
        assertTrue(engine.switchMode(SegmentKind.WORK));

        scheduler.advanceSeconds(600);

        assertEquals(0, listener.breakNotifications);
        assertFalse(engine.snoozeBreakReminder(Duration.ofMinutes(1)));
    }

    @Test
    void startIsRejectedForAnySlotButTheCurrentOne() {
        assertFalse(engine.start(StartRequest.work(SLOT_30 + 1, DAY, null, null)));
        assertFalse(engine.start(StartRequest.work(SLOT_30 - 1, DAY, null, null)));
        assertFalse(engine.start(StartRequest.work(SLOT_30, DAY.minusDays(1), null, null)));
        assertEquals(TimerPhase.IDLE, engine.view().phase());
        assertTrue(listener.states.isEmpty());
    }

    @Test
    void workStartNeedsVisualRoomButABreakDoesNot() {
        var full = StartRequest.work(SLOT_30, DAY, null, null).withExistingVisualFill(1.0);
        assertFalse(engine.start(full));

        var fullBreak = StartRequest.rest(SLOT_30, DAY).withExistingVisualFill(1.0);
        assertTrue(engine.start(fullBreak));
        assertEquals(1.0, engine.view().visualFill());
    }

    @Test
    void previousFillDefaultsToTheBaselineOfExistingSegments() {
        var request = StartRequest.work(SLOT_30, DAY, null, null)
                .withExistingSegments(List.of(Segment.work(300, null, null, 0)));

        assertTrue(engine.start(request));

        assertEquals(0.25, engine.snapshot().orElseThrow().previousVisualProportion(), 1e-12);
    }

    @Test
    void illegalCallsAreIgnored() {
        assertFalse(engine.pause());
        assertFalse(engine.resume());
        assertFalse(engine.stop(true));
        assertFalse(engine.dismiss());
        assertFalse(engine.switchMode(SegmentKind.BREAK));
        assertFalse(engine.continueToCurrentSlot(ContinuationTrigger.EXPLICIT, List.of()));

        assertTrue(startWork("a", null));
        assertFalse(startWork("b", null));
        assertFalse(engine.resume());
        assertFalse(engine.dismiss());
        assertFalse(engine.switchMode(SegmentKind.WORK));
        assertEquals(TimerPhase.RUNNING, engine.view().phase());
        assertEquals("a", engine.view().category());
    }

    @Test
    void stopRecordsActualValuesAndCancelsEverything() {
        assertTrue(startWork("a", null));
        scheduler.advanceSeconds(400);

        assertTrue(engine.stop(true));

        var completion = listener.lastCompletion();
        assertFalse(completion.natural());
        assertEquals(400, completion.secondsUsed());
        assertEquals(400.0 / 1200, completion.visualFill(), 1e-9);
        assertEquals(SLOT_30_START.plusSeconds(400), completion.completedAt());
        assertEquals(TimerPhase.IDLE, engine.view().phase());
        assertEquals(0, scheduler.activePeriodicCount());
        assertTrue(notifications.pending.isEmpty());

        int ticks = listener.ticks.size();
        scheduler.advanceSeconds(30);
        assertEquals(ticks, listener.ticks.size());
    }

    @Test
    void stopWithoutMarkingCompleteEmitsNoCompletion() {
        assertTrue(startWork("a", null));
        scheduler.advanceSeconds(40);

        assertTrue(engine.stop(false));

        assertTrue(listener.completions.isEmpty());
        assertEquals(TimerPhase.IDLE, engine.view().phase());
    }

    @Test
    void naturalCompletionCreditsTheFullSessionDespiteAPause() {
        assertTrue(startWork("a", null));
        scheduler.advanceSeconds(200);
        assertTrue(engine.pause());
        scheduler.advanceSeconds(100);
        assertTrue(engine.resume());

        scheduler.advanceSeconds(900);

        var completion = listener.lastCompletion();
        assertTrue(completion.natural());
        assertEquals(1200, completion.secondsUsed());
        assertEquals(1.0, completion.visualFill());
        assertEquals(1100, Segment.totalSeconds(completion.segments()));
        assertEquals(0, scheduler.activePeriodicCount());
    }

    @Test
    void fillNeverDecreasesAndSegmentsNeverExceedTheSession() {
        assertTrue(startWork("a", "x"));
        var fills = new ArrayList<Double>();
        var totals = new ArrayList<Integer>();
        Runnable sample = () -> {
            var view = engine.view();
            fills.add(view.visualFill());
            totals.add(Segment.totalSeconds(view.segments()));
        };

        for (int i = 0; i < 6; i++) {
            scheduler.advanceSeconds(37);
            sample.run();
            engine.switchMode(i % 2 == 0 ? SegmentKind.BREAK : SegmentKind.WORK);
            sample.run();
            scheduler.advanceSeconds(11);
            engine.pause();
            sample.run();
            scheduler.advanceSeconds(13);
            engine.resume();
            sample.run();
            engine.updateCategory("a", "label-" + i);
            sample.run();
        }
        scheduler.advanceSeconds(1200);
        sample.run();

        for (int i = 1; i < fills.size(); i++) {
            assertTrue(fills.get(i) >= fills.get(i - 1), "fill dropped at sample " + i);
            assertTrue(totals.get(i) >= totals.get(i - 1), "segment total dropped at sample " + i);
            assertTrue(totals.get(i) <= 1200);
        }
        assertEquals(1.0, fills.get(fills.size() - 1));
    }

    @Test
    void notificationsFollowTheSession() {
        assertTrue(startWork("a", null));
        assertEquals(
                List.of(new RecordingNotificationScheduler.Scheduled("work-end", SLOT_30_END, SLOT_30)),
                notifications.pending);

        scheduler.advanceSeconds(10);
        assertTrue(engine.switchMode(SegmentKind.BREAK));
        assertEquals("break-end", notifications.pending.get(0).kind());
        assertEquals(2, notifications.pending.size());

        assertTrue(engine.pause());
        assertTrue(notifications.pending.isEmpty());
        assertTrue(engine.resume());
        assertEquals("break-end", notifications.pending.get(0).kind());
    }

    @Test
    void failingListenerDoesNotBreakTheEngine() {
        engine.addListener(new TimerListener() {
            @Override
            public void onTick(int timeLeft, double progressPercent) {
                throw new IllegalStateException("boom");
            }
        });
        assertTrue(startWork("a", null));

        scheduler.advanceSeconds(1200);

        assertEquals(1, listener.completions.size());
    }

    @Test
    void continuingIntoTheNextSlotKeepsModeAndContext() {
        assertTrue(startWork("a", "x"));
        scheduler.advanceSeconds(1200);
        assertEquals(TimerPhase.COMPLETED, engine.view().phase());

        assertTrue(engine.continueToCurrentSlot(ContinuationTrigger.EXPLICIT, List.of()));

        var view = engine.view();
        assertEquals(TimerPhase.RUNNING, view.phase());
        assertEquals(SLOT_30 + 1, view.blockIndex());
        assertEquals("a", view.category());
        assertEquals("x", view.label());
        assertEquals(1200, view.initialDurationSeconds());
    }

    @Test
    void continuingFromPausedExpiryRecordsTheExpiredSessionFirst() {
        assertTrue(startWork("a", null));
        scheduler.advanceSeconds(100);
        assertTrue(engine.pause());
        scheduler.advanceSeconds(1150);

        assertTrue(engine.continueToCurrentSlot(ContinuationTrigger.EXPLICIT, SegmentKind.BREAK, List.of()));

        assertEquals(1, listener.completions.size());
        assertEquals(100, listener.lastCompletion().secondsUsed());
        assertEquals(SLOT_30, listener.lastCompletion().blockIndex());
        var view = engine.view();
        assertEquals(SLOT_30 + 1, view.blockIndex());
        assertTrue(view.isBreak());
        assertEquals(1100, view.initialDurationSeconds());
    }

    @Test
    void automaticContinuationStopsAtTheCheckInThreshold() {
        assertTrue(startWork("a", null));
        for (int i = 1; i <= 3; i++) {
            scheduler.advanceSeconds(1200);
            assertTrue(engine.continueToCurrentSlot(ContinuationTrigger.AUTOMATIC, List.of()));
            assertEquals(i, engine.view().consecutiveAutoContinuations());
        }
        scheduler.advanceSeconds(1200);

        assertFalse(engine.continueToCurrentSlot(ContinuationTrigger.AUTOMATIC, List.of()));

        assertEquals(1, listener.checkInsRequired);
        assertEquals(TimerPhase.COMPLETED, engine.view().phase());
        assertTrue(engine.view().checkInRequired());

        engine.acknowledgeCheckIn();
        assertEquals(0, engine.view().consecutiveAutoContinuations());
        assertTrue(engine.continueToCurrentSlot(ContinuationTrigger.AUTOMATIC, List.of()));
        assertEquals(1, engine.view().consecutiveAutoContinuations());
    }

    @Test
    void explicitActionsResetTheCheckInCounter() {
        assertTrue(startWork("a", null));
        scheduler.advanceSeconds(1200);
        assertTrue(engine.continueToCurrentSlot(ContinuationTrigger.AUTOMATIC, List.of()));
        scheduler.advanceSeconds(1200);
        assertTrue(engine.continueToCurrentSlot(ContinuationTrigger.AUTOMATIC, List.of()));
        assertEquals(2, engine.view().consecutiveAutoContinuations());

        assertTrue(engine.switchMode(SegmentKind.BREAK));

        assertEquals(0, engine.view().consecutiveAutoContinuations());
    }

    @Test
    void continuationIntoAFullSlotIsRejected() {
        assertTrue(startWork("a", null));
        scheduler.advanceSeconds(1200);

        var full = List.of(Segment.work(1200, "a", null, 0));
        assertFalse(engine.continueToCurrentSlot(ContinuationTrigger.AUTOMATIC, full));

        assertEquals(TimerPhase.COMPLETED, engine.view().phase());
        assertEquals(0, engine.view().consecutiveAutoContinuations());
    }

    @Test
    void startingAgainAfterCompletionReplacesTheCompletedSession() {
        assertTrue(startWork("a", null));
        scheduler.advanceSeconds(1200);

        assertTrue(engine.start(StartRequest.work(SLOT_30 + 1, DAY, "b", null)));

        assertEquals(TimerPhase.RUNNING, engine.view().phase());
        assertEquals("b", engine.view().category());
    }
}
