package io.seventytwo.blocks.segments;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.seventytwo.blocks.api.Segment;
import io.seventytwo.blocks.api.SegmentKind;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SegmentLedgerTest {

    @Test
    void splitClosesTheOpenSegmentAndOpensTheNextKind() {
        var ledger = new SegmentLedger(SegmentKind.WORK, "deep", "draft");

        var closed = ledger.splitAt(600, SegmentKind.BREAK, null, null);

        assertEquals(Optional.of(Segment.work(600, "deep", "draft", 0)), closed);
        assertEquals(600, ledger.currentSegmentStart());
        assertEquals(SegmentKind.BREAK, ledger.currentKind());
        assertEquals(
                List.of(Segment.work(600, "deep", "draft", 0), Segment.breakTime(30, 600)), ledger.liveView(630));
    }

    @Test
    void zeroLengthSegmentsAreNeverRecorded() {
        var ledger = new SegmentLedger(SegmentKind.WORK, null, null);

        assertEquals(Optional.empty(), ledger.splitAt(0, SegmentKind.BREAK, null, null));
        assertEquals(Optional.empty(), ledger.finalizeAt(0));
        assertEquals(List.of(), ledger.liveView(0));
    }

    @Test
    void labelOnlyChangeBelowTheMinimumJustRetagsTheOpenSegment() {
        var ledger = new SegmentLedger(SegmentKind.WORK, "a", "x");

        assertEquals(Optional.empty(), ledger.retag(5, "a", "y", 10));
        assertEquals(List.of(Segment.work(5, "a", "y", 0)), ledger.liveView(5));

        assertEquals(Optional.of(Segment.work(15, "a", "y", 0)), ledger.retag(15, "a", "z", 10));
    }

    @Test
    void categoryChangeAlwaysCreatesABoundaryOnceTimeHasPassed() {
        var ledger = new SegmentLedger(SegmentKind.WORK, "a", null);

        assertEquals(Optional.empty(), ledger.retag(0, "b", null, 10));
        assertEquals("b", ledger.currentCategory());
        assertEquals(Optional.of(Segment.work(3, "b", null, 0)), ledger.retag(3, "c", null, 10));
    }

    @Test
    void unchangedTagsDoNothing() {
        var ledger = new SegmentLedger(SegmentKind.WORK, "a", "x");

        assertEquals(Optional.empty(), ledger.retag(500, "a", "x", 10));
        assertEquals(0, ledger.currentSegmentStart());
    }

    @Test
    void drainHandsOverTheWindowAndStartsAFreshOne() {
        var ledger = new SegmentLedger(SegmentKind.WORK, "a", null);
        ledger.splitAt(100, SegmentKind.BREAK, null, null);

        var drained = ledger.drain(160);

        assertEquals(List.of(Segment.work(100, "a", null, 0), Segment.breakTime(60, 100)), drained);
        assertEquals(160, ledger.windowStart());
        assertEquals(List.of(), ledger.segments());
        assertEquals(List.of(Segment.breakTime(40, 160)), ledger.liveView(200));
        assertEquals(40, ledger.liveSeconds(200));
    }

    @Test
    void elapsedMayNotGoBackwards() {
        var ledger = new SegmentLedger(SegmentKind.WORK, null, null);
        ledger.finalizeAt(50);

        assertThrows(IllegalStateException.class, () -> ledger.liveView(40));
        assertThrows(IllegalStateException.class, () -> ledger.splitAt(10, SegmentKind.BREAK, null, null));
    }

    @Test
    void appendMustContinueTheTimeline() {
        var ledger = new SegmentLedger(SegmentKind.WORK, null, null);
        ledger.append(Segment.work(30, null, null, 0));

        assertThrows(IllegalStateException.class, () -> ledger.append(Segment.work(30, null, null, 40)));
    }

    @Test
    void restoreSplitsFinalizedSegmentsFromTheOpenTail() {
        var live = List.of(Segment.work(100, "a", null, 0), Segment.breakTime(25, 100));

        var ledger = SegmentLedger.restore(live, 100, SegmentKind.BREAK, null, null);

        assertEquals(List.of(Segment.work(100, "a", null, 0)), ledger.segments());
        assertEquals(List.of(Segment.work(100, "a", null, 0), Segment.breakTime(80, 100)), ledger.liveView(180));
    }

    @Test
    void restoreOfAResumedWindowKeepsItsStart() {
        var ledger = SegmentLedger.restore(List.of(), 300, SegmentKind.WORK, "a", null);

        assertEquals(300, ledger.windowStart());
        assertTrue(ledger.liveView(300).isEmpty());
    }

    @Test
    void restoreRejectsGaps() {
        var live = List.of(Segment.work(100, "a", null, 0));

        assertThrows(
                IllegalStateException.class, () -> SegmentLedger.restore(live, 150, SegmentKind.WORK, "a", null));
    }
}
