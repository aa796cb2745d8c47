package io.seventytwo.blocks.calendar;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Slot arithmetic for a day of 72 twenty-minute slots.
 *
 * <p>Slot indexes always count from local midnight (index 0 is 00:00-00:20). The day-start hour only
 * decides which calendar day a slot belongs to and how slots are numbered for display: with a day
 * start of 06:00, slot 3 (01:00) of logical day D lies on calendar day D+1 and is displayed as the
 * 58th slot of D.
 */
public final class BlockCalendar {
    public static final int SLOT_SECONDS = 1200;
    public static final int SLOTS_PER_DAY = 72;
    public static final int SLOTS_PER_HOUR = 3;
    private static final int SLOT_MINUTES = SLOT_SECONDS / 60;

    private final ZoneId zone;
    private final int dayStartHour;

    public BlockCalendar(ZoneId zone, int dayStartHour) {
        this.zone = Objects.requireNonNull(zone, "zone");
        if (dayStartHour < 0 || dayStartHour > 23) {
            throw new IllegalArgumentException("dayStartHour must be within 0..23, got: " + dayStartHour);
        }
        this.dayStartHour = dayStartHour;
    }

    public ZoneId zone() {
        return zone;
    }

    public int dayStartHour() {
        return dayStartHour;
    }

    /** Index of the slot whose wall-clock interval contains {@code now}. */
    public int indexForInstant(Instant now) {
        var local = LocalDateTime.ofInstant(now, zone);
        return (local.getHour() * 60 + local.getMinute()) / SLOT_MINUTES;
    }

    /** The logical day {@code now} belongs to; before the day-start hour that is still yesterday. */
    public LocalDate logicalDate(Instant now) {
        var local = LocalDateTime.ofInstant(now, zone);
        var date = local.toLocalDate();
        return local.getHour() < dayStartHour ? date.minusDays(1) : date;
    }

    /**
     * The slot containing {@code now}. While a repeated local hour is passed through the second time,
     * the slot is placed on that second pass.
     */
    public BlockSlot slotAt(Instant now) {
        var date = logicalDate(now);
        int index = indexForInstant(now);
        var slot = slot(date, index);
        return slot.contains(now) ? slot : bounds(date, index, true);
    }

    /**
     * Bounds of slot {@code index} on the given logical day. A slot inside a repeated local hour is
     * placed on its first pass.
     */
    public BlockSlot slot(LocalDate logicalDate, int index) {
        return bounds(logicalDate, index, false);
    }

    private BlockSlot bounds(LocalDate logicalDate, int index, boolean laterOffset) {
        checkIndex(index);
        var calendarDate = isBeforeDayStart(index) ? logicalDate.plusDays(1) : logicalDate;
        var startLocal = calendarDate.atStartOfDay().plusMinutes((long) index * SLOT_MINUTES);
        var start = startLocal.atZone(zone);
        var end = startLocal.plusMinutes(SLOT_MINUTES).atZone(zone);
        if (laterOffset) {
            start = start.withLaterOffsetAtOverlap();
            end = end.withLaterOffsetAtOverlap();
        }
        return new BlockSlot(index, logicalDate, start.toInstant(), end.toInstant());
    }

    /**
     * Whole seconds left in slot {@code index} of the logical day containing {@code now}: 0 once the
     * slot has passed, the full slot length before it starts.
     */
    public int remainingSeconds(int index, Instant now) {
        var current = slotAt(now);
        var slot = current.index() == index ? current : slot(logicalDate(now), index);
        if (slot.hasEnded(now)) {
            return 0;
        }
        if (now.isBefore(slot.start())) {
            return SLOT_SECONDS;
        }
        return secondsRoundedUp(slot.remaining(now));
    }

    /** 1-based position of the slot within the logical day; the day-start hour's first slot is 1. */
    public int displayNumber(int index) {
        checkIndex(index);
        return Math.floorMod(index - dayStartHour * SLOTS_PER_HOUR, SLOTS_PER_DAY) + 1;
    }

    /** True when slot {@code a} comes before slot {@code b} within the same logical day. */
    public boolean isEarlierInDay(int a, int b) {
        return displayNumber(a) < displayNumber(b);
    }

    /** Wall-clock start of a slot, e.g. {@code 08:20}. */
    public static String startTimeLabel(int index) {
        checkIndex(index);
        int minutes = index * SLOT_MINUTES;
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }

    /** Rounds up to whole seconds; zero or negative durations become 0. */
    public static int secondsRoundedUp(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            return 0;
        }
        long nanos = duration.toNanos();
        return (int) ((nanos + 999_999_999L) / 1_000_000_000L);
    }

    /** Seconds with nanosecond precision, for scale-factor arithmetic. */
    public static double preciseSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    static void checkIndex(int index) {
        if (index < 0 || index >= SLOTS_PER_DAY) {
            throw new IllegalArgumentException("slot index must be within 0..71, got: " + index);
        }
    }

    private boolean isBeforeDayStart(int index) {
        return index < dayStartHour * SLOTS_PER_HOUR;
    }
}
