package io.seventytwo.blocks.calendar;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One 20-minute slot on one logical day. Derived on demand, never persisted.
 *
 * @param index slot index counted from local midnight, 0..71
 * @param date logical day the slot belongs to
 * @param start first instant of the slot
 * @param end first instant after the slot
 */
public record BlockSlot(int index, LocalDate date, Instant start, Instant end) {

    public BlockSlot {
        Objects.requireNonNull(date, "date");
        BlockCalendar.checkIndex(index);
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("slot end " + end + " must be after start " + start);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /** Time left until the slot boundary; zero once it has passed. */
    public Duration remaining(Instant now) {
        var remaining = Duration.between(now, end);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean hasEnded(Instant now) {
        return !now.isBefore(end);
    }
}
