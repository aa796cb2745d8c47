package io.seventytwo.blocks.api;

import java.time.Instant;

/**
 * Schedules user-visible notifications. Calls are fire-and-forget; implementations should not block.
 */
public interface NotificationScheduler {

    /** Announce that the slot ends at {@code at}. Replaces any earlier completion notice for the slot. */
    void scheduleCompletion(Instant at, int blockIndex, boolean isBreak);

    /** Mid-slot reminder that a break has run for its allotted time. */
    default void scheduleBreakReminder(Instant at, int blockIndex) {}

    /** Drop every pending notification for the slot. */
    void cancel(int blockIndex);

    NotificationScheduler NONE = new NotificationScheduler() {
        @Override
        public void scheduleCompletion(Instant at, int blockIndex, boolean isBreak) {}

        @Override
        public void cancel(int blockIndex) {}
    };
}
