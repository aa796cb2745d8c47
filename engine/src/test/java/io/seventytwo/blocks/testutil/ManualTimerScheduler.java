package io.seventytwo.blocks.testutil;

import io.seventytwo.blocks.timer.TimerScheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Runs scheduled callbacks in virtual time. {@link #advance} moves the clock forward one due callback
 * at a time; {@link #jump} moves it without running anything, like a suspended host.
 */
public final class ManualTimerScheduler implements TimerScheduler {
    private final ManualClock clock;
    private final List<Entry> entries = new ArrayList<>();
    private long order;

    public ManualTimerScheduler(ManualClock clock) {
        this.clock = clock;
    }

    private final class Entry implements Handle {
        final Runnable task;
        final @Nullable Duration period;
        final long seq = order++;
        Instant next;
        boolean cancelled;

        Entry(Runnable task, Instant next, @Nullable Duration period) {
            this.task = task;
            this.next = next;
            this.period = period;
        }

        @Override
        public void cancel() {
            cancelled = true;
            entries.remove(this);
        }
    }

    @Override
    public Handle scheduleAtFixedRate(Runnable task, Duration period) {
        var entry = new Entry(task, clock.instant().plus(period), period);
        entries.add(entry);
        return entry;
    }

    @Override
    public Handle scheduleAt(Runnable task, Instant at) {
        var entry = new Entry(task, at, null);
        entries.add(entry);
        return entry;
    }

    /** Moves time forward by {@code duration}, running every callback that falls due on the way. */
    public void advance(Duration duration) {
        var target = clock.instant().plus(duration);
        while (true) {
            var due = entries.stream()
                    .filter(e -> !e.next.isAfter(target))
                    .min(Comparator.<Entry, Instant>comparing(e -> e.next).thenComparingLong(e -> e.seq));
            if (due.isEmpty()) {
                break;
            }
            var entry = due.get();
            if (entry.next.isAfter(clock.instant())) {
                clock.set(entry.next);
            }
            if (entry.period == null) {
                entries.remove(entry);
            } else {
                entry.next = entry.next.plus(entry.period);
            }
            entry.task.run();
        }
        clock.set(target);
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    /** Runs whatever is already due without moving the clock. */
    public void runDue() {
        advance(Duration.ZERO);
    }

    /** Moves the clock without running callbacks. */
    public void jump(Duration duration) {
        clock.advance(duration);
    }

    public int activePeriodicCount() {
        return (int) entries.stream().filter(e -> e.period != null).count();
    }

    public int activeOneShotCount() {
        return (int) entries.stream().filter(e -> e.period == null).count();
    }
}
