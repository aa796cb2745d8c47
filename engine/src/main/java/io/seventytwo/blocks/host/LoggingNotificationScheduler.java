package io.seventytwo.blocks.host;

import io.seventytwo.blocks.api.NotificationScheduler;
import io.seventytwo.blocks.calendar.BlockCalendar;
import io.seventytwo.blocks.timer.TimerScheduler;
import io.seventytwo.blocks.timer.TimerScheduler.Handle;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Headless notifications: each one is written to the log when it falls due. */
public class LoggingNotificationScheduler implements NotificationScheduler {
    private static final Logger logger = LogManager.getLogger(LoggingNotificationScheduler.class);

    private final TimerScheduler scheduler;
    private final BlockCalendar calendar;
    private final Map<Integer, List<Handle>> pending = new HashMap<>();

    public LoggingNotificationScheduler(TimerScheduler scheduler, BlockCalendar calendar) {
        this.scheduler = scheduler;
        this.calendar = calendar;
    }

    @Override
    public synchronized void scheduleCompletion(Instant at, int blockIndex, boolean isBreak) {
        var number = calendar.displayNumber(blockIndex);
        var message = isBreak ? "Break over: block " + number + " has ended" : "Block " + number + " complete";
        add(blockIndex, scheduler.scheduleAt(() -> logger.info(message), at));
    }

    @Override
    public synchronized void scheduleBreakReminder(Instant at, int blockIndex) {
        add(blockIndex, scheduler.scheduleAt(() -> logger.info("Break reminder: time to get back to work"), at));
    }

    @Override
    public synchronized void cancel(int blockIndex) {
        var handles = pending.remove(blockIndex);
        if (handles != null) {
            handles.forEach(Handle::cancel);
        }
    }

    synchronized int pendingCount(int blockIndex) {
        return pending.getOrDefault(blockIndex, List.of()).size();
    }

    private void add(int blockIndex, Handle handle) {
        pending.computeIfAbsent(blockIndex, k -> new ArrayList<>()).add(handle);
    }
}
