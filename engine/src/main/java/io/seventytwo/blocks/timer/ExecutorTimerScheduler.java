package io.seventytwo.blocks.timer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link TimerScheduler} backed by a single daemon thread. One-shot deadlines are converted to delays
 * against the injected clock when scheduled; callers re-derive state from absolute instants when they
 * run, so a late callback is harmless.
 */
public final class ExecutorTimerScheduler implements TimerScheduler {
    private static final Logger logger = LogManager.getLogger(ExecutorTimerScheduler.class);

    private final Clock clock;
    private final ScheduledExecutorService executor;

    public ExecutorTimerScheduler(Clock clock) {
        this(clock, "BlockTimer-Scheduler");
    }

    public ExecutorTimerScheduler(Clock clock, String threadName) {
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Handle scheduleAtFixedRate(Runnable task, Duration period) {
        long millis = Math.max(1, period.toMillis());
        ScheduledFuture<?> future =
                executor.scheduleAtFixedRate(guarded(task), millis, millis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public Handle scheduleAt(Runnable task, Instant at) {
        long delay = Math.max(0, Duration.between(clock.instant(), at).toMillis());
        ScheduledFuture<?> future = executor.schedule(guarded(task), delay, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        logger.debug("Timer scheduler shut down");
    }

    // a periodic task that throws is silently cancelled by the executor
    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Scheduled timer task failed", e);
            }
        };
    }
}
