package io.seventytwo.blocks.timer;

import java.time.Duration;
import java.time.Instant;

/** Host-provided callbacks that drive the engine. */
public interface TimerScheduler extends AutoCloseable {

    /** Runs {@code task} every {@code period}, first after one period. */
    Handle scheduleAtFixedRate(Runnable task, Duration period);

    /** Runs {@code task} once at the absolute instant {@code at}, or as soon as possible if it has passed. */
    Handle scheduleAt(Runnable task, Instant at);

    @Override
    default void close() {}

    interface Handle {
        void cancel();
    }
}
