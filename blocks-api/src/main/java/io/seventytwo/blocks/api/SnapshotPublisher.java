package io.seventytwo.blocks.api;

/** Best-effort mirror of the running session for widgets and other out-of-process views. */
@FunctionalInterface
public interface SnapshotPublisher {
    void publish(RunSnapshot snapshot);

    SnapshotPublisher NONE = snapshot -> {};
}
