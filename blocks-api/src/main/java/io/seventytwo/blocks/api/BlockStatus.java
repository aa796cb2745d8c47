package io.seventytwo.blocks.api;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle of a persisted block. */
public enum BlockStatus {
    /** Nothing planned or recorded. */
    IDLE,
    /** Planned, or a session has started writing to it. */
    PLANNED,
    /** Finished with real usage. */
    DONE,
    /** Passed without usage. */
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isSettled() {
        return this == DONE || this == SKIPPED;
    }
}
