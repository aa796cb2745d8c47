package io.seventytwo.blocks.api;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Whether a stretch of time was spent working or on a break. */
public enum SegmentKind {
    WORK,
    BREAK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
