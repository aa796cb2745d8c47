package io.seventytwo.blocks.timer;

/** Who asked for a continuation into the next slot. */
public enum ContinuationTrigger {
    /** The user chose to continue. Resets the check-in counter. */
    EXPLICIT,
    /** Continued without interaction, e.g. after the completion countdown ran out. Counts toward a check-in. */
    AUTOMATIC
}
