package io.seventytwo.blocks.timer;

import org.jetbrains.annotations.Nullable;

/** Category and label that work time is attributed to. */
public record WorkContext(@Nullable String category, @Nullable String label) {
    public static final WorkContext NONE = new WorkContext(null, null);
}
