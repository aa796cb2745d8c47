package io.seventytwo.blocks.timer;

import io.seventytwo.blocks.api.SegmentKind;
import java.util.Objects;

/**
 * What the session is doing right now. Both variants carry the work context: while working it is the
 * context being recorded, during a break it is the context restored when work resumes.
 */
public sealed interface SessionMode permits SessionMode.Work, SessionMode.Break {

    WorkContext workContext();

    SegmentKind kind();

    /** Same variant, new work context. */
    SessionMode withWorkContext(WorkContext context);

    static SessionMode of(SegmentKind kind, WorkContext context) {
        return switch (kind) {
            case WORK -> new Work(context);
            case BREAK -> new Break(context);
        };
    }

    default boolean isBreak() {
        return kind() == SegmentKind.BREAK;
    }

    record Work(WorkContext workContext) implements SessionMode {
        public Work {
            Objects.requireNonNull(workContext, "workContext");
        }

        @Override
        public SegmentKind kind() {
            return SegmentKind.WORK;
        }

        @Override
        public SessionMode withWorkContext(WorkContext context) {
            return new Work(context);
        }
    }

    record Break(WorkContext workContext) implements SessionMode {
        public Break {
            Objects.requireNonNull(workContext, "workContext");
        }

        @Override
        public SegmentKind kind() {
            return SegmentKind.BREAK;
        }

        @Override
        public SessionMode withWorkContext(WorkContext context) {
            return new Break(context);
        }
    }
}
