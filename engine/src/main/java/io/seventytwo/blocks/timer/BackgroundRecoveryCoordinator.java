package io.seventytwo.blocks.timer;

import io.seventytwo.blocks.api.LifecycleSignal;
import io.seventytwo.blocks.api.RunSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Keeps the engine correct across host suspension and process loss. Nothing is counted while the
 * host is away; on return the session is re-derived from its absolute deadlines, so the length of the
 * gap does not matter.
 */
public final class BackgroundRecoveryCoordinator implements LifecycleSignal {
    private static final Logger logger = LogManager.getLogger(BackgroundRecoveryCoordinator.class);

    private final TimerStateMachine engine;
    private boolean suspended;

    public BackgroundRecoveryCoordinator(TimerStateMachine engine) {
        this.engine = engine;
    }

    /** Publishes a snapshot right away and stops the local tick and snapshot cadence. */
    @Override
    public synchronized void onSuspend() {
        if (suspended) {
            logger.debug("Already suspended");
            return;
        }
        suspended = true;
        engine.suspend();
        logger.debug("Host suspended");
    }

    /**
     * A running session whose boundary passed meanwhile completes with full credit; otherwise the
     * cadence restarts and an overdue break reminder fires at once. A paused session whose boundary
     * passed enters paused expiry.
     */
    @Override
    public synchronized void onResume() {
        suspended = false;
        engine.reconcile();
        logger.debug("Host resumed");
    }

    /**
     * Rebuilds the session described by {@code snapshot} after the process was lost. The engine must
     * be idle.
     *
     * @return false if the engine was busy or the snapshot is unusable
     */
    public synchronized boolean recover(RunSnapshot snapshot) {
        try {
            return engine.restore(snapshot);
        } catch (IllegalStateException | IllegalArgumentException e) {
            logger.error(
                    "Discarding unusable snapshot of run {} on slot {}", snapshot.runId(), snapshot.blockIndex(), e);
            return false;
        }
    }

    public synchronized boolean isSuspended() {
        return suspended;
    }
}
