package io.seventytwo.blocks.checkin;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Counts consecutive continuations into the next slot that happened without any user interaction.
 * Once the count reaches the threshold, automatic continuation stops until the user checks in.
 */
public final class CheckInCounter {
    private static final Logger logger = LogManager.getLogger(CheckInCounter.class);

    public static final int DEFAULT_THRESHOLD = 3;
    public static final int MAX_THRESHOLD = 12;

    private final int threshold;
    private int consecutiveAutoContinuations;

    public CheckInCounter() {
        this(DEFAULT_THRESHOLD);
    }

    public CheckInCounter(int threshold) {
        if (threshold < 1 || threshold > MAX_THRESHOLD) {
            throw new IllegalArgumentException(
                    "threshold must be within 1.." + MAX_THRESHOLD + ", got: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * Records an automatic continuation if the gate allows it.
     *
     * @return false if a check-in is required first; the count is left unchanged
     */
    public boolean tryAutoContinue() {
        if (isCheckInRequired()) {
            logger.info(
                    "Automatic continuation refused after {} consecutive continuations", consecutiveAutoContinuations);
            return false;
        }
        consecutiveAutoContinuations++;
        logger.debug("Automatic continuation {}/{}", consecutiveAutoContinuations, threshold);
        return true;
    }

    /** Any explicit user action: continue, take a break, stop, dismiss, or acknowledging a check-in. */
    public void recordExplicitAction() {
        if (consecutiveAutoContinuations > 0) {
            logger.debug("Check-in counter reset from {}", consecutiveAutoContinuations);
        }
        consecutiveAutoContinuations = 0;
    }

    public boolean isCheckInRequired() {
        return consecutiveAutoContinuations >= threshold;
    }

    public int consecutiveAutoContinuations() {
        return consecutiveAutoContinuations;
    }

    public int threshold() {
        return threshold;
    }
}
