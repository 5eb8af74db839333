package de.bsommerfeld.replyradar.core.util;

import java.time.Duration;

/**
 * Every pause of a run (quota back-off, inter-chunk pacing) goes through
 * this seam so tests can run without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks for the given duration. An interrupt ends the pause early and
     * leaves the thread's interrupt flag set.
     */
    void sleep(Duration duration);

    static Sleeper system() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    static Sleeper noop() {
        return duration -> {
        };
    }
}
