package com.delta.harvester.harvest.retry;

import java.time.Duration;

/**
 * Blocking pause used for backoff and cooldown waits.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> {
            long millis = duration.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
