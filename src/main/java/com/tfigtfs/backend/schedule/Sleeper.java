package com.tfigtfs.backend.schedule;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait used by the background loops. Interruptible, so a loop can be
 * shut down while it sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        TimeUnit.MILLISECONDS.sleep(duration.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;
}
