package org.iceforge.pruner.run;

import java.time.Duration;

/**
 * Abstracts waiting between retries so tests can run without real delays.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
