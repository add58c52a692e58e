package org.iceforge.pruner.strategy;

import java.time.Duration;
import java.time.Instant;

/**
 * Age of a backup relative to the policy thresholds. A backup exactly {@code keepAllWithin} old is THINNING,
 * one exactly {@code onePerMonthWithin} old is EXPIRED; backups dated after "now" are RECENT.
 */
enum AgeBand {
    RECENT,
    THINNING,
    EXPIRED;

    static AgeBand of(Instant timestamp, Instant now, Duration keepAllWithin, Duration onePerMonthWithin) {
        Duration age = Duration.between(timestamp, now);
        if (age.compareTo(keepAllWithin) < 0) {
            return RECENT;
        }
        if (age.compareTo(onePerMonthWithin) < 0) {
            return THINNING;
        }
        return EXPIRED;
    }
}
