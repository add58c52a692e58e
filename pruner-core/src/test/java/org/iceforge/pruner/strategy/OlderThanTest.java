package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.Catalog;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.iceforge.pruner.testutil.Backups.backup;
import static org.iceforge.pruner.testutil.Backups.catalog;
import static org.iceforge.pruner.testutil.Backups.utc;
import static org.junit.jupiter.api.Assertions.*;

class OlderThanTest {

    private final OlderThan strategy = new OlderThan();

    @Test
    void deletesEverythingAtLeastKeepAllWithinOld() {
        Instant now = utc(2014, 6, 15);
        Catalog catalog = catalog(
                backup("future", utc(2015, 6, 15)),
                backup("now", now),
                backup("fresh", utc(2014, 6, 14, 0, 0, 1)),
                backup("exactly-one-day", utc(2014, 6, 14)),
                backup("older", utc(2014, 6, 13, 23, 59, 59))
        );

        RetentionDecision decision = strategy.decide(catalog, now, PolicyParams.ofDays(1, 1));

        assertThat(decision.keep()).containsExactly("fresh", "now", "future");
        assertThat(decision.delete()).containsExactly("older", "exactly-one-day");
    }

    @Test
    void ignoresOnePerMonthWithin() {
        Instant now = utc(2024, 1, 31);
        Catalog catalog = catalog(backup("a", utc(2024, 1, 1)));
        PolicyParams params = new PolicyParams(Duration.ofDays(10), null, null, 0);

        assertThat(strategy.decide(catalog, now, params).delete()).containsExactly("a");
    }

    @Test
    void missingKeepAllWithin_isInvalid() {
        assertThrows(InvalidPolicyException.class,
                () -> strategy.decide(Catalog.empty(), utc(2024, 1, 1), PolicyParams.keepLast(3)));
    }
}
