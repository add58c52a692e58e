package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.Catalog;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.iceforge.pruner.testutil.Backups.backup;
import static org.iceforge.pruner.testutil.Backups.catalog;
import static org.iceforge.pruner.testutil.Backups.utc;
import static org.junit.jupiter.api.Assertions.*;

class RetainExpiredThinningTest {

    private final RetainExpiredThinning strategy = new RetainExpiredThinning();

    @Test
    void thinsMiddleBand_butLeavesExpiredBackupsAlone() {
        Instant now = utc(2024, 6, 30);
        Catalog catalog = catalog(
                backup("ancient-1", utc(2020, 1, 1)),
                backup("ancient-2", utc(2020, 1, 2)),
                backup("may-01", utc(2024, 5, 1)),
                backup("may-15", utc(2024, 5, 15)),
                backup("jun-29", utc(2024, 6, 29))
        );

        RetentionDecision decision = strategy.decide(catalog, now, PolicyParams.ofDays(7, 180));

        assertThat(decision.keep()).containsExactly("ancient-1", "ancient-2", "may-01", "jun-29");
        assertThat(decision.delete()).containsExactly("may-15");
    }

    @Test
    void differsFromFlagshipOnlyInTheExpiredBand() {
        Instant now = utc(2024, 6, 30);
        Catalog catalog = catalog(
                backup("old", utc(2023, 1, 1)),
                backup("mid-a", utc(2024, 3, 2)),
                backup("mid-b", utc(2024, 3, 9))
        );
        PolicyParams params = PolicyParams.ofDays(7, 180);

        RetentionDecision floor = strategy.decide(catalog, now, params);
        RetentionDecision flagship = new OlderThanButKeepOnePerMonth().decide(catalog, now, params);

        assertThat(floor.delete()).containsExactly("mid-b");
        assertThat(flagship.delete()).containsExactly("old", "mid-b");
    }

    @Test
    void invalidBands_areRejected() {
        assertThrows(InvalidPolicyException.class,
                () -> strategy.decide(Catalog.empty(), utc(2024, 1, 1), PolicyParams.ofDays(10, 3)));
    }
}
