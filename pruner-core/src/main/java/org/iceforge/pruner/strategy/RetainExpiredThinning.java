package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.Catalog;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Same bands as {@link OlderThanButKeepOnePerMonth}, but backups older than {@code onePerMonthWithin}
 * are left untouched instead of deleted. Only the thinning band loses backups.
 */
public final class RetainExpiredThinning implements RetentionStrategy {

    public static final String NAME = "retain-expired-thinning";

    private final ZoneId zone;

    public RetainExpiredThinning() {
        this(ZoneOffset.UTC);
    }

    public RetainExpiredThinning(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetentionDecision decide(Catalog catalog, Instant now, PolicyParams params) {
        Objects.requireNonNull(params, "params");
        params.requireOrderedBands();
        if (catalog.isEmpty()) {
            return RetentionDecision.empty();
        }
        return RetentionDecision.deleting(catalog, MonthlyThinning.expendable(catalog, now, params, zone, false))
                .checkPartitionOf(catalog);
    }
}
