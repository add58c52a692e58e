package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.Catalog;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Keeps everything younger than {@code keepAllWithin}; between {@code keepAllWithin} and
 * {@code onePerMonthWithin} keeps the earliest backup of each calendar month; deletes everything older.
 * <p>
 * Months are taken from each backup's own timestamp in {@code zone}, so the representative of a month
 * does not depend on when the policy runs and a second run finds nothing more to delete.
 */
public final class OlderThanButKeepOnePerMonth implements RetentionStrategy {

    public static final String NAME = "older-than-but-keep-one-per-month";

    private final ZoneId zone;

    public OlderThanButKeepOnePerMonth() {
        this(ZoneOffset.UTC);
    }

    public OlderThanButKeepOnePerMonth(ZoneId zone) {
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
        return RetentionDecision.deleting(catalog, MonthlyThinning.expendable(catalog, now, params, zone, true))
                .checkPartitionOf(catalog);
    }
}
