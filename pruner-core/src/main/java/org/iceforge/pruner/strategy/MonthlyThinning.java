package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.BackupRecord;
import org.iceforge.pruner.catalog.Catalog;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Band-based thinning shared by {@link OlderThanButKeepOnePerMonth} and {@link RetainExpiredThinning}.
 */
final class MonthlyThinning {

    private MonthlyThinning() {}

    /**
     * Keys to delete: the non-representatives of the thinning band, plus the expired band when
     * {@code deleteExpired} is set. The representative of a month is its earliest backup.
     */
    static Set<String> expendable(Catalog catalog, Instant now, PolicyParams params, ZoneId zone,
                                  boolean deleteExpired) {
        params.requireOrderedBands();

        Set<YearMonth> represented = new HashSet<>();
        Set<String> delete = new LinkedHashSet<>();
        // catalog order is ascending, so the first record seen for a month is its earliest
        for (BackupRecord r : catalog.records()) {
            AgeBand band = AgeBand.of(r.timestamp(), now, params.keepAllWithin(), params.onePerMonthWithin());
            switch (band) {
                case RECENT -> { }
                case THINNING -> {
                    if (!represented.add(YearMonth.from(r.timestamp().atZone(zone)))) {
                        delete.add(r.key());
                    }
                }
                case EXPIRED -> {
                    if (deleteExpired) {
                        delete.add(r.key());
                    }
                }
            }
        }
        return delete;
    }
}
