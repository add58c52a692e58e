package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.BackupRecord;
import org.iceforge.pruner.catalog.Catalog;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps, for every month, the backup nearest to the 1st of that month, provided it lies within
 * {@code onePerMonthTolerance} of it. Applies to the whole catalog, without age bands.
 * <p>
 * Months are walked from the month of the oldest backup to the month after the newest one. A backup chosen
 * for one month is never reused for the next, so a backup on the 31st that already anchors its own month
 * cannot also anchor the following one. Equidistant candidates resolve to the earlier backup.
 */
public final class KeepOnePerMonth implements RetentionStrategy {

    public static final String NAME = "keep-one-per-month";

    private final ZoneId zone;

    public KeepOnePerMonth() {
        this(ZoneOffset.UTC);
    }

    public KeepOnePerMonth(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetentionDecision decide(Catalog catalog, Instant now, PolicyParams params) {
        Objects.requireNonNull(params, "params");
        Duration tolerance = params.requireTolerance();
        if (catalog.isEmpty()) {
            return RetentionDecision.empty();
        }

        List<BackupRecord> records = catalog.records();
        ZonedDateTime monthStart = startOfMonth(records.get(0).timestamp());
        ZonedDateTime lastMonthStart = startOfMonth(records.get(records.size() - 1).timestamp()).plusMonths(1);

        Set<String> keep = new HashSet<>();
        int from = 0;
        while (!monthStart.isAfter(lastMonthStart)) {
            int chosen = nearestWithin(records, from, monthStart.toInstant(), tolerance);
            if (chosen >= 0) {
                keep.add(records.get(chosen).key());
                from = chosen + 1;
            }
            monthStart = monthStart.plusMonths(1);
        }

        List<String> delete = records.stream()
                .map(BackupRecord::key)
                .filter(key -> !keep.contains(key))
                .toList();
        return RetentionDecision.deleting(catalog, delete).checkPartitionOf(catalog);
    }

    /**
     * Index of the record nearest to {@code anchor} among {@code records[from..]} within
     * {@code anchor ± tolerance}, or -1 when none qualifies.
     */
    private static int nearestWithin(List<BackupRecord> records, int from, Instant anchor, Duration tolerance) {
        Instant earliest = anchor.minus(tolerance);
        Instant latest = anchor.plus(tolerance);

        int nearest = -1;
        for (int i = from; i < records.size(); i++) {
            Instant ts = records.get(i).timestamp();
            if (ts.isBefore(earliest)) {
                continue;
            }
            if (ts.isAfter(latest)) {
                break;
            }
            if (nearest >= 0 && !isCloser(anchor, ts, records.get(nearest).timestamp())) {
                // records are ascending, so distances only grow from here on
                break;
            }
            nearest = i;
        }
        return nearest;
    }

    private static boolean isCloser(Instant anchor, Instant a, Instant b) {
        return Duration.between(anchor, a).abs().compareTo(Duration.between(anchor, b).abs()) < 0;
    }

    private ZonedDateTime startOfMonth(Instant instant) {
        LocalDate date = instant.atZone(zone).toLocalDate().withDayOfMonth(1);
        return date.atStartOfDay(zone);
    }
}
