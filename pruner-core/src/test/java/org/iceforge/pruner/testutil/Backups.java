package org.iceforge.pruner.testutil;

import org.iceforge.pruner.catalog.BackupRecord;
import org.iceforge.pruner.catalog.Catalog;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for building catalogs in tests.
 */
public final class Backups {

    private Backups() {}

    public static Instant utc(int year, int month, int day) {
        return utc(year, month, day, 0, 0, 0);
    }

    public static Instant utc(int year, int month, int day, int hour, int minute, int second) {
        return LocalDateTime.of(year, month, day, hour, minute, second).toInstant(ZoneOffset.UTC);
    }

    public static BackupRecord backup(String key, Instant timestamp) {
        return new BackupRecord(key, timestamp);
    }

    public static Catalog catalog(BackupRecord... records) {
        return Catalog.of(List.of(records));
    }

    /** One backup per day, newest first: {@code day-0} taken at {@code newest}, {@code day-1} a day before, ... */
    public static Catalog daily(Instant newest, int days) {
        List<BackupRecord> records = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            records.add(new BackupRecord("day-" + i, newest.minus(Duration.ofDays(i))));
        }
        return Catalog.of(records);
    }
}
