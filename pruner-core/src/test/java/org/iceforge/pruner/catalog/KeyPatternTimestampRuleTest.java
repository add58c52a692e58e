package org.iceforge.pruner.catalog;

import org.iceforge.pruner.storage.StoredObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.iceforge.pruner.testutil.Backups.utc;
import static org.junit.jupiter.api.Assertions.*;

class KeyPatternTimestampRuleTest {

    @Test
    void dateOnlyFormat_isStartOfDayInZone() {
        KeyPatternTimestampRule rule = new KeyPatternTimestampRule(
                "nightly-(?<ts>\\d{4}-\\d{2}-\\d{2})", "yyyy-MM-dd", ZoneId.of("Europe/Berlin"));

        Optional<Instant> ts = rule.timestampOf(StoredObject.of("nightly-2024-07-01.tar", null));

        // midnight in Berlin (CEST, +02:00) is 22:00 UTC the day before
        assertEquals(Optional.of(utc(2024, 6, 30, 22, 0, 0)), ts);
    }

    @Test
    void offsetInKey_wins_overZone() {
        KeyPatternTimestampRule rule = new KeyPatternTimestampRule(
                "incident-(?<ts>\\d{8}-\\d{6}[+-]\\d{4})", "yyyyMMdd-HHmmssZ", ZoneId.of("Asia/Tokyo"));

        Optional<Instant> ts = rule.timestampOf(StoredObject.of("incident-20260111-010000+0000.zip", null));

        assertEquals(Optional.of(utc(2026, 1, 11, 1, 0, 0)), ts);
    }

    @Test
    void unparsableDate_isEmpty() {
        KeyPatternTimestampRule rule = new KeyPatternTimestampRule(
                "db-(?<ts>\\d{8})", "yyyyMMdd", ZoneOffset.UTC);

        assertTrue(rule.timestampOf(StoredObject.of("db-20241340", null)).isEmpty());
        assertTrue(rule.timestampOf(StoredObject.of("other", null)).isEmpty());
    }

    @Test
    void patternWithoutNamedGroup_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new KeyPatternTimestampRule("db-(\\d{8})", "yyyyMMdd", ZoneOffset.UTC));
    }

    @Test
    void formatWithoutFullDate_isRejected() {
        IllegalArgumentException monthOnly = assertThrows(IllegalArgumentException.class,
                () -> new KeyPatternTimestampRule("m-(?<ts>\\d{6})", "yyyyMM", ZoneOffset.UTC));
        assertTrue(monthOnly.getMessage().contains("yyyyMM"));

        assertThrows(IllegalArgumentException.class,
                () -> new KeyPatternTimestampRule("t-(?<ts>\\d{6})", "HHmmss", ZoneOffset.UTC));
    }

    @Test
    void undatableKey_fallsBackToLastModified() {
        Instant modified = utc(2024, 3, 5);
        BackupCatalog catalog = new BackupCatalog(TimestampRule.firstOf(
                new KeyPatternTimestampRule("db-(?<ts>\\d{8})", "yyyyMMdd", ZoneOffset.UTC),
                TimestampRule.lastModified()));

        Catalog built = catalog.build(List.of(
                StoredObject.of("db-20241340.gz", modified),
                StoredObject.of("db-20240101.gz", modified)));

        assertEquals(List.of("db-20240101.gz", "db-20241340.gz"), List.copyOf(built.keys()));
        assertEquals(utc(2024, 1, 1), built.records().get(0).timestamp());
        assertEquals(modified, built.records().get(1).timestamp());
    }
}
