package org.iceforge.pruner.catalog;

import org.iceforge.pruner.storage.StoredObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.iceforge.pruner.testutil.Backups.utc;
import static org.junit.jupiter.api.Assertions.*;

class BackupCatalogTest {

    private final BackupCatalog byLastModified = new BackupCatalog(TimestampRule.lastModified());

    @Test
    void build_sortsByTimestampThenKey() {
        Instant t1 = utc(2024, 1, 1);
        Instant t2 = utc(2024, 2, 1);

        Catalog catalog = byLastModified.build(List.of(
                StoredObject.of("c", t2),
                StoredObject.of("b", t1),
                StoredObject.of("a", t2)
        ));

        assertEquals(List.of("b", "a", "c"), List.copyOf(catalog.keys()));
        assertEquals(t1, catalog.records().get(0).timestamp());
    }

    @Test
    void build_emptyListing_returnsEmptyCatalog() {
        Catalog catalog = byLastModified.build(List.of());

        assertTrue(catalog.isEmpty());
        assertEquals(0, catalog.size());
    }

    @Test
    void build_duplicateKey_throws() {
        List<StoredObject> listing = List.of(
                StoredObject.of("a", utc(2024, 1, 1)),
                StoredObject.of("a", utc(2024, 1, 2))
        );

        DuplicateKeyException ex = assertThrows(DuplicateKeyException.class, () -> byLastModified.build(listing));

        assertEquals("a", ex.key());
    }

    @Test
    void build_missingLastModified_isMalformed() {
        List<StoredObject> listing = List.of(new StoredObject("no-date", null, 10L, "etag"));

        MalformedEntryException ex = assertThrows(MalformedEntryException.class, () -> byLastModified.build(listing));

        assertEquals("no-date", ex.key());
        assertTrue(ex.getMessage().contains("last-modified"));
    }

    @Test
    void build_blankKey_isMalformed() {
        List<StoredObject> listing = List.of(StoredObject.of(" ", utc(2024, 1, 1)));

        assertThrows(MalformedEntryException.class, () -> byLastModified.build(listing));
    }

    @Test
    void build_keyPatternRule_ignoresStoreMetadata() {
        BackupCatalog byKey = new BackupCatalog(new KeyPatternTimestampRule(
                "db-(?<ts>\\d{8}-\\d{6})\\.sql\\.gz", "yyyyMMdd-HHmmss", ZoneOffset.UTC));
        Instant uploadedLater = utc(2030, 1, 1);

        Catalog catalog = byKey.build(List.of(
                StoredObject.of("backups/db-20240301-120000.sql.gz", uploadedLater),
                StoredObject.of("backups/db-20240215-000000.sql.gz", uploadedLater)
        ));

        assertEquals(List.of("backups/db-20240215-000000.sql.gz", "backups/db-20240301-120000.sql.gz"),
                List.copyOf(catalog.keys()));
        assertEquals(utc(2024, 3, 1, 12, 0, 0), catalog.records().get(1).timestamp());
    }

    @Test
    void build_keyPatternRule_rejectsKeysOutsideConvention() {
        BackupCatalog byKey = new BackupCatalog(new KeyPatternTimestampRule(
                "db-(?<ts>\\d{8})\\.dump", "yyyyMMdd", ZoneOffset.UTC));

        List<StoredObject> listing = List.of(
                StoredObject.of("db-20240101.dump", utc(2024, 1, 1)),
                StoredObject.of("README.txt", utc(2024, 1, 1))
        );

        MalformedEntryException ex = assertThrows(MalformedEntryException.class, () -> byKey.build(listing));
        assertEquals("README.txt", ex.key());
    }

    @Test
    void build_firstOf_fallsBackToLastModified() {
        TimestampRule rule = TimestampRule.firstOf(
                new KeyPatternTimestampRule("db-(?<ts>\\d{8})\\.dump", "yyyyMMdd", ZoneOffset.UTC),
                TimestampRule.lastModified());
        BackupCatalog catalog = new BackupCatalog(rule);

        Catalog built = catalog.build(List.of(
                StoredObject.of("db-20240105.dump", utc(2024, 6, 1)),
                StoredObject.of("manual-copy.dump", utc(2024, 1, 3))
        ));

        assertEquals(List.of("manual-copy.dump", "db-20240105.dump"), List.copyOf(built.keys()));
        assertTrue(rule.describe().contains(" or "));
    }

    @Test
    void catalogOf_rejectsDuplicates() {
        List<BackupRecord> records = List.of(
                new BackupRecord("x", utc(2024, 1, 1)),
                new BackupRecord("x", utc(2024, 1, 1))
        );

        assertThrows(DuplicateKeyException.class, () -> Catalog.of(records));
    }
}
