package org.iceforge.pruner.catalog;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, chronologically ordered set of backups found under one prefix.
 * <p>
 * Ordering is ascending by timestamp with ties broken by key, and keys are unique. Instances are only
 * created through {@link BackupCatalog#build} or {@link #of(List)}, which enforce both.
 */
public final class Catalog {

    private static final Catalog EMPTY = new Catalog(List.of());

    private final List<BackupRecord> records;

    private Catalog(List<BackupRecord> records) {
        this.records = records;
    }

    public static Catalog empty() {
        return EMPTY;
    }

    /**
     * Builds a catalog from records that already carry timestamps.
     *
     * @throws DuplicateKeyException if two records share a key
     */
    public static Catalog of(List<BackupRecord> records) {
        Set<String> seen = new HashSet<>();
        for (BackupRecord r : records) {
            if (!seen.add(r.key())) {
                throw new DuplicateKeyException(r.key());
            }
        }
        return new Catalog(records.stream().sorted(BackupRecord.CHRONOLOGICAL).toList());
    }

    public List<BackupRecord> records() {
        return records;
    }

    /** Keys in catalog order. */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        for (BackupRecord r : records) {
            keys.add(r.key());
        }
        return Collections.unmodifiableSet(keys);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public String toString() {
        if (records.isEmpty()) {
            return "Catalog[empty]";
        }
        return "Catalog[size=" + records.size()
                + ", oldest=" + records.get(0).timestamp()
                + ", newest=" + records.get(records.size() - 1).timestamp() + "]";
    }
}
