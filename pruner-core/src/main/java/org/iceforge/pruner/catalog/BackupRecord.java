package org.iceforge.pruner.catalog;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A listed object accepted as a backup: its key plus the instant it was taken.
 */
public record BackupRecord(String key, Instant timestamp) {

    /** Ascending by timestamp, ties by key. */
    public static final Comparator<BackupRecord> CHRONOLOGICAL =
            Comparator.comparing(BackupRecord::timestamp).thenComparing(BackupRecord::key);

    public BackupRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
