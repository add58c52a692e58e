package org.iceforge.pruner.catalog;

import org.iceforge.pruner.storage.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns raw listing entries into a {@link Catalog}. Pure: no store access, no clock.
 */
public final class BackupCatalog {
    private static final Logger logger = LoggerFactory.getLogger(BackupCatalog.class);

    private final TimestampRule timestampRule;

    public BackupCatalog(TimestampRule timestampRule) {
        this.timestampRule = Objects.requireNonNull(timestampRule, "timestampRule");
    }

    public TimestampRule timestampRule() {
        return timestampRule;
    }

    /**
     * @throws MalformedEntryException if an object cannot be dated
     * @throws DuplicateKeyException   if the same key was listed twice
     */
    public Catalog build(List<StoredObject> rawObjects) {
        Objects.requireNonNull(rawObjects, "rawObjects");
        if (rawObjects.isEmpty()) {
            return Catalog.empty();
        }

        Set<String> seen = new HashSet<>();
        List<BackupRecord> records = new ArrayList<>(rawObjects.size());
        for (StoredObject o : rawObjects) {
            if (o.key().isBlank()) {
                throw new MalformedEntryException(o.key(), "blank key");
            }
            if (!seen.add(o.key())) {
                throw new DuplicateKeyException(o.key());
            }
            Instant ts = timestampRule.timestampOf(o)
                    .orElseThrow(() -> new MalformedEntryException(o.key(),
                            "no timestamp derivable from " + timestampRule.describe()));
            records.add(new BackupRecord(o.key(), ts));
        }

        Catalog catalog = Catalog.of(records);
        logger.debug("Built {}", catalog);
        return catalog;
    }
}
