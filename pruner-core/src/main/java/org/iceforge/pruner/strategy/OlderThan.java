package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.BackupRecord;
import org.iceforge.pruner.catalog.Catalog;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deletes every backup at least {@code keepAllWithin} old.
 */
public final class OlderThan implements RetentionStrategy {

    public static final String NAME = "older-than";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetentionDecision decide(Catalog catalog, Instant now, PolicyParams params) {
        Objects.requireNonNull(params, "params");
        Duration maxAge = params.requireKeepAllWithin();

        List<String> delete = new ArrayList<>();
        for (BackupRecord r : catalog.records()) {
            if (Duration.between(r.timestamp(), now).compareTo(maxAge) >= 0) {
                delete.add(r.key());
            }
        }
        return RetentionDecision.deleting(catalog, delete).checkPartitionOf(catalog);
    }
}
