package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.Catalog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the {@code keepLast} newest backups regardless of age.
 */
public final class KeepLastN implements RetentionStrategy {

    public static final String NAME = "keep-last";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetentionDecision decide(Catalog catalog, Instant now, PolicyParams params) {
        Objects.requireNonNull(params, "params");
        if (params.keepLast() < 1) {
            throw new InvalidPolicyException("keepLast must be >= 1, was " + params.keepLast());
        }
        int expendable = Math.max(0, catalog.size() - params.keepLast());
        List<String> delete = new ArrayList<>(expendable);
        for (int i = 0; i < expendable; i++) {
            delete.add(catalog.records().get(i).key());
        }
        return RetentionDecision.deleting(catalog, delete).checkPartitionOf(catalog);
    }
}
