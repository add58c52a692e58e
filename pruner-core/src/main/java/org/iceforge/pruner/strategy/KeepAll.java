package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.Catalog;

import java.time.Instant;

/**
 * Deletes nothing. Useful as a dry baseline and for prefixes that must never be pruned.
 */
public final class KeepAll implements RetentionStrategy {

    public static final String NAME = "keep-all";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetentionDecision decide(Catalog catalog, Instant now, PolicyParams params) {
        return RetentionDecision.keepingAll(catalog);
    }
}
