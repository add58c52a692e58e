package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.Catalog;

import java.time.Instant;

/**
 * Decides which backups of a catalog survive. Implementations are pure: same catalog, instant and
 * parameters give the same decision, and nothing outside the arguments is read.
 */
public interface RetentionStrategy {

    /** Stable name used in configuration and logs. */
    String name();

    /**
     * @throws InvalidPolicyException if {@code params} do not suit this strategy
     */
    RetentionDecision decide(Catalog catalog, Instant now, PolicyParams params);
}
