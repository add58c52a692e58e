package org.iceforge.pruner.strategy;

import org.iceforge.pruner.catalog.Catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable keep/delete partition of a catalog's keys. Both sides preserve catalog order.
 */
public final class RetentionDecision {

    private static final RetentionDecision EMPTY = new RetentionDecision(Set.of(), Set.of());

    private final Set<String> keep;
    private final Set<String> delete;

    private RetentionDecision(Set<String> keep, Set<String> delete) {
        this.keep = keep;
        this.delete = delete;
    }

    public static RetentionDecision empty() {
        return EMPTY;
    }

    /**
     * Every catalog key in {@code toDelete} is deleted, every other catalog key is kept.
     * Keys in {@code toDelete} that are not in the catalog are ignored.
     */
    public static RetentionDecision deleting(Catalog catalog, Collection<String> toDelete) {
        if (catalog.isEmpty()) {
            return EMPTY;
        }
        Set<String> deleteLookup = new HashSet<>(toDelete);
        Set<String> keep = new LinkedHashSet<>();
        Set<String> delete = new LinkedHashSet<>();
        for (String key : catalog.keys()) {
            if (deleteLookup.contains(key)) {
                delete.add(key);
            } else {
                keep.add(key);
            }
        }
        return new RetentionDecision(Collections.unmodifiableSet(keep), Collections.unmodifiableSet(delete));
    }

    public static RetentionDecision keepingAll(Catalog catalog) {
        return deleting(catalog, Set.of());
    }

    public Set<String> keep() {
        return keep;
    }

    public Set<String> delete() {
        return delete;
    }

    public boolean deletesNothing() {
        return delete.isEmpty();
    }

    /**
     * Verifies that keep and delete are disjoint and together cover exactly the catalog's keys.
     *
     * @throws IllegalStateException if the partition law does not hold
     */
    public RetentionDecision checkPartitionOf(Catalog catalog) {
        Set<String> all = catalog.keys();
        for (String key : keep) {
            if (delete.contains(key)) {
                throw new IllegalStateException("Key both kept and deleted: " + key);
            }
        }
        if (keep.size() + delete.size() != all.size() || !all.containsAll(keep) || !all.containsAll(delete)) {
            throw new IllegalStateException("Decision does not partition the catalog: catalog=" + all.size()
                    + " keep=" + keep.size() + " delete=" + delete.size());
        }
        return this;
    }

    @Override
    public String toString() {
        return "RetentionDecision[keep=" + keep.size() + ", delete=" + delete.size() + "]";
    }
}
