package org.iceforge.pruner.catalog;

import org.iceforge.pruner.storage.StoredObject;

import java.time.Instant;
import java.util.Optional;

/**
 * Uses the store-native last-modified time.
 */
public final class LastModifiedTimestampRule implements TimestampRule {

    @Override
    public Optional<Instant> timestampOf(StoredObject object) {
        return Optional.ofNullable(object.lastModified());
    }

    @Override
    public String describe() {
        return "last-modified metadata";
    }
}
