package org.iceforge.pruner.catalog;

import org.iceforge.pruner.PruneException;

/**
 * The listing returned the same key twice within one catalog build, which the store contract forbids.
 */
public class DuplicateKeyException extends PruneException {
    private final String key;

    public DuplicateKeyException(String key) {
        super("Duplicate key in listing: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
