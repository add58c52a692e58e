package org.iceforge.pruner.catalog;

import org.iceforge.pruner.PruneException;

/**
 * A listed object does not follow the expected naming/metadata convention, so no timestamp can be derived.
 */
public class MalformedEntryException extends PruneException {
    private final String key;

    public MalformedEntryException(String key, String reason) {
        super("Malformed backup entry '" + key + "': " + reason);
        this.key = key;
    }

    public MalformedEntryException(String key, String reason, Throwable cause) {
        super("Malformed backup entry '" + key + "': " + reason, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
