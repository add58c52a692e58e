package org.iceforge.pruner.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * One raw entry of a store listing.
 *
 * @param key          full object key, unique within the bucket
 * @param lastModified store-native modification time, {@code null} when the store did not report one
 * @param size         object size in bytes
 * @param eTag         store entity tag, may be {@code null}
 */
public record StoredObject(
        String key,
        Instant lastModified,
        long size,
        String eTag
) {
    public StoredObject {
        Objects.requireNonNull(key, "key");
    }

    public static StoredObject of(String key, Instant lastModified) {
        return new StoredObject(key, lastModified, 0L, null);
    }
}
