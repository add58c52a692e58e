package org.iceforge.pruner.storage;

/**
 * Narrow view of an object store: paginated listing under a prefix and deletion by key.
 * <br>
 * Implementations translate vendor errors into {@link TransientStorageException} or
 * {@link PermanentStorageException}; nothing vendor-specific (tokens, throttling, auth) leaks past this interface.
 * The bucket (or root directory) is fixed when the adapter is created.
 */
public interface StorageAdapter {

    /**
     * Lists one page of objects whose key starts with {@code prefix}.
     *
     * @param prefix            key prefix, empty for the whole bucket
     * @param continuationToken token returned by the previous page, {@code null} for the first page
     */
    ListPage list(String prefix, String continuationToken);

    /**
     * Deletes one object. Deleting a key that no longer exists is not an error.
     */
    DeleteStatus delete(String key);

    /** Short description for logs, e.g. {@code s3://bucket}. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
