package org.iceforge.pruner.config;

import org.iceforge.pruner.storage.StorageAdapter;

/**
 * Opens the store a run works on. Chosen by {@code pruner.store}.
 */
@FunctionalInterface
public interface StorageAdapterFactory {

    /**
     * @param bucket bucket (or local directory) holding the backups
     * @param region region override, {@code null} to use the configured one
     */
    StorageAdapter open(String bucket, String region);
}
