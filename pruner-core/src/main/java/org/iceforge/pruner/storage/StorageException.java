package org.iceforge.pruner.storage;

/**
 * Failure reported by a {@link StorageAdapter} call. Callers decide whether to retry by type:
 * {@link TransientStorageException} may succeed on another attempt, {@link PermanentStorageException} will not.
 */
public abstract class StorageException extends RuntimeException {
    protected StorageException(String message, Throwable cause) { super(message, cause); }
    protected StorageException(String message) { super(message); }
}
