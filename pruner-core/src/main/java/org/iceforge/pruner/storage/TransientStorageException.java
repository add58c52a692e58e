package org.iceforge.pruner.storage;

public class TransientStorageException extends StorageException {
    public TransientStorageException(String message, Throwable cause) { super(message, cause); }
    public TransientStorageException(String message) { super(message); }
}
