package org.iceforge.pruner.storage;

public class PermanentStorageException extends StorageException {
    public PermanentStorageException(String message, Throwable cause) { super(message, cause); }
    public PermanentStorageException(String message) { super(message); }
}
