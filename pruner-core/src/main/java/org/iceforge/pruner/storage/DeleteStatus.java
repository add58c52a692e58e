package org.iceforge.pruner.storage;

/** Successful outcomes of {@link StorageAdapter#delete(String)}. Both count as "gone". */
public enum DeleteStatus {
    DELETED,
    NOT_FOUND
}
