package com.disasterfeed.sync.exception;

import com.disasterfeed.sync.model.FailureKind;

/** Transaction-level store failure. Nothing from the cycle was committed. */
public class StorageException extends SyncException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.STORAGE;
    }
}
