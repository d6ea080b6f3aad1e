package com.disasterfeed.sync.exception;

import com.disasterfeed.sync.model.FailureKind;

/**
 * Root of the cycle-level failures. Anything thrown as a SyncException aborts the current
 * cycle only; the scheduler records {@link #getKind()} and carries on.
 */
public abstract class SyncException extends RuntimeException {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind getKind();
}
