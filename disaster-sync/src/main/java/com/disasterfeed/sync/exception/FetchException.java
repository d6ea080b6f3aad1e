package com.disasterfeed.sync.exception;

import com.disasterfeed.sync.model.FailureKind;

public class FetchException extends SyncException {

    public enum FetchFailure {
        NETWORK, HTTP_STATUS, BROWSER, TIMEOUT, INTERRUPTED
    }

    private final FetchFailure failure;

    public FetchException(FetchFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public FetchException(FetchFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public FetchFailure getFailure() {
        return failure;
    }

    @Override
    public FailureKind getKind() {
        return failure == FetchFailure.INTERRUPTED ? FailureKind.CANCELLED : FailureKind.FETCH;
    }

    @Override
    public String getMessage() {
        return failure + ": " + super.getMessage();
    }
}
