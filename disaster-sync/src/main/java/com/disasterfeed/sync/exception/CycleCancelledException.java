package com.disasterfeed.sync.exception;

import com.disasterfeed.sync.model.FailureKind;

public class CycleCancelledException extends SyncException {

    public CycleCancelledException(String checkpoint) {
        super("Stop requested, cycle abandoned before " + checkpoint);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.CANCELLED;
    }
}
