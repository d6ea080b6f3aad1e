package com.disasterfeed.sync.model;

/** Coarse reason a cycle did not complete. */
public enum FailureKind {
    FETCH, PARSE, STORAGE, CANCELLED, UNEXPECTED
}
