package com.disasterfeed.sync.model;

public enum CycleState {
    IDLE, FETCHING, PARSING, RECONCILING, DIFFING, WRITING, SLEEPING, STOPPED
}
