package com.disasterfeed.sync.scheduler;

import com.disasterfeed.sync.model.CycleState;
import com.disasterfeed.sync.model.SyncRun;

import java.time.Instant;

/** Point-in-time view of the scheduler for the status endpoint. */
public record SyncStatus(
        CycleState state,
        long cyclesCompleted,
        int consecutiveFailures,
        Instant lastCycleStartedAt,
        Instant nextCycleAt,
        SyncRun lastRun) {
}
