package com.disasterfeed.sync.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Tracks each sync cycle for observability.
 * Stored in the sync_runs table.
 */
@Data
@Builder
public class SyncRun {

    private String runId;           // UUID
    private Instant startedAt;
    private Instant completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED | CANCELLED
    private FailureKind failureKind; // null on success
    private int geoJsonRecords;
    private int xmlRecords;
    private int parseWarnings;
    private int canonicalRecords;
    private int inserted;
    private int updated;
    private int unchanged;
    private int failed;
    private String errorMessage;    // null on success

    public boolean isSuccess() {
        return "SUCCESS".equals(status);
    }
}
