package com.disasterfeed.sync.model;

import java.util.List;

/**
 * What one write stage committed, and which records were left out and why.
 */
public record SyncResult(int insertedCount, int updatedCount, List<FailedRecord> failed) {

    public SyncResult {
        failed = List.copyOf(failed);
    }

    public record FailedRecord(String sourceId, String reason) {}
}
