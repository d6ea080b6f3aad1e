package com.disasterfeed.sync.output;

import com.disasterfeed.sync.model.DisasterEvent;
import com.disasterfeed.sync.model.SyncRun;

import java.util.List;
import java.util.Map;

/**
 * Persistent side of the sync: one row per sourceId plus a log of cycles.
 */
public interface EventStore {

    /** Create tables and indexes that do not exist yet. */
    void ensureSchema();

    /** sourceId -> fingerprint of every stored event. */
    Map<String, String> loadFingerprintIndex();

    /**
     * Upsert all given events in a single transaction. Either everything commits or,
     * on any storage error, nothing does and a StorageException is thrown.
     */
    void upsertAll(List<DisasterEvent> inserts, List<DisasterEvent> updates);

    /** Best effort; a failure here never fails the cycle. */
    void writeSyncRun(SyncRun run);
}
