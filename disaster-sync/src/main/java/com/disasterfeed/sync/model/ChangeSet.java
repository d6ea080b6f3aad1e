package com.disasterfeed.sync.model;

import java.util.List;

/**
 * Outcome of comparing one cycle's canonical events with the persisted fingerprints.
 */
public record ChangeSet(List<DisasterEvent> toInsert, List<DisasterEvent> toUpdate, List<DisasterEvent> unchanged) {

    public ChangeSet {
        toInsert = List.copyOf(toInsert);
        toUpdate = List.copyOf(toUpdate);
        unchanged = List.copyOf(unchanged);
    }

    public boolean hasWork() {
        return !toInsert.isEmpty() || !toUpdate.isEmpty();
    }
}
