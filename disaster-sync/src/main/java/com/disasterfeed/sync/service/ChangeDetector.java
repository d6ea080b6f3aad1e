package com.disasterfeed.sync.service;

import com.disasterfeed.sync.model.ChangeSet;
import com.disasterfeed.sync.model.DisasterEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits the canonical events into insert / update / unchanged against the fingerprints
 * currently stored, so the writer only touches rows whose upstream content moved.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChangeDetector {

    private final EventFingerprinter fingerprinter;

    /**
     * @param persistedIndex sourceId -> stored fingerprint, read fresh for this cycle
     */
    public ChangeSet diff(List<DisasterEvent> canonicalEvents, Map<String, String> persistedIndex) {
        List<DisasterEvent> toInsert = new ArrayList<>();
        List<DisasterEvent> toUpdate = new ArrayList<>();
        List<DisasterEvent> unchanged = new ArrayList<>();

        for (DisasterEvent event : canonicalEvents) {
            String stored = persistedIndex.get(event.getSourceId());
            if (stored == null) {
                toInsert.add(event);
            } else if (!stored.equals(fingerprinter.fingerprint(event))) {
                toUpdate.add(event);
            } else {
                unchanged.add(event);
            }
        }

        log.info("Change detection: {} new, {} changed, {} unchanged (index holds {} rows)",
                toInsert.size(), toUpdate.size(), unchanged.size(), persistedIndex.size());
        return new ChangeSet(toInsert, toUpdate, unchanged);
    }
}
