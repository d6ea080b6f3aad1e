package com.disasterfeed.sync.output;

import com.disasterfeed.sync.model.DisasterEvent;
import com.disasterfeed.sync.model.SyncResult;
import com.disasterfeed.sync.model.SyncResult.FailedRecord;
import com.disasterfeed.sync.service.GeometryValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies a cycle's inserts and updates.
 *
 * Records are validated before the transaction opens; a bad geometry excludes only that
 * record and is reported in {@link SyncResult#failed()}. The rest go to the store in one
 * transaction, so a storage error leaves nothing committed and propagates as StorageException.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncWriter {

    private final EventStore eventStore;
    private final GeometryValidator geometryValidator;

    public SyncResult apply(List<DisasterEvent> toInsert, List<DisasterEvent> toUpdate) {
        List<FailedRecord> failed = new ArrayList<>();
        List<DisasterEvent> inserts = validated(toInsert, failed);
        List<DisasterEvent> updates = validated(toUpdate, failed);

        if (!inserts.isEmpty() || !updates.isEmpty()) {
            eventStore.upsertAll(inserts, updates);
        }

        if (!failed.isEmpty()) {
            log.warn("{} events excluded from the write: {}", failed.size(), failed);
        }
        return new SyncResult(inserts.size(), updates.size(), failed);
    }

    private List<DisasterEvent> validated(List<DisasterEvent> events, List<FailedRecord> failed) {
        List<DisasterEvent> valid = new ArrayList<>(events.size());
        for (DisasterEvent event : events) {
            Optional<String> problem = geometryValidator.validate(event.getGeometry());
            if (problem.isPresent()) {
                failed.add(new FailedRecord(event.getSourceId(), problem.get()));
            } else {
                valid.add(event);
            }
        }
        return valid;
    }
}
