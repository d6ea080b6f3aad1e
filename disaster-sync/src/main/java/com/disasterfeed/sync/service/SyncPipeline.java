package com.disasterfeed.sync.service;

import com.disasterfeed.sync.exception.CycleCancelledException;
import com.disasterfeed.sync.exception.SyncException;
import com.disasterfeed.sync.metrics.SyncMetrics;
import com.disasterfeed.sync.model.ChangeSet;
import com.disasterfeed.sync.model.CycleState;
import com.disasterfeed.sync.model.DisasterEvent;
import com.disasterfeed.sync.model.FailureKind;
import com.disasterfeed.sync.model.FeedFormat;
import com.disasterfeed.sync.model.FeedSnapshot;
import com.disasterfeed.sync.model.ParseResult;
import com.disasterfeed.sync.model.ParseWarning;
import com.disasterfeed.sync.model.SyncResult;
import com.disasterfeed.sync.model.SyncRun;
import com.disasterfeed.sync.output.EventStore;
import com.disasterfeed.sync.output.SyncWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runs one sync cycle: fetch -> parse -> reconcile -> diff -> write.
 *
 * Any cycle-level failure ends the cycle at that stage and is reported in the returned
 * SyncRun; this method does not throw. A stop request is honoured between stages but never
 * once the write has started.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncPipeline {

    private final SourceClient sourceClient;
    private final GeoJsonEventParser geoJsonParser;
    private final XmlEventParser xmlParser;
    private final EventReconciler reconciler;
    private final ChangeDetector changeDetector;
    private final SyncWriter syncWriter;
    private final EventStore eventStore;
    private final SyncMetrics metrics;
    private final Clock clock;

    public SyncRun runCycle(BooleanSupplier stopRequested, Consumer<CycleState> onStateChange) {
        SyncRun run = SyncRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(clock.instant())
                .status("RUNNING")
                .build();
        log.info("Sync cycle {} started", run.getRunId());

        try {
            checkpoint(stopRequested, "fetch");
            onStateChange.accept(CycleState.FETCHING);
            FeedSnapshot snapshot = sourceClient.fetchAll();

            checkpoint(stopRequested, "parse");
            onStateChange.accept(CycleState.PARSING);
            ParseResult geoJson = geoJsonParser.parse(snapshot.geoJson());
            ParseResult xml = xmlParser.parse(snapshot.xml());
            run.setGeoJsonRecords(geoJson.events().size());
            run.setXmlRecords(xml.events().size());
            run.setParseWarnings(geoJson.warnings().size() + xml.warnings().size());
            reportWarnings(FeedFormat.GEOJSON, geoJson.warnings());
            reportWarnings(FeedFormat.XML, xml.warnings());

            checkpoint(stopRequested, "reconcile");
            onStateChange.accept(CycleState.RECONCILING);
            List<DisasterEvent> canonical = reconciler.reconcile(geoJson.events(), xml.events());
            run.setCanonicalRecords(canonical.size());

            checkpoint(stopRequested, "diff");
            onStateChange.accept(CycleState.DIFFING);
            Map<String, String> index = eventStore.loadFingerprintIndex();
            ChangeSet changes = changeDetector.diff(canonical, index);
            run.setUnchanged(changes.unchanged().size());

            checkpoint(stopRequested, "write");
            onStateChange.accept(CycleState.WRITING);
            SyncResult result = syncWriter.apply(changes.toInsert(), changes.toUpdate());
            run.setInserted(result.insertedCount());
            run.setUpdated(result.updatedCount());
            run.setFailed(result.failed().size());
            metrics.recordWrite(result, changes.unchanged().size());

            run.setStatus("SUCCESS");
            log.info("Sync cycle {} complete: {} inserted, {} updated, {} unchanged, {} rejected",
                    run.getRunId(), result.insertedCount(), result.updatedCount(),
                    changes.unchanged().size(), result.failed().size());

        } catch (CycleCancelledException e) {
            log.info("Sync cycle {} cancelled: {}", run.getRunId(), e.getMessage());
            fail(run, e.getKind(), e.getMessage());
            run.setStatus("CANCELLED");

        } catch (SyncException e) {
            log.error("Sync cycle {} failed ({}): {}", run.getRunId(), e.getKind(), e.getMessage(), e);
            fail(run, e.getKind(), e.getMessage());
            if (e.getKind() == FailureKind.CANCELLED) {
                run.setStatus("CANCELLED");
            }

        } catch (RuntimeException e) {
            log.error("Sync cycle {} failed unexpectedly: {}", run.getRunId(), e.getMessage(), e);
            fail(run, FailureKind.UNEXPECTED, e.toString());

        } finally {
            run.setCompletedAt(clock.instant());
            metrics.recordCycle(run, Duration.between(run.getStartedAt(), run.getCompletedAt()));
            eventStore.writeSyncRun(run);
        }
        return run;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void checkpoint(BooleanSupplier stopRequested, String stage) {
        if (stopRequested.getAsBoolean()) {
            throw new CycleCancelledException(stage);
        }
    }

    private void reportWarnings(FeedFormat format, List<ParseWarning> warnings) {
        if (warnings.isEmpty()) return;
        log.warn("{} feed: {} records skipped or incomplete", format, warnings.size());
        warnings.forEach(w -> log.debug("  {}", w));
        metrics.recordParseWarnings(format, warnings.size());
    }

    private void fail(SyncRun run, FailureKind kind, String message) {
        run.setStatus("FAILED");
        run.setFailureKind(kind);
        run.setErrorMessage(message);
    }
}
