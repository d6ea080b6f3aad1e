package com.disasterfeed.sync.output;

import com.disasterfeed.sync.config.DisasterSyncProperties;
import com.disasterfeed.sync.exception.StorageException;
import com.disasterfeed.sync.metrics.SyncMetrics;
import com.disasterfeed.sync.model.DisasterEvent;
import com.disasterfeed.sync.model.SyncRun;
import com.disasterfeed.sync.service.EventFingerprinter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * PostGIS-backed store.
 *
 * Writes are INSERT ... ON CONFLICT (source_id) DO UPDATE, batched, inside one
 * transaction per cycle. first_seen_at is only ever set by the insert branch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PostgisEventStore implements EventStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate syncTransactionTemplate;
    private final DisasterSyncProperties properties;
    private final EventFingerprinter fingerprinter;
    private final ObjectMapper objectMapper;
    private final SyncMetrics metrics;

    @Override
    public void ensureSchema() {
        DisasterSyncProperties.Store store = properties.getStore();
        log.info("Ensuring PostGIS schema exists...");

        jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS postgis");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS %s
            (
                source_id       TEXT PRIMARY KEY,
                event_type      TEXT,
                severity        TEXT,
                title           TEXT,
                country         TEXT,
                link            TEXT,
                episode_id      TEXT,
                occurred_at     TIMESTAMPTZ,
                ends_at         TIMESTAMPTZ,
                geom            geometry(Geometry, %d) NOT NULL,
                raw_attributes  JSONB NOT NULL DEFAULT '{}'::jsonb,
                fingerprint     CHAR(64) NOT NULL,
                fetched_at      TIMESTAMPTZ NOT NULL,
                first_seen_at   TIMESTAMPTZ NOT NULL DEFAULT now(),
                updated_at      TIMESTAMPTZ NOT NULL DEFAULT now()
            )
            """.formatted(store.getEventsTable(), store.getSrid()));

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %1$s_geom_idx ON %1$s USING GIST (geom)"
                .formatted(store.getEventsTable()));

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS %s
            (
                run_id              UUID PRIMARY KEY,
                started_at          TIMESTAMPTZ NOT NULL,
                completed_at        TIMESTAMPTZ,
                status              TEXT NOT NULL,
                failure_kind        TEXT,
                geojson_records     INT NOT NULL DEFAULT 0,
                xml_records         INT NOT NULL DEFAULT 0,
                parse_warnings      INT NOT NULL DEFAULT 0,
                canonical_records   INT NOT NULL DEFAULT 0,
                inserted            INT NOT NULL DEFAULT 0,
                updated             INT NOT NULL DEFAULT 0,
                unchanged           INT NOT NULL DEFAULT 0,
                failed              INT NOT NULL DEFAULT 0,
                error_message       TEXT
            )
            """.formatted(store.getRunsTable()));

        log.info("PostGIS schema ready.");
    }

    @Override
    public Map<String, String> loadFingerprintIndex() {
        Map<String, String> index = new HashMap<>();
        try {
            // run inside the template so store.query-timeout bounds the read
            syncTransactionTemplate.executeWithoutResult(status ->
                    jdbcTemplate.query("SELECT source_id, fingerprint FROM " + properties.getStore().getEventsTable(),
                            rs -> {
                                index.put(rs.getString(1), rs.getString(2).trim());
                            }));
            return index;
        } catch (DataAccessException e) {
            throw new StorageException("Could not read stored fingerprints: " + e.getMessage(), e);
        }
    }

    @Override
    public void upsertAll(List<DisasterEvent> inserts, List<DisasterEvent> updates) {
        List<DisasterEvent> all = new ArrayList<>(inserts.size() + updates.size());
        all.addAll(inserts);
        all.addAll(updates);
        if (all.isEmpty()) return;

        int batchSize = properties.getStore().getBatchSize();
        String sql = upsertSql();
        try {
            syncTransactionTemplate.executeWithoutResult(status -> {
                for (int i = 0; i < all.size(); i += batchSize) {
                    List<DisasterEvent> batch = all.subList(i, Math.min(i + batchSize, all.size()));
                    jdbcTemplate.batchUpdate(sql, batch.stream().map(this::toRow).toList());
                    log.debug("Upserted batch {}/{}", Math.min(i + batchSize, all.size()), all.size());
                }
            });
        } catch (DataAccessException e) {
            throw new StorageException("Upsert of " + all.size() + " events rolled back: " + e.getMessage(), e);
        }
        log.info("Committed {} inserts and {} updates", inserts.size(), updates.size());
    }

    private String upsertSql() {
        return """
            INSERT INTO %s
            (source_id, event_type, severity, title, country, link, episode_id, occurred_at, ends_at,
             geom, raw_attributes, fingerprint, fetched_at, first_seen_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ST_SetSRID(ST_GeomFromText(?), %d), ?::jsonb, ?, ?, now(), now())
            ON CONFLICT (source_id) DO UPDATE SET
                event_type     = EXCLUDED.event_type,
                severity       = EXCLUDED.severity,
                title          = EXCLUDED.title,
                country        = EXCLUDED.country,
                link           = EXCLUDED.link,
                episode_id     = EXCLUDED.episode_id,
                occurred_at    = EXCLUDED.occurred_at,
                ends_at        = EXCLUDED.ends_at,
                geom           = EXCLUDED.geom,
                raw_attributes = EXCLUDED.raw_attributes,
                fingerprint    = EXCLUDED.fingerprint,
                fetched_at     = EXCLUDED.fetched_at,
                updated_at     = now()
            """.formatted(properties.getStore().getEventsTable(), properties.getStore().getSrid());
    }

    private Object[] toRow(DisasterEvent e) {
        return new Object[]{
                e.getSourceId(),
                e.getEventType() != null ? e.getEventType().name() : null,
                e.getSeverity() != null ? e.getSeverity().name() : null,
                e.getTitle(),
                e.getCountry(),
                e.getLink(),
                e.getEpisodeId(),
                timestamp(e.getOccurredAt()),
                timestamp(e.getEndsAt()),
                new WKTWriter().write(e.getGeometry()),
                json(e.getRawAttributes()),
                fingerprinter.fingerprint(e),
                timestamp(e.getFetchedAt())
        };
    }

    private Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private String json(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes == null ? Map.of() : attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Raw attributes not serialisable", e);
        }
    }

    @Override
    public void writeSyncRun(SyncRun run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO %s
                (run_id, started_at, completed_at, status, failure_kind, geojson_records, xml_records,
                 parse_warnings, canonical_records, inserted, updated, unchanged, failed, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(properties.getStore().getRunsTable()),
                    UUID.fromString(run.getRunId()),
                    timestamp(run.getStartedAt()),
                    timestamp(run.getCompletedAt()),
                    run.getStatus(),
                    run.getFailureKind() != null ? run.getFailureKind().name() : null,
                    run.getGeoJsonRecords(),
                    run.getXmlRecords(),
                    run.getParseWarnings(),
                    run.getCanonicalRecords(),
                    run.getInserted(),
                    run.getUpdated(),
                    run.getUnchanged(),
                    run.getFailed(),
                    run.getErrorMessage());
        } catch (DataAccessException e) {
            metrics.runLogWriteFailed();
            log.warn("Failed to write sync run {}: {}", run.getRunId(), e.getMessage());
        }
    }
}
