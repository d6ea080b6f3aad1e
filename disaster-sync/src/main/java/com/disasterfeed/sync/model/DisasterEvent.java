package com.disasterfeed.sync.model;

import lombok.Builder;
import lombok.Data;
import org.locationtech.jts.geom.Geometry;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalised disaster event, the common shape both feed parsers produce.
 *
 * Schema design notes:
 *  - sourceId is eventType code + GDACS event id, e.g. "EQ1453422", identical in both feeds
 *  - geometry is WGS84 lon/lat (SRID 4326); may be absent only before reconciliation
 *  - rawAttributes keeps every scalar field we do not model, sorted by key
 *  - fetchedAt is ours, never part of the change fingerprint
 */
@Data
@Builder(toBuilder = true)
public class DisasterEvent {

    // ── Identity ────────────────────────────────────────────────────────────
    private String sourceId;

    /** GDACS episode id; a new episode is a revision of the same event */
    private String episodeId;

    // ── Classification ──────────────────────────────────────────────────────
    private EventType eventType;

    private AlertLevel severity;

    private String title;

    private String country;

    private String link;

    // ── Time ────────────────────────────────────────────────────────────────
    private Instant occurredAt;

    private Instant endsAt;

    // ── Location ────────────────────────────────────────────────────────────
    private Geometry geometry;

    // ── Passthrough ─────────────────────────────────────────────────────────
    @Builder.Default
    private Map<String, Object> rawAttributes = new TreeMap<>();

    // ── Metadata ────────────────────────────────────────────────────────────
    private Instant fetchedAt;
}
