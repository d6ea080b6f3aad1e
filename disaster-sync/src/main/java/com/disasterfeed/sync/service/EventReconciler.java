package com.disasterfeed.sync.service;

import com.disasterfeed.sync.model.DisasterEvent;
import com.disasterfeed.sync.model.FeedFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges the GeoJSON and XML views of the feed into one record per sourceId.
 *
 * Precedence is fixed:
 *  - XML is the base record; any field it lacks is taken from GeoJSON
 *  - geometry comes from GeoJSON whenever GeoJSON has a non-empty one
 *  - where both carry a non-null scalar, XML wins
 *  - raw attributes are the union, XML winning on key collisions
 *
 * Duplicate ids inside one feed collapse to the highest episode, then the latest occurredAt,
 * then the greatest fingerprint, so the outcome never depends on input order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventReconciler {

    private final EventFingerprinter fingerprinter;

    public List<DisasterEvent> reconcile(List<DisasterEvent> geoJsonEvents, List<DisasterEvent> xmlEvents) {
        Map<String, DisasterEvent> geoJson = collapse(geoJsonEvents, FeedFormat.GEOJSON);
        Map<String, DisasterEvent> xml = collapse(xmlEvents, FeedFormat.XML);

        TreeSet<String> ids = new TreeSet<>(geoJson.keySet());
        ids.addAll(xml.keySet());

        List<DisasterEvent> canonical = new ArrayList<>(ids.size());
        int merged = 0;
        for (String id : ids) {
            DisasterEvent x = xml.get(id);
            DisasterEvent g = geoJson.get(id);
            if (x != null && g != null) {
                canonical.add(merge(x, g));
                merged++;
            } else {
                canonical.add(x != null ? x : g);
            }
        }

        log.info("Reconciled {} GeoJSON + {} XML records into {} events ({} present in both feeds)",
                geoJsonEvents.size(), xmlEvents.size(), canonical.size(), merged);
        return canonical;
    }

    DisasterEvent merge(DisasterEvent xml, DisasterEvent geoJson) {
        Map<String, Object> attributes = new TreeMap<>();
        if (geoJson.getRawAttributes() != null) attributes.putAll(geoJson.getRawAttributes());
        if (xml.getRawAttributes() != null) attributes.putAll(xml.getRawAttributes());

        return xml.toBuilder()
                .episodeId(prefer(xml.getEpisodeId(), geoJson.getEpisodeId()))
                .eventType(prefer(xml.getEventType(), geoJson.getEventType()))
                .severity(prefer(xml.getSeverity(), geoJson.getSeverity()))
                .title(prefer(xml.getTitle(), geoJson.getTitle()))
                .country(prefer(xml.getCountry(), geoJson.getCountry()))
                .link(prefer(xml.getLink(), geoJson.getLink()))
                .occurredAt(prefer(xml.getOccurredAt(), geoJson.getOccurredAt()))
                .endsAt(prefer(xml.getEndsAt(), geoJson.getEndsAt()))
                .geometry(usable(geoJson.getGeometry()) ? geoJson.getGeometry() : xml.getGeometry())
                .rawAttributes(attributes)
                .fetchedAt(later(xml.getFetchedAt(), geoJson.getFetchedAt()))
                .build();
    }

    private Map<String, DisasterEvent> collapse(List<DisasterEvent> events, FeedFormat format) {
        Comparator<DisasterEvent> preference = Comparator
                .comparing((DisasterEvent e) -> episodeNumber(e.getEpisodeId()))
                .thenComparing(DisasterEvent::getOccurredAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(fingerprinter::fingerprint);

        Map<String, DisasterEvent> byId = new HashMap<>();
        int duplicates = 0;
        for (DisasterEvent event : events) {
            DisasterEvent existing = byId.get(event.getSourceId());
            if (existing == null) {
                byId.put(event.getSourceId(), event);
            } else {
                duplicates++;
                if (preference.compare(event, existing) > 0) {
                    byId.put(event.getSourceId(), event);
                }
            }
        }
        if (duplicates > 0) {
            log.info("{} feed carried {} duplicate records, kept the latest episode of each", format, duplicates);
        }
        return byId;
    }

    private long episodeNumber(String episodeId) {
        if (episodeId == null) return Long.MIN_VALUE;
        try {
            return Long.parseLong(episodeId.trim());
        } catch (NumberFormatException e) {
            return Long.MIN_VALUE + 1;
        }
    }

    private static <T> T prefer(T primary, T fallback) {
        return primary != null ? primary : fallback;
    }

    private static boolean usable(Geometry geometry) {
        return geometry != null && !geometry.isEmpty();
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
