package com.disasterfeed.sync.service;

import com.disasterfeed.sync.model.DisasterEvent;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over every mutable field of an event except fetchedAt.
 *
 * Geometry is normalised before rendering so ring start point and orientation do not count
 * as change. Raw attributes are rendered in key order.
 */
@Component
public class EventFingerprinter {

    public String fingerprint(DisasterEvent event) {
        StringBuilder canonical = new StringBuilder(256);
        field(canonical, "type", event.getEventType());
        field(canonical, "severity", event.getSeverity());
        field(canonical, "title", event.getTitle());
        field(canonical, "country", event.getCountry());
        field(canonical, "link", event.getLink());
        field(canonical, "episode", event.getEpisodeId());
        field(canonical, "occurred", event.getOccurredAt());
        field(canonical, "ends", event.getEndsAt());
        field(canonical, "geometry", event.getGeometry() == null ? null
                : new WKTWriter().write(event.getGeometry().norm()));

        Map<String, Object> raw = event.getRawAttributes() == null ? Map.of() : new TreeMap<>(event.getRawAttributes());
        raw.forEach((k, v) -> field(canonical, "raw." + k, render(v)));

        return sha256(canonical.toString());
    }

    private void field(StringBuilder sb, String name, Object value) {
        sb.append(name).append('=').append(value == null ? "<null>" : value).append('\n');
    }

    private Object render(Object value) {
        if (value instanceof BigDecimal d) {
            return d.stripTrailingZeros().toPlainString();
        }
        return value;
    }

    private String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
