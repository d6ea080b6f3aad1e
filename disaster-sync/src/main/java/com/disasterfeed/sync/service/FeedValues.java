package com.disasterfeed.sync.service;

import com.disasterfeed.sync.model.EventType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Field conventions shared by the GeoJSON and XML parsers.
 */
final class FeedValues {

    private FeedValues() {
    }

    /**
     * The one identity rule for both formats: event type code followed by the GDACS event id,
     * e.g. "EQ" + "1453422". Null when either part is missing.
     */
    static String sourceId(String eventTypeCode, String eventId) {
        String type = emptyToNull(eventTypeCode);
        String id = emptyToNull(eventId);
        if (type == null || id == null) return null;
        return type.toUpperCase(Locale.ROOT) + id;
    }

    static EventType eventType(String code) {
        return EventType.fromCode(code);
    }

    /**
     * Accepts the date shapes GDACS publishes: RFC 1123 in the RSS feed, ISO local date-times
     * (UTC) in the GeoJSON export, plus offset/instant and plain dates.
     *
     * @throws DateTimeParseException when none match
     */
    static Instant parseInstant(String value) {
        String v = value.trim();
        if (Character.isLetter(v.charAt(0))) {
            return OffsetDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        }
        if (v.length() == 10) {
            return LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC);
        }
    }

    /** Keeps numbers and booleans typed; everything else stays as trimmed text. */
    static Object scalar(String text) {
        String v = text.trim();
        if ("true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) {
            return Boolean.valueOf(v.toLowerCase(Locale.ROOT));
        }
        if (v.matches("-?\\d+(\\.\\d+)?")) {
            try {
                return new BigDecimal(v);
            } catch (NumberFormatException e) {
                return v;
            }
        }
        return v;
    }

    static String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }
}
