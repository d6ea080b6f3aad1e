package com.disasterfeed.sync.service;

import com.disasterfeed.sync.exception.FeedParseException;
import com.disasterfeed.sync.model.AlertLevel;
import com.disasterfeed.sync.model.DisasterEvent;
import com.disasterfeed.sync.model.FeedFormat;
import com.disasterfeed.sync.model.FeedPayload;
import com.disasterfeed.sync.model.ParseResult;
import com.disasterfeed.sync.model.ParseWarning;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Parses the GDACS GeoJSON export (a FeatureCollection) into DisasterEvents.
 *
 * Property mapping:
 *   eventtype + eventid -> sourceId     episodeid -> episodeId
 *   alertlevel          -> severity     name / eventname -> title
 *   country             -> country      url.report / url -> link
 *   fromdate / todate   -> occurredAt / endsAt
 * Every other scalar property lands in rawAttributes; nested objects are flattened with
 * dotted keys (severitydata.severity), arrays are dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GeoJsonEventParser {

    private static final Set<String> MAPPED = Set.of(
            "eventtype", "eventid", "episodeid", "alertlevel", "name", "eventname",
            "country", "fromdate", "todate", "url");

    private final ObjectMapper objectMapper;
    private final GeometryFactory geometryFactory;

    public ParseResult parse(FeedPayload payload) {
        if (payload.isBlank()) {
            throw new FeedParseException(FeedFormat.GEOJSON, "empty payload");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload.body());
        } catch (IOException e) {
            throw new FeedParseException(FeedFormat.GEOJSON, "is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
            throw new FeedParseException(FeedFormat.GEOJSON, "is not a FeatureCollection");
        }
        JsonNode features = root.path("features");
        if (!features.isArray()) {
            throw new FeedParseException(FeedFormat.GEOJSON, "FeatureCollection has no features array");
        }

        List<DisasterEvent> events = new ArrayList<>();
        List<ParseWarning> warnings = new ArrayList<>();
        GeoJsonReader geometryReader = new GeoJsonReader(geometryFactory);

        for (int i = 0; i < features.size(); i++) {
            JsonNode feature = features.get(i);
            JsonNode props = feature.path("properties");

            String sourceId = FeedValues.sourceId(text(props, "eventtype"), text(props, "eventid"));
            if (sourceId == null) {
                warnings.add(new ParseWarning(FeedFormat.GEOJSON, i, null, "missing eventtype or eventid"));
                continue;
            }

            JsonNode geometryNode = feature.path("geometry");
            if (geometryNode.isMissingNode() || geometryNode.isNull()) {
                warnings.add(new ParseWarning(FeedFormat.GEOJSON, i, sourceId, "missing geometry"));
                continue;
            }
            Geometry geometry;
            try {
                geometry = geometryReader.read(objectMapper.writeValueAsString(geometryNode));
            } catch (ParseException | JsonProcessingException | RuntimeException e) {
                warnings.add(new ParseWarning(FeedFormat.GEOJSON, i, sourceId, "unreadable geometry: " + e.getMessage()));
                continue;
            }
            if (geometry.isEmpty()) {
                warnings.add(new ParseWarning(FeedFormat.GEOJSON, i, sourceId, "empty " + geometry.getGeometryType()));
                continue;
            }

            String title = text(props, "name") != null ? text(props, "name") : text(props, "eventname");
            events.add(DisasterEvent.builder()
                    .sourceId(sourceId)
                    .episodeId(text(props, "episodeid"))
                    .eventType(FeedValues.eventType(text(props, "eventtype")))
                    .severity(AlertLevel.parse(text(props, "alertlevel")))
                    .title(title)
                    .country(text(props, "country"))
                    .link(link(props))
                    .occurredAt(instant(props, "fromdate", i, sourceId, warnings))
                    .endsAt(instant(props, "todate", i, sourceId, warnings))
                    .geometry(geometry)
                    .rawAttributes(rawAttributes(props))
                    .fetchedAt(payload.fetchedAt())
                    .build());
        }

        log.info("Parsed GeoJSON: {} events, {} warnings from {} features",
                events.size(), warnings.size(), features.size());
        return new ParseResult(events, warnings);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String text(JsonNode props, String field) {
        JsonNode node = props.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        return FeedValues.emptyToNull(node.asText());
    }

    private String link(JsonNode props) {
        JsonNode url = props.get("url");
        if (url == null || url.isNull()) return null;
        if (url.isObject()) return text(url, "report");
        return FeedValues.emptyToNull(url.asText());
    }

    private Instant instant(JsonNode props, String field, int index, String sourceId, List<ParseWarning> warnings) {
        String value = text(props, field);
        if (value == null) return null;
        try {
            return FeedValues.parseInstant(value);
        } catch (DateTimeParseException e) {
            warnings.add(new ParseWarning(FeedFormat.GEOJSON, index, sourceId, "unparseable " + field + " '" + value + "'"));
            return null;
        }
    }

    private Map<String, Object> rawAttributes(JsonNode props) {
        Map<String, Object> attributes = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!MAPPED.contains(field.getKey())) {
                flatten(field.getKey(), field.getValue(), attributes);
            }
        }
        return attributes;
    }

    private void flatten(String key, JsonNode node, Map<String, Object> into) {
        if (node.isObject()) {
            node.fields().forEachRemaining(e -> flatten(key + "." + e.getKey(), e.getValue(), into));
        } else if (node.isNumber()) {
            into.put(key, new BigDecimal(node.asText()));
        } else if (node.isBoolean()) {
            into.put(key, node.booleanValue());
        } else if (node.isTextual()) {
            into.put(key, node.textValue());
        }
    }
}
