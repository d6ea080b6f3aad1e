package com.disasterfeed.sync.service;

import com.disasterfeed.sync.exception.FeedParseException;
import com.disasterfeed.sync.model.AlertLevel;
import com.disasterfeed.sync.model.DisasterEvent;
import com.disasterfeed.sync.model.FeedFormat;
import com.disasterfeed.sync.model.FeedPayload;
import com.disasterfeed.sync.model.ParseResult;
import com.disasterfeed.sync.model.ParseWarning;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Parses the GDACS RSS feed into DisasterEvents.
 *
 * Each rss/channel/item is one event. Fields are looked up by local name within the item:
 *   gdacs:eventtype + gdacs:eventid -> sourceId      gdacs:episodeid -> episodeId
 *   gdacs:alertlevel -> severity                      title, link, gdacs:country
 *   gdacs:fromdate / gdacs:todate -> occurredAt / endsAt
 *   georss:point ("lat lon"), else gdacs:bbox ("minLon maxLon minLat maxLat") -> geometry
 * Other leaf elements and their attributes go to rawAttributes (severity.unit, dc.subject, ...).
 *
 * An item without identity is dropped with a warning. An item without a usable geometry is
 * kept with a warning: the GeoJSON feed is the spatial source and fills it in during
 * reconciliation, and the writer rejects whatever is still missing one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class XmlEventParser {

    static final String GDACS_NS = "http://www.gdacs.org";
    static final String GEORSS_NS = "http://www.georss.org/georss";
    static final String DC_NS = "http://purl.org/dc/elements/1.1/";

    private static final Set<String> MAPPED = Set.of(
            "eventtype", "eventid", "episodeid", "alertlevel", "title", "link", "country",
            "fromdate", "todate", "point", "bbox");

    private final GeometryFactory geometryFactory;

    public ParseResult parse(FeedPayload payload) {
        if (payload.isBlank()) {
            throw new FeedParseException(FeedFormat.XML, "empty payload");
        }

        Document document = readDocument(payload.body());
        Element root = document.getDocumentElement();
        if (!"rss".equals(localName(root)) || firstChild(root, "channel") == null) {
            throw new FeedParseException(FeedFormat.XML, "unexpected document root <" + root.getNodeName() + ">");
        }

        NodeList items = document.getElementsByTagNameNS("*", "item");
        List<DisasterEvent> events = new ArrayList<>();
        List<ParseWarning> warnings = new ArrayList<>();

        for (int i = 0; i < items.getLength(); i++) {
            Element item = (Element) items.item(i);
            Map<String, String> fields = leafFields(item);

            String sourceId = FeedValues.sourceId(fields.get("eventtype"), fields.get("eventid"));
            if (sourceId == null) {
                warnings.add(new ParseWarning(FeedFormat.XML, i, null, "missing gdacs:eventtype or gdacs:eventid"));
                continue;
            }

            Geometry geometry = geometry(fields, i, sourceId, warnings);

            events.add(DisasterEvent.builder()
                    .sourceId(sourceId)
                    .episodeId(fields.get("episodeid"))
                    .eventType(FeedValues.eventType(fields.get("eventtype")))
                    .severity(AlertLevel.parse(fields.get("alertlevel")))
                    .title(fields.get("title"))
                    .country(fields.get("country"))
                    .link(fields.get("link"))
                    .occurredAt(instant(fields, "fromdate", i, sourceId, warnings))
                    .endsAt(instant(fields, "todate", i, sourceId, warnings))
                    .geometry(geometry)
                    .rawAttributes(rawAttributes(item))
                    .fetchedAt(payload.fetchedAt())
                    .build());
        }

        log.info("Parsed XML: {} events, {} warnings from {} items",
                events.size(), warnings.size(), items.getLength());
        return new ParseResult(events, warnings);
    }

    // ── Document ─────────────────────────────────────────────────────────────

    private Document readDocument(byte[] body) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(body));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser misconfigured", e);
        } catch (SAXException | IOException e) {
            throw new FeedParseException(FeedFormat.XML, "is not well-formed: " + e.getMessage(), e);
        }
    }

    /** Text of every child element that has no element children, keyed by local name. */
    private Map<String, String> leafFields(Element item) {
        Map<String, String> fields = new HashMap<>();
        for (Node n = item.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child && !hasElementChildren(child)) {
                String value = FeedValues.emptyToNull(child.getTextContent());
                if (value != null) {
                    fields.putIfAbsent(localName(child), value);
                }
            }
        }
        return fields;
    }

    private Map<String, Object> rawAttributes(Element item) {
        Map<String, Object> attributes = new TreeMap<>();
        for (Node n = item.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (!(n instanceof Element child) || hasElementChildren(child)) continue;

            String key = attributeKey(child);
            String text = FeedValues.emptyToNull(child.getTextContent());
            if (text != null && !MAPPED.contains(localName(child))) {
                attributes.putIfAbsent(key, FeedValues.scalar(text));
            }

            NamedNodeMap attrs = child.getAttributes();
            for (int a = 0; a < attrs.getLength(); a++) {
                Attr attr = (Attr) attrs.item(a);
                if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) continue;
                String value = FeedValues.emptyToNull(attr.getValue());
                if (value != null) {
                    attributes.putIfAbsent(key + "." + localName(attr), FeedValues.scalar(value));
                }
            }
        }
        return attributes;
    }

    // ── Geometry ─────────────────────────────────────────────────────────────

    private Geometry geometry(Map<String, String> fields, int index, String sourceId, List<ParseWarning> warnings) {
        String point = fields.get("point");
        if (point != null) {
            double[] latLon = numbers(point, 2);
            if (latLon != null) {
                return geometryFactory.createPoint(new Coordinate(latLon[1], latLon[0]));
            }
            warnings.add(new ParseWarning(FeedFormat.XML, index, sourceId, "unreadable georss:point '" + point + "'"));
        }

        String bbox = fields.get("bbox");
        if (bbox != null) {
            double[] b = numbers(bbox, 4);
            if (b != null) {
                Envelope envelope = new Envelope(b[0], b[1], b[2], b[3]);
                return envelope.getArea() > 0
                        ? geometryFactory.toGeometry(envelope)
                        : geometryFactory.createPoint(new Coordinate(envelope.getMinX(), envelope.getMinY()));
            }
            warnings.add(new ParseWarning(FeedFormat.XML, index, sourceId, "unreadable gdacs:bbox '" + bbox + "'"));
        }

        if (point == null && bbox == null) {
            warnings.add(new ParseWarning(FeedFormat.XML, index, sourceId, "no geometry, expecting GeoJSON to supply it"));
        }
        return null;
    }

    private double[] numbers(String text, int expected) {
        String[] parts = text.trim().split("[\\s,]+");
        if (parts.length != expected) return null;
        double[] values = new double[expected];
        try {
            for (int i = 0; i < expected; i++) {
                values[i] = Double.parseDouble(parts[i]);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return values;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Instant instant(Map<String, String> fields, String field, int index, String sourceId, List<ParseWarning> warnings) {
        String value = fields.get(field);
        if (value == null) return null;
        try {
            return FeedValues.parseInstant(value);
        } catch (DateTimeParseException e) {
            warnings.add(new ParseWarning(FeedFormat.XML, index, sourceId, "unparseable " + field + " '" + value + "'"));
            return null;
        }
    }

    private String attributeKey(Element element) {
        String ns = element.getNamespaceURI();
        String name = localName(element);
        if (DC_NS.equals(ns)) return "dc." + name;
        if (GEORSS_NS.equals(ns)) return "georss." + name;
        return name;
    }

    private boolean hasElementChildren(Element element) {
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) return true;
        }
        return false;
    }

    private Element firstChild(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element e && localName.equals(localName(e))) return e;
        }
        return null;
    }

    private String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }
}
