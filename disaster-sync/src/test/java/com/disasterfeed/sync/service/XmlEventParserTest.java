package com.disasterfeed.sync.service;

import com.disasterfeed.sync.TestFeeds;
import com.disasterfeed.sync.exception.FeedParseException;
import com.disasterfeed.sync.model.AlertLevel;
import com.disasterfeed.sync.model.DisasterEvent;
import com.disasterfeed.sync.model.EventType;
import com.disasterfeed.sync.model.FeedFormat;
import com.disasterfeed.sync.model.ParseResult;
import com.disasterfeed.sync.model.ParseWarning;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlEventParserTest {

    private final XmlEventParser parser = new XmlEventParser(TestFeeds.GEOMETRY);

    private ParseResult sample() {
        return parser.parse(TestFeeds.resource(FeedFormat.XML, "/feeds/gdacs-rss.xml"));
    }

    @Test
    @DisplayName("maps item tags onto the event schema")
    void parse_mapsItem() {
        DisasterEvent quake = sample().events().get(0);

        assertThat(quake.getSourceId()).isEqualTo("EQ1453422");
        assertThat(quake.getEventType()).isEqualTo(EventType.EARTHQUAKE);
        assertThat(quake.getSeverity()).isEqualTo(AlertLevel.ORANGE);
        assertThat(quake.getEpisodeId()).isEqualTo("1592391");
        assertThat(quake.getCountry()).isEqualTo("Japan");
        assertThat(quake.getTitle()).startsWith("Green earthquake alert");
        assertThat(quake.getLink()).isEqualTo("https://www.gdacs.org/report.aspx?eventtype=EQ&eventid=1453422");
        assertThat(quake.getOccurredAt()).isEqualTo(Instant.parse("2024-10-14T06:00:00Z"));
        assertThat(quake.getEndsAt()).isEqualTo(Instant.parse("2024-10-14T06:00:00Z"));
    }

    @Test
    @DisplayName("georss:point is lat/lon and takes precedence over the bbox")
    void parse_pointGeometry() {
        DisasterEvent quake = sample().events().get(0);

        assertThat(quake.getGeometry()).isInstanceOf(Point.class);
        assertThat(quake.getGeometry().getCoordinate().x).isEqualTo(142.1);
        assertThat(quake.getGeometry().getCoordinate().y).isEqualTo(38.2);
        assertThat(quake.getGeometry().getSRID()).isEqualTo(4326);
    }

    @Test
    @DisplayName("falls back to gdacs:bbox as a polygon")
    void parse_bboxGeometry() {
        DisasterEvent cyclone = sample().events().get(1);

        assertThat(cyclone.getSourceId()).isEqualTo("TC1001105");
        assertThat(cyclone.getGeometry()).isInstanceOf(Polygon.class);
        assertThat(cyclone.getGeometry().getEnvelopeInternal().getMinX()).isEqualTo(-90.0);
        assertThat(cyclone.getGeometry().getEnvelopeInternal().getMaxY()).isEqualTo(30.0);
        assertThat(cyclone.getEndsAt()).isNull();
    }

    @Test
    @DisplayName("keeps leaf elements and attributes as raw attributes, skipping nested blocks")
    void parse_rawAttributes() {
        DisasterEvent quake = sample().events().get(0);

        assertThat(quake.getRawAttributes())
                .containsEntry("severity", "Magnitude 4.6M, Depth:10km")
                .containsEntry("severity.unit", "M")
                .containsEntry("severity.value", new BigDecimal("4.6"))
                .containsEntry("dc.subject", "EQ1")
                .containsEntry("guid.isPermaLink", Boolean.FALSE)
                .containsEntry("iscurrent", Boolean.TRUE)
                .doesNotContainKeys("resources", "title", "eventid", "bbox", "georss.point");
    }

    @Test
    @DisplayName("drops items without identity, keeps items without geometry, warns for both")
    void parse_warnings() {
        ParseResult result = sample();

        assertThat(result.events()).extracting(DisasterEvent::getSourceId)
                .containsExactly("EQ1453422", "TC1001105", "VO1000123");
        assertThat(result.events().get(2).getGeometry()).isNull();

        assertThat(result.warnings()).extracting(ParseWarning::index).containsExactly(2, 3);
        assertThat(result.warnings().get(0).identifier()).isNull();
        assertThat(result.warnings().get(1).identifier()).isEqualTo("VO1000123");
    }

    @Test
    @DisplayName("a malformed point falls back to the bbox with a warning")
    void parse_badPoint() {
        String body = TestFeeds.rss(TestFeeds.item("EQ", "5",
                "<georss:point>north 12</georss:point><gdacs:bbox>1 2 3 3</gdacs:bbox>"));

        ParseResult result = parser.parse(TestFeeds.xml(body));

        DisasterEvent event = result.events().get(0);
        assertThat(event.getGeometry()).isInstanceOf(Point.class);
        assertThat(event.getGeometry().getCoordinate().x).isEqualTo(1.0);
        assertThat(result.warnings()).singleElement()
                .satisfies(w -> assertThat(w.reason()).contains("georss:point"));
    }

    @Test
    @DisplayName("a channel with no items means no active events")
    void parse_zeroItems() {
        ParseResult result = parser.parse(TestFeeds.xml(TestFeeds.rss()));

        assertThat(result.events()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("empty, malformed or foreign documents fail the whole parse")
    void parse_documentFailures() {
        assertThatThrownBy(() -> parser.parse(TestFeeds.xml("")))
                .isInstanceOf(FeedParseException.class)
                .hasMessageContaining("empty payload");
        assertThatThrownBy(() -> parser.parse(TestFeeds.xml("<rss><channel>")))
                .isInstanceOf(FeedParseException.class)
                .hasMessageContaining("well-formed");
        assertThatThrownBy(() -> parser.parse(TestFeeds.xml("<html><body>maintenance</body></html>")))
                .isInstanceOf(FeedParseException.class)
                .hasMessageContaining("<html>");
    }

    @Test
    @DisplayName("refuses documents with a DOCTYPE")
    void parse_rejectsDoctype() {
        String body = "<?xml version=\"1.0\"?><!DOCTYPE rss [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                + "<rss><channel><item>&x;</item></channel></rss>";

        assertThatThrownBy(() -> parser.parse(TestFeeds.xml(body)))
                .isInstanceOf(FeedParseException.class);
    }
}
