package com.disasterfeed.sync.service;

import com.disasterfeed.sync.model.EventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedValuesTest {

    @Test
    @DisplayName("sourceId joins the uppercased type code and the event id")
    void sourceId() {
        assertThat(FeedValues.sourceId("eq", " 001 ")).isEqualTo("EQ001");
        assertThat(FeedValues.sourceId("EQ", "")).isNull();
        assertThat(FeedValues.sourceId(null, "1")).isNull();
    }

    @Test
    @DisplayName("parses every date shape the feeds publish as UTC instants")
    void parseInstant() {
        Instant expected = Instant.parse("2024-10-14T06:00:00Z");

        assertThat(FeedValues.parseInstant("Mon, 14 Oct 2024 06:00:00 GMT")).isEqualTo(expected);
        assertThat(FeedValues.parseInstant("2024-10-14T06:00:00")).isEqualTo(expected);
        assertThat(FeedValues.parseInstant("2024-10-14T08:00:00+02:00")).isEqualTo(expected);
        assertThat(FeedValues.parseInstant("2024-10-14")).isEqualTo(Instant.parse("2024-10-14T00:00:00Z"));
        assertThatThrownBy(() -> FeedValues.parseInstant("14/10/2024")).isInstanceOf(DateTimeParseException.class);
    }

    @Test
    @DisplayName("keeps numbers and booleans typed")
    void scalar() {
        assertThat(FeedValues.scalar("4.6")).isEqualTo(new BigDecimal("4.6"));
        assertThat(FeedValues.scalar("-12")).isEqualTo(new BigDecimal("-12"));
        assertThat(FeedValues.scalar("TRUE")).isEqualTo(Boolean.TRUE);
        assertThat(FeedValues.scalar(" Pop100km ")).isEqualTo("Pop100km");
    }

    @Test
    @DisplayName("unknown event codes map to OTHER, blank to null")
    void eventType() {
        assertThat(FeedValues.eventType("tc")).isEqualTo(EventType.TROPICAL_CYCLONE);
        assertThat(FeedValues.eventType("XX")).isEqualTo(EventType.OTHER);
        assertThat(FeedValues.eventType(" ")).isNull();
    }
}
