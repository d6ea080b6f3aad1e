package com.disasterfeed.sync.service;

import com.disasterfeed.sync.TestFeeds;
import com.disasterfeed.sync.model.DisasterEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class EventFingerprinterTest {

    private final EventFingerprinter fingerprinter = new EventFingerprinter();

    @Test
    @DisplayName("ring start point and winding do not change the fingerprint")
    void fingerprint_normalisesGeometry() {
        Polygon clockwise = square(new Coordinate(0, 0), new Coordinate(0, 1), new Coordinate(1, 1), new Coordinate(1, 0));
        Polygon rotated = square(new Coordinate(1, 1), new Coordinate(1, 0), new Coordinate(0, 0), new Coordinate(0, 1));
        Polygon counter = square(new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(1, 1), new Coordinate(0, 1));

        String a = fingerprinter.fingerprint(TestFeeds.event("FL1", 0, 0).geometry(clockwise).build());

        assertThat(fingerprinter.fingerprint(TestFeeds.event("FL1", 0, 0).geometry(rotated).build())).isEqualTo(a);
        assertThat(fingerprinter.fingerprint(TestFeeds.event("FL1", 0, 0).geometry(counter).build())).isEqualTo(a);
    }

    @Test
    @DisplayName("numeric attributes compare by value, not scale")
    void fingerprint_numericScale() {
        DisasterEvent a = TestFeeds.event("EQ1", 0, 0)
                .rawAttributes(new TreeMap<>(Map.of("magnitude", new BigDecimal("4.60")))).build();
        DisasterEvent b = TestFeeds.event("EQ1", 0, 0)
                .rawAttributes(new TreeMap<>(Map.of("magnitude", new BigDecimal("4.6")))).build();

        assertThat(fingerprinter.fingerprint(a)).isEqualTo(fingerprinter.fingerprint(b));
    }

    @Test
    @DisplayName("any mutable field changes the fingerprint")
    void fingerprint_detectsChange() {
        DisasterEvent base = TestFeeds.event("EQ1", 0, 0).title("t").build();

        assertThat(fingerprinter.fingerprint(base.toBuilder().title("t2").build()))
                .isNotEqualTo(fingerprinter.fingerprint(base));
        assertThat(fingerprinter.fingerprint(base.toBuilder().geometry(TestFeeds.GEOMETRY.createPoint(new Coordinate(0, 0.001))).build()))
                .isNotEqualTo(fingerprinter.fingerprint(base));
        assertThat(fingerprinter.fingerprint(base.toBuilder().rawAttributes(Map.of("k", "v")).build()))
                .isNotEqualTo(fingerprinter.fingerprint(base));
        assertThat(fingerprinter.fingerprint(base)).hasSize(64);
    }

    private Polygon square(Coordinate a, Coordinate b, Coordinate c, Coordinate d) {
        return TestFeeds.GEOMETRY.createPolygon(new Coordinate[]{a, b, c, d, a.copy()});
    }
}
