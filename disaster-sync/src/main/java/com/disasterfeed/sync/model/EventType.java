package com.disasterfeed.sync.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * GDACS event categories, keyed by the two-letter code both feeds use.
 */
public enum EventType {

    EARTHQUAKE("EQ"),
    TROPICAL_CYCLONE("TC"),
    FLOOD("FL"),
    VOLCANO("VO"),
    DROUGHT("DR"),
    WILDFIRE("WF"),
    OTHER("");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a feed code. Unknown but non-blank codes map to {@link #OTHER}; blank maps to null.
     */
    public static EventType fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        String normalised = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t != OTHER && t.code.equals(normalised))
                .findFirst()
                .orElse(OTHER);
    }
}
