package com.disasterfeed.sync.model;

import java.util.Locale;

/**
 * GDACS alert level. Declaration order is severity order: GREEN &lt; ORANGE &lt; RED.
 */
public enum AlertLevel {
    GREEN, ORANGE, RED;

    /** Case-insensitive parse; null for blank or unrecognised values. */
    public static AlertLevel parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
