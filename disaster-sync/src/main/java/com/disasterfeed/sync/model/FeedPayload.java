package com.disasterfeed.sync.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Raw document exactly as fetched from one of the upstream endpoints.
 */
public record FeedPayload(FeedFormat format, byte[] body, String origin, Instant fetchedAt) {

    public boolean isBlank() {
        return body == null || new String(body, StandardCharsets.UTF_8).isBlank();
    }

    public int size() {
        return body == null ? 0 : body.length;
    }
}
