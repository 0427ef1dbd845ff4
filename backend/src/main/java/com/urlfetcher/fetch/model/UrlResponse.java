package com.urlfetcher.fetch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Body captured from a single HTTP GET. Never mutated after construction; a later fetch of the
 * same URL produces a new instance.
 */
public record UrlResponse(String url, String body, Instant timestamp) {
    public UrlResponse {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(timestamp, "timestamp");
        body = body == null ? "" : body;
    }
}
