package com.delta.archivescraper.archive.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

public record ArchiveResponse(
    String requestedUrl,
    int statusCode,
    JsonNode body,
    RateLimitSignal rateLimit,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean hasRateLimit() {
        return rateLimit != null;
    }
}
