package com.delta.archivescraper.archive.model;

/**
 * Server-side quota as reported with a response: requests left in the current window and
 * seconds until the window resets.
 */
public record RateLimitSignal(int remaining, double resetSeconds) {
    public RateLimitSignal {
        remaining = Math.max(0, remaining);
        resetSeconds = Math.max(0.0, resetSeconds);
    }
}
