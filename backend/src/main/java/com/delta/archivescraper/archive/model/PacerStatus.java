package com.delta.archivescraper.archive.model;

import java.time.Instant;

public record PacerStatus(
    String paceMode,
    long delayMs,
    Integer poolAvailable,
    Integer poolCapacity,
    Integer serverRemaining,
    Instant serverResetAt,
    Instant nextAllowedAt,
    Instant cooldownUntil,
    long requestsIssued
) {
}
