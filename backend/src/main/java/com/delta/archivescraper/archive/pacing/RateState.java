package com.delta.archivescraper.archive.pacing;

import com.delta.archivescraper.archive.model.PaceMode;

import java.time.Instant;

/**
 * Pacing state shared by every stream of a {@link Pacer}. Only the pacer touches it, and only
 * while holding its lock.
 */
final class RateState {
    final PaceMode mode;
    final int poolCapacity;
    long delayMs;
    int poolAvailable;
    Instant poolRefilledAt;
    Integer serverRemaining;
    Instant serverResetAt;
    Instant nextAllowedAt;
    Instant cooldownUntil;
    long requestsIssued;

    RateState(PaceMode mode, int poolCapacity, long delayMs, Instant now) {
        this.mode = mode;
        this.poolCapacity = poolCapacity;
        this.delayMs = delayMs;
        this.poolAvailable = poolCapacity;
        this.poolRefilledAt = now;
        this.nextAllowedAt = now;
        this.cooldownUntil = now;
    }
}
