package com.delta.archivescraper.archive.pacing;

import com.delta.archivescraper.archive.model.PaceMode;
import com.delta.archivescraper.archive.model.PacerStatus;
import com.delta.archivescraper.archive.model.RateLimitSignal;
import com.delta.archivescraper.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Spaces out requests to the archive across all concurrent streams.
 * <p>
 * Every caller reserves a send slot under the lock and sleeps outside of it, so two streams never
 * claim the same slot or the same quota unit. In the auto modes a local request pool is refilled
 * once per window, and a server signal of zero remaining requests holds everyone until the reset.
 */
@Component
public class Pacer {
    private static final Logger log = LoggerFactory.getLogger(Pacer.class);

    private final Object lock = new Object();
    private final ScraperProperties.RateLimit limits;
    private final long sleepMs;
    private final RateState state;

    public Pacer(ScraperProperties properties) {
        this.limits = properties.getRateLimit();
        this.sleepMs = secondsToMillis(properties.getSleepSec());
        PaceMode mode = PaceMode.fromValue(properties.getPaceMode());
        int capacity = switch (mode) {
            case AUTO_SOFT -> limits.getMaxPoolSoft();
            case AUTO_HARD -> limits.getMaxPoolHard();
            case MANUAL -> 0;
        };
        this.state = new RateState(mode, capacity, unsignaledDelayMs(mode), Instant.now());
        log.info("Pacer started in {} mode with delay {} ms", mode.value(), state.delayMs);
    }

    /**
     * Blocks until the next request may be sent and counts it as sent.
     *
     * @throws InterruptedException when the calling stream is cancelled while waiting
     */
    public void acquire() throws InterruptedException {
        long waitMs;
        synchronized (lock) {
            Instant now = Instant.now();
            Instant slot = latest(now, state.nextAllowedAt, state.cooldownUntil);
            if (state.mode != PaceMode.MANUAL) {
                slot = reservePoolSlot(slot);
                slot = reserveServerQuota(slot);
            }
            state.nextAllowedAt = slot.plusMillis(state.delayMs);
            state.requestsIssued++;
            waitMs = Duration.between(now, slot).toMillis();
        }
        if (waitMs > 0) {
            log.debug("Pacer holding request for {} ms", waitMs);
            Thread.sleep(waitMs);
        }
    }

    /** Adapts the delay to the quota reported with the latest response. */
    public void update(RateLimitSignal signal) {
        if (signal == null) {
            return;
        }
        synchronized (lock) {
            Instant now = Instant.now();
            state.serverRemaining = signal.remaining();
            state.serverResetAt = now.plusMillis(secondsToMillis(signal.resetSeconds()));
            if (state.mode == PaceMode.MANUAL) {
                return;
            }
            int effective = signal.remaining() - limits.getSafetyMargin();
            long maxPaceMs = secondsToMillis(limits.getMaxPaceSec());
            // with no usable quota left, slow down to one request per reset window
            long spacingMs = effective > 0
                ? secondsToMillis(signal.resetSeconds() / effective)
                : Math.max(1000L, secondsToMillis(signal.resetSeconds()));
            long delay = state.mode == PaceMode.AUTO_HARD
                ? Math.min(spacingMs, maxPaceMs)
                : Math.max(sleepMs, Math.min(spacingMs, maxPaceMs));
            if (delay != state.delayMs) {
                log.debug("Pacer delay {} -> {} ms (remaining={}, reset={}s)", state.delayMs, delay, signal.remaining(), signal.resetSeconds());
            }
            state.delayMs = delay;
        }
    }

    /** Holds every stream for at least {@code duration}, typically after a 429. */
    public void cooldown(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            if (candidate.isAfter(state.cooldownUntil)) {
                state.cooldownUntil = candidate;
                log.warn("Rate limited by the archive; cooling down all streams for {} ms", duration.toMillis());
            }
        }
    }

    public PacerStatus status() {
        synchronized (lock) {
            boolean pooled = state.mode != PaceMode.MANUAL;
            return new PacerStatus(
                state.mode.value(),
                state.delayMs,
                pooled ? state.poolAvailable : null,
                pooled ? state.poolCapacity : null,
                state.serverRemaining,
                state.serverResetAt,
                state.nextAllowedAt,
                state.cooldownUntil,
                state.requestsIssued
            );
        }
    }

    public long currentDelayMs() {
        synchronized (lock) {
            return state.delayMs;
        }
    }

    private Instant reservePoolSlot(Instant slot) {
        Instant refillAt = state.poolRefilledAt.plusMillis(limits.getRefillMs());
        if (!slot.isBefore(refillAt)) {
            state.poolAvailable = state.poolCapacity;
            state.poolRefilledAt = slot;
        } else if (state.poolAvailable <= 0) {
            log.info("Local request pool empty; waiting {} ms for refill", Duration.between(slot, refillAt).toMillis());
            slot = refillAt;
            state.poolAvailable = state.poolCapacity;
            state.poolRefilledAt = refillAt;
        }
        state.poolAvailable--;
        return slot;
    }

    private Instant reserveServerQuota(Instant slot) {
        if (state.serverRemaining == null || state.serverResetAt == null) {
            return slot;
        }
        if (!slot.isBefore(state.serverResetAt)) {
            state.serverRemaining = null;
            state.serverResetAt = null;
            state.delayMs = unsignaledDelayMs(state.mode);
            return slot;
        }
        if (state.serverRemaining - limits.getSafetyMargin() <= 0) {
            log.info("Archive quota used up; waiting until {}", state.serverResetAt);
            Instant resetAt = state.serverResetAt;
            state.serverRemaining = null;
            state.serverResetAt = null;
            return resetAt;
        }
        state.serverRemaining--;
        return slot;
    }

    private long unsignaledDelayMs(PaceMode mode) {
        if (mode == PaceMode.AUTO_SOFT) {
            return Math.max(sleepMs, limits.getRefillMs() / limits.getMaxPoolSoft());
        }
        return sleepMs;
    }

    private static Instant latest(Instant first, Instant second, Instant third) {
        Instant max = first.isAfter(second) ? first : second;
        return max.isAfter(third) ? max : third;
    }

    private static long secondsToMillis(double seconds) {
        return Math.max(0L, Math.round(seconds * 1000.0));
    }
}
