package com.delta.archivescraper.archive.retry;

import com.delta.archivescraper.archive.http.MalformedResponseException;
import com.delta.archivescraper.archive.http.NonRetryableResponseException;
import com.delta.archivescraper.archive.model.ArchiveResponse;
import com.delta.archivescraper.archive.util.ReasonCodeClassifier;
import com.delta.archivescraper.config.ScraperProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one logical request with up to {@code max-retries} attempts and linear backoff
 * ({@code backoff-sec * attempt}) between them.
 */
@Component
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final ScraperProperties properties;

    public RetryPolicy(ScraperProperties properties) {
        this.properties = properties;
    }

    @FunctionalInterface
    public interface Attempt {
        ArchiveResponse send() throws InterruptedException;
    }

    /**
     * @return the first response carrying a decodable {@code data} array, even an empty one
     * @throws RetryExhaustedException when every attempt failed transiently
     * @throws NonRetryableResponseException on a client error that a retry cannot fix
     * @throws MalformedResponseException when the archive answered successfully with an unusable body
     */
    public ArchiveResponse execute(String label, Attempt attempt) throws InterruptedException {
        int maxAttempts = properties.getMaxRetries();
        String lastReason = ReasonCodeClassifier.UNKNOWN;
        String lastMessage = null;
        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            ArchiveResponse response = attempt.send();
            String reason = classify(response);
            if (reason == null) {
                return requireData(response);
            }
            if (ReasonCodeClassifier.INTERRUPTED.equals(reason)) {
                throw new InterruptedException("Interrupted while fetching " + label);
            }
            if (ReasonCodeClassifier.MALFORMED_RESPONSE.equals(reason)) {
                throw new MalformedResponseException("Undecodable response from " + response.requestedUrl() + ": " + response.errorMessage());
            }
            if (!ReasonCodeClassifier.isRetryable(reason)) {
                throw new NonRetryableResponseException(
                    reason,
                    response.statusCode(),
                    "Archive rejected " + response.requestedUrl() + " with " + describe(response)
                );
            }
            lastReason = reason;
            lastMessage = describe(response);
            if (attemptNumber < maxAttempts) {
                long backoffMs = backoffMillis(attemptNumber);
                log.warn(
                    "Attempt {}/{} for {} failed ({}); retrying in {} ms",
                    attemptNumber,
                    maxAttempts,
                    label,
                    lastMessage,
                    backoffMs
                );
                if (backoffMs > 0) {
                    Thread.sleep(backoffMs);
                }
            }
        }
        throw new RetryExhaustedException(label, maxAttempts, lastReason, lastMessage);
    }

    long backoffMillis(int attemptNumber) {
        return Math.round(properties.getBackoffSec() * 1000.0 * attemptNumber);
    }

    private static String classify(ArchiveResponse response) {
        if (response == null) {
            return ReasonCodeClassifier.IO_ERROR;
        }
        if (response.errorCode() != null) {
            return ReasonCodeClassifier.fromErrorCode(response.errorCode(), response.errorMessage());
        }
        if (response.isSuccessful()) {
            return null;
        }
        return ReasonCodeClassifier.fromHttpStatus(response.statusCode());
    }

    private static ArchiveResponse requireData(ArchiveResponse response) {
        JsonNode body = response.body();
        if (body == null || !body.has("data") || !body.get("data").isArray()) {
            throw new MalformedResponseException("Response from " + response.requestedUrl() + " has no 'data' array");
        }
        return response;
    }

    private static String describe(ArchiveResponse response) {
        if (response == null) {
            return "no response";
        }
        if (response.errorCode() != null) {
            return response.errorCode() + (response.errorMessage() == null ? "" : ": " + response.errorMessage());
        }
        return "HTTP " + response.statusCode();
    }
}
