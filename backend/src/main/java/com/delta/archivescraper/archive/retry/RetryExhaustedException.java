package com.delta.archivescraper.archive.retry;

import com.delta.archivescraper.archive.http.ArchiveFetchException;
import com.delta.archivescraper.archive.util.ReasonCodeClassifier;

public class RetryExhaustedException extends ArchiveFetchException {
    private final int attempts;
    private final String lastReasonCode;

    public RetryExhaustedException(String label, int attempts, String lastReasonCode, String lastMessage) {
        super(
            ReasonCodeClassifier.RETRY_EXHAUSTED,
            "Retries exhausted for " + label + " after " + attempts + " attempts, last=" + lastReasonCode
                + (lastMessage == null || lastMessage.isBlank() ? "" : " (" + lastMessage + ")")
        );
        this.attempts = attempts;
        this.lastReasonCode = lastReasonCode;
    }

    public int attempts() {
        return attempts;
    }

    public String lastReasonCode() {
        return lastReasonCode;
    }
}
