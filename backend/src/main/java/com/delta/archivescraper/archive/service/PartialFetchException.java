package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.http.ArchiveFetchException;
import com.delta.archivescraper.archive.model.FetchResult;
import com.delta.archivescraper.archive.model.StreamBoundary;
import com.delta.archivescraper.archive.util.ReasonCodeClassifier;

/**
 * A fetch stopped early. {@link #partialResult()} holds every record merged before the failure,
 * already sorted the way the request asked for.
 */
public class PartialFetchException extends ArchiveFetchException {
    private final transient FetchResult partialResult;
    private final transient StreamBoundary boundary;

    public PartialFetchException(FetchResult partialResult, StreamBoundary boundary, Throwable cause) {
        super(
            reasonCodeOf(cause),
            "Fetch stopped after " + partialResult.size() + " records: " + cause.getMessage(),
            cause
        );
        this.partialResult = partialResult;
        this.boundary = boundary;
    }

    public FetchResult partialResult() {
        return partialResult;
    }

    public StreamBoundary boundary() {
        return boundary;
    }

    /** True when nothing was retrieved before the failure. */
    public boolean isTotalFailure() {
        return partialResult.size() == 0;
    }

    private static String reasonCodeOf(Throwable cause) {
        if (cause instanceof ArchiveFetchException fetchException) {
            return fetchException.reasonCode();
        }
        if (cause instanceof InterruptedException) {
            return ReasonCodeClassifier.INTERRUPTED;
        }
        return ReasonCodeClassifier.UNKNOWN;
    }
}
