package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.http.ArchiveFetchException;
import com.delta.archivescraper.archive.model.StreamBoundary;
import com.delta.archivescraper.archive.util.ReasonCodeClassifier;

/**
 * A pagination stream hit an error it cannot recover from. Carries the stream's position so the
 * caller knows which part of the range is missing.
 */
public class StreamFailureException extends ArchiveFetchException {
    private final transient StreamBoundary boundary;

    public StreamFailureException(StreamBoundary boundary, Throwable cause) {
        super(
            cause instanceof ArchiveFetchException fetchException ? fetchException.reasonCode() : ReasonCodeClassifier.STREAM_FAILED,
            "Stream " + (boundary == null ? "<unknown>" : boundary.describe()) + " failed: " + cause.getMessage(),
            cause
        );
        this.boundary = boundary;
    }

    public StreamBoundary boundary() {
        return boundary;
    }
}
