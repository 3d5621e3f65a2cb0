package com.delta.archivescraper.archive.http;

/**
 * Base type for every failure the fetch engine reports. {@link #reasonCode()} carries one of the
 * {@link com.delta.archivescraper.archive.util.ReasonCodeClassifier} codes.
 */
public class ArchiveFetchException extends RuntimeException {
    private final String reasonCode;

    public ArchiveFetchException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public ArchiveFetchException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
