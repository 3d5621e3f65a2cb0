package com.delta.archivescraper.archive.http;

public class NonRetryableResponseException extends ArchiveFetchException {
    private final int statusCode;

    public NonRetryableResponseException(String reasonCode, int statusCode, String message) {
        super(reasonCode, message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
