package com.delta.archivescraper.archive.query;

import com.delta.archivescraper.archive.http.ArchiveFetchException;
import com.delta.archivescraper.archive.util.ReasonCodeClassifier;

public class InvalidFetchRequestException extends ArchiveFetchException {
    public InvalidFetchRequestException(String message) {
        super(ReasonCodeClassifier.INVALID_REQUEST, message);
    }

    public InvalidFetchRequestException(String message, Throwable cause) {
        super(ReasonCodeClassifier.INVALID_REQUEST, message, cause);
    }
}
