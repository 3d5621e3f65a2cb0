package com.delta.archivescraper.archive.http;

import com.delta.archivescraper.archive.util.ReasonCodeClassifier;

public class MalformedResponseException extends ArchiveFetchException {
    public MalformedResponseException(String message) {
        super(ReasonCodeClassifier.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(ReasonCodeClassifier.MALFORMED_RESPONSE, message, cause);
    }
}
