package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.http.ArchiveFetchException;
import com.delta.archivescraper.archive.util.ReasonCodeClassifier;

import java.io.UncheckedIOException;

/** The fetch finished but its result could not be saved. */
public class ResultWriteException extends ArchiveFetchException {
    public ResultWriteException(String fileName, UncheckedIOException cause) {
        super(ReasonCodeClassifier.WRITE_FAILED, "Could not save result as " + fileName + ": " + cause.getMessage(), cause);
    }
}
