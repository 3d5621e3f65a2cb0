package com.delta.archivescraper.archive.model;

import java.util.List;

/**
 * Filter parameters for one fetch, tagged by the archive backend and endpoint they target.
 * Time bounds are epoch seconds and exclusive on both ends, as the archive reads them.
 */
public sealed interface FetchParams permits SubmissionParams, CommentParams, ArcticShiftParams {

    FetchMode mode();

    default ArchiveBackend backend() {
        return ArchiveBackend.PULLPUSH;
    }

    String q();

    List<String> ids();

    String author();

    String subreddit();

    Long after();

    Long before();

    FetchParams withTimeRange(Long after, Long before);
}
