package com.delta.archivescraper.archive.model;

import java.util.List;

public record SubmissionParams(
    String q,
    List<String> ids,
    String author,
    String subreddit,
    Long after,
    Long before,
    String title,
    String selftext,
    String score,
    String numComments
) implements FetchParams {

    public SubmissionParams {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    public static SubmissionParams forSubreddit(String subreddit, Long after, Long before) {
        return new SubmissionParams(null, null, null, subreddit, after, before, null, null, null, null);
    }

    @Override
    public FetchMode mode() {
        return FetchMode.SUBMISSIONS;
    }

    @Override
    public SubmissionParams withTimeRange(Long after, Long before) {
        return new SubmissionParams(q, ids, author, subreddit, after, before, title, selftext, score, numComments);
    }
}
