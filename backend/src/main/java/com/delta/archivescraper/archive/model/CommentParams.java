package com.delta.archivescraper.archive.model;

import java.util.List;

public record CommentParams(
    String q,
    List<String> ids,
    String author,
    String subreddit,
    Long after,
    Long before,
    String linkId
) implements FetchParams {

    public CommentParams {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    public static CommentParams forLink(String linkId) {
        return new CommentParams(null, null, null, null, null, null, linkId);
    }

    @Override
    public FetchMode mode() {
        return FetchMode.COMMENTS;
    }

    @Override
    public CommentParams withTimeRange(Long after, Long before) {
        return new CommentParams(q, ids, author, subreddit, after, before, linkId);
    }
}
