package com.delta.archivescraper.archive.model;

import java.util.List;

/**
 * Filters for the Arctic Shift {@code posts} and {@code comments} endpoints. The free-text term
 * is sent as {@code query} for posts and {@code body} for comments. A non-empty {@code ids} list
 * switches the request to the {@code ids} lookup, which takes no other filter.
 */
public record ArcticShiftParams(
    FetchMode mode,
    String q,
    List<String> ids,
    String author,
    String subreddit,
    Long after,
    Long before,
    String title,
    String selftext,
    String linkId
) implements FetchParams {

    public ArcticShiftParams {
        mode = mode == null ? FetchMode.SUBMISSIONS : mode;
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    public static ArcticShiftParams forLink(String linkId) {
        return new ArcticShiftParams(FetchMode.COMMENTS, null, null, null, null, null, null, null, null, linkId);
    }

    @Override
    public ArchiveBackend backend() {
        return ArchiveBackend.ARCTIC_SHIFT;
    }

    public ArchiveLookup lookup() {
        return ids.isEmpty() ? ArchiveLookup.SEARCH : ArchiveLookup.IDS;
    }

    @Override
    public ArcticShiftParams withTimeRange(Long after, Long before) {
        return new ArcticShiftParams(mode, q, ids, author, subreddit, after, before, title, selftext, linkId);
    }
}
