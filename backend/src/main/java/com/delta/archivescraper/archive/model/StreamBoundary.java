package com.delta.archivescraper.archive.model;

/**
 * Where a pagination stream stood when it stopped. Bounds are the exclusive wire bounds of the
 * next page it would have requested; null means unbounded.
 */
public record StreamBoundary(String streamId, Long after, Long before, int pagesFetched) {
    public String describe() {
        return streamId + " (after=" + after + ", before=" + before + ", pages=" + pagesFetched + ")";
    }
}
