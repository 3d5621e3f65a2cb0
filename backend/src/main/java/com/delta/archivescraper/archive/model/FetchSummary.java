package com.delta.archivescraper.archive.model;

public record FetchSummary(
    String status,
    String mode,
    int recordCount,
    int duplicateIds,
    int streams,
    String filePath,
    long durationMs,
    String reasonCode,
    String message
) {
    public static final String STATUS_COMPLETE = "complete";
    public static final String STATUS_PARTIAL = "partial";
    public static final String STATUS_FAILED = "failed";

    public static FetchSummary complete(FetchResult result) {
        return new FetchSummary(
            STATUS_COMPLETE,
            result.mode().value(),
            result.size(),
            result.duplicates().size(),
            result.streams(),
            result.file() == null ? null : result.file().toString(),
            result.duration() == null ? 0L : result.duration().toMillis(),
            null,
            null
        );
    }
}
