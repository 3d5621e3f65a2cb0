package com.delta.archivescraper.archive.model;

import java.util.List;
import java.util.Objects;

/**
 * Fully typed fetch request. {@code duplicateAction} and {@code concurrency} fall back to the
 * configured defaults when null.
 */
public record FetchRequest(
    FetchParams params,
    SortType sortType,
    SortOrder sortOrder,
    Integer limit,
    DuplicateAction duplicateAction,
    boolean getComments,
    Integer concurrency,
    String fileName,
    List<String> fields
) {
    public FetchRequest {
        Objects.requireNonNull(params, "params is required");
        sortType = sortType == null ? SortType.CREATED_UTC : sortType;
        sortOrder = sortOrder == null ? SortOrder.DESC : sortOrder;
        fields = fields == null ? List.of() : List.copyOf(fields);
        fileName = fileName == null || fileName.isBlank() ? null : fileName.trim();
    }

    public static FetchRequest of(FetchParams params) {
        return new FetchRequest(params, null, null, null, null, false, null, null, null);
    }

    public FetchMode mode() {
        return params.mode();
    }

    public FetchRequest withParams(FetchParams replacement) {
        return new FetchRequest(
            replacement, sortType, sortOrder, limit, duplicateAction, getComments, concurrency, fileName, fields
        );
    }
}
