package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.query.InvalidFetchRequestException;

import java.util.Locale;

/**
 * Archive service a request is sent to. The services share the record shape but differ in
 * endpoint layout, the name of the page-size parameter and how strictly they report quota.
 */
public enum ArchiveBackend {
    PULLPUSH("pullpush", "size", 100, false),
    ARCTIC_SHIFT("arcticshift", "limit", 100, true);

    private final String value;
    private final String sizeParam;
    private final int maxPageSize;
    private final boolean rateLimitHeadersRequired;

    ArchiveBackend(String value, String sizeParam, int maxPageSize, boolean rateLimitHeadersRequired) {
        this.value = value;
        this.sizeParam = sizeParam;
        this.maxPageSize = maxPageSize;
        this.rateLimitHeadersRequired = rateLimitHeadersRequired;
    }

    public String value() {
        return value;
    }

    public String sizeParam() {
        return sizeParam;
    }

    public int maxPageSize() {
        return maxPageSize;
    }

    /** Whether a successful answer without {@code X-RateLimit-*} headers counts as malformed. */
    public boolean rateLimitHeadersRequired() {
        return rateLimitHeadersRequired;
    }

    /** Path below the base URL, e.g. {@code submission/} or {@code posts/search}. */
    public String path(FetchMode mode, ArchiveLookup lookup) {
        if (this == PULLPUSH) {
            return mode.endpoint() + "/";
        }
        String endpoint = mode == FetchMode.SUBMISSIONS ? "posts" : "comments";
        return endpoint + "/" + lookup.value();
    }

    public static ArchiveBackend fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return PULLPUSH;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (ArchiveBackend backend : values()) {
            if (backend.value.equals(normalized)) {
                return backend;
            }
        }
        throw new InvalidFetchRequestException("backend should be one of [pullpush, arcticshift], got: " + raw);
    }
}
