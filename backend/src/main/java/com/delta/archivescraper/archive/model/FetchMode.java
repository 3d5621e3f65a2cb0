package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.query.InvalidFetchRequestException;

import java.util.Locale;

public enum FetchMode {
    SUBMISSIONS("submissions", "submission"),
    COMMENTS("comments", "comment");

    private final String value;
    private final String endpoint;

    FetchMode(String value, String endpoint) {
        this.value = value;
        this.endpoint = endpoint;
    }

    public String value() {
        return value;
    }

    public String endpoint() {
        return endpoint;
    }

    public static FetchMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUBMISSIONS;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (FetchMode mode : values()) {
            if (mode.value.equals(normalized) || mode.endpoint.equals(normalized)) {
                return mode;
            }
        }
        throw new InvalidFetchRequestException("mode should be one of [submissions, comments], got: " + raw);
    }
}
