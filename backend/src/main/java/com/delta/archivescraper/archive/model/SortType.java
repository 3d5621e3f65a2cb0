package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.query.InvalidFetchRequestException;

import java.util.Locale;

public enum SortType {
    CREATED_UTC("created_utc"),
    SCORE("score"),
    NUM_COMMENTS("num_comments");

    private final String value;

    SortType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SortType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return CREATED_UTC;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SortType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidFetchRequestException("sort_type should be one of [created_utc, score, num_comments], got: " + raw);
    }
}
