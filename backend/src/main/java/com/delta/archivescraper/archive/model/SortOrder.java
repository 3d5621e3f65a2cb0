package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.query.InvalidFetchRequestException;

import java.util.Locale;

public enum SortOrder {
    ASC("asc"),
    DESC("desc");

    private final String value;

    SortOrder(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SortOrder fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return DESC;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SortOrder order : values()) {
            if (order.value.equals(normalized)) {
                return order;
            }
        }
        throw new InvalidFetchRequestException("sort should be one of [asc, desc], got: " + raw);
    }
}
