package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.query.InvalidFetchRequestException;

import java.util.Locale;

public enum PaceMode {
    MANUAL("manual"),
    AUTO_SOFT("auto-soft"),
    AUTO_HARD("auto-hard");

    private final String value;

    PaceMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static PaceMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO_HARD;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (PaceMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new InvalidFetchRequestException("pace_mode should be one of [auto-soft, auto-hard, manual], got: " + raw);
    }
}
