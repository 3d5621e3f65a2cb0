package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.query.InvalidFetchRequestException;

import java.util.Locale;

/**
 * What to keep when the archive returns several variants of the same record id.
 */
public enum DuplicateAction {
    /** Variant with the most recent last-seen signal wins. */
    KEEP_NEWEST("keep_newest"),
    /** First stored variant wins. */
    KEEP_OLDEST("keep_oldest"),
    /** Every variant is dropped and the id stays out of the result. */
    REMOVE("remove"),
    /** Variant without a removal marker wins, recovering content captured before deletion. */
    KEEP_ORIGINAL("keep_original"),
    /** Variant carrying a removal marker wins. */
    KEEP_REMOVED("keep_removed");

    private final String value;

    DuplicateAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DuplicateAction fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return KEEP_NEWEST;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DuplicateAction action : values()) {
            if (action.value.equals(normalized)) {
                return action;
            }
        }
        throw new InvalidFetchRequestException(
            "duplicate_action should be one of [keep_newest, keep_oldest, remove, keep_original, keep_removed], got: " + raw
        );
    }
}
