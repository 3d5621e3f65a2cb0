package com.delta.archivescraper.archive.model;

import java.util.List;

public record Page(List<ArchiveRecord> records, PageCursor cursor, boolean exhausted) {
    public Page {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
