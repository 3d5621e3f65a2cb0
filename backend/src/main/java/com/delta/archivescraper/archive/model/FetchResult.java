package com.delta.archivescraper.archive.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one fetch. {@code records} iterates in the requested order; {@code duplicates}
 * holds how often each repeated id was observed.
 */
public record FetchResult(
    FetchMode mode,
    Map<String, ArchiveRecord> records,
    Map<String, Integer> duplicates,
    int streams,
    Path file,
    Duration duration
) {
    public FetchResult {
        records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        duplicates = Collections.unmodifiableMap(new LinkedHashMap<>(duplicates == null ? Map.of() : duplicates));
    }

    public int size() {
        return records.size();
    }

    public FetchResult withFile(Path written) {
        return new FetchResult(mode, records, duplicates, streams, written, duration);
    }
}
