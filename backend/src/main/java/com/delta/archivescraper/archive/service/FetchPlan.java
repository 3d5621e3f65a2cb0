package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.model.ArchiveQuery;
import com.delta.archivescraper.archive.model.PageCursor;

import java.util.List;

/**
 * How a fetch is spread over workers.
 *
 * @param query   endpoint query without cursor bounds
 * @param cursors one cursor per stream; a hand-off plan has exactly one
 * @param workers number of concurrent workers
 */
public record FetchPlan(ArchiveQuery query, Strategy strategy, List<PageCursor> cursors, int workers) {

    public enum Strategy {
        /** One cursor passed between workers, a page at a time. */
        HAND_OFF,
        /** Independent cursors, one per contiguous slice of the time range. */
        TIME_SLICE
    }

    public FetchPlan {
        cursors = List.copyOf(cursors);
        workers = Math.max(1, workers);
    }

    public static FetchPlan handOff(ArchiveQuery query, PageCursor cursor, int workers) {
        return new FetchPlan(query, Strategy.HAND_OFF, List.of(cursor), workers);
    }

    public static FetchPlan timeSlices(ArchiveQuery query, List<PageCursor> cursors) {
        return new FetchPlan(query, Strategy.TIME_SLICE, cursors, cursors.size());
    }
}
