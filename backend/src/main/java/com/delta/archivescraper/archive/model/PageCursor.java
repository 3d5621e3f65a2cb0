package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.http.MalformedResponseException;
import com.delta.archivescraper.archive.util.TimeRangeSplitter.TimeSlice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Mutable pagination state of one stream. Bounds are exclusive on the wire: the archive returns
 * records with {@code after < created_utc < before}. Descending streams walk {@code before} down,
 * ascending streams walk {@code after} up, so the record a page ended on is never requested again.
 * <p>
 * Not thread-safe. A cursor is owned by exactly one worker at a time.
 */
public final class PageCursor {
    private static final Logger log = LoggerFactory.getLogger(PageCursor.class);

    private final String streamId;
    private final SortOrder direction;
    private final boolean paginated;
    private final Long initialAfter;
    private final Long initialBefore;
    private Long after;
    private Long before;
    private Integer remaining;
    private int pages;
    private Long lastSortKey;
    private boolean exhausted;

    private PageCursor(
        String streamId,
        Long after,
        Long before,
        SortOrder direction,
        Integer remaining,
        boolean paginated
    ) {
        this.streamId = streamId;
        this.after = after;
        this.before = before;
        this.initialAfter = after;
        this.initialBefore = before;
        this.direction = direction == null ? SortOrder.DESC : direction;
        this.remaining = remaining;
        this.paginated = paginated;
        this.exhausted = remaining != null && remaining <= 0;
    }

    /**
     * Cursor over explicit exclusive wire bounds, either of which may be open.
     *
     * @param remaining total record cap for the stream, or null for no cap
     * @param paginated false when the sort key cannot drive a time cursor; the stream then stops after one page
     */
    public static PageCursor forBounds(
        String streamId,
        Long after,
        Long before,
        SortOrder direction,
        Integer remaining,
        boolean paginated
    ) {
        return new PageCursor(streamId, after, before, direction, remaining, paginated);
    }

    /** Cursor covering every second of the inclusive slice. */
    public static PageCursor forSlice(String streamId, TimeSlice slice, SortOrder direction, boolean paginated) {
        return new PageCursor(streamId, slice.start() - 1, slice.end() + 1, direction, null, paginated);
    }

    public int requestSize(int pageSize) {
        return remaining == null ? pageSize : Math.max(0, Math.min(pageSize, remaining));
    }

    /**
     * Consumes one page of results: trims it to the remaining quota, moves the bound to the last
     * record's creation time and decides whether the stream is done.
     *
     * @return the records that count towards this stream
     */
    public List<ArchiveRecord> advance(List<ArchiveRecord> records, int requestedSize) {
        pages++;
        List<ArchiveRecord> accepted = records;
        if (remaining != null && accepted.size() > remaining) {
            accepted = accepted.subList(0, remaining);
        }
        if (remaining != null) {
            remaining -= accepted.size();
        }
        if (accepted.isEmpty()) {
            exhausted = true;
            return accepted;
        }
        if (records.size() < requestedSize || (remaining != null && remaining <= 0) || !paginated) {
            exhausted = true;
        }

        Long key = accepted.get(accepted.size() - 1).createdUtc();
        if (key == null) {
            if (paginated) {
                throw new MalformedResponseException("Record " + accepted.get(accepted.size() - 1).id() + " without created_utc");
            }
            return accepted;
        }
        moveBound(key);
        lastSortKey = key;
        return accepted;
    }

    private void moveBound(long key) {
        if (direction == SortOrder.DESC) {
            if (before != null && key >= before) {
                log.warn("Stream {} page did not move below before={} (last created_utc={}); stopping", streamId, before, key);
                exhausted = true;
                return;
            }
            before = key;
            if (after != null && key <= after + 1) {
                exhausted = true;
            }
        } else {
            if (after != null && key <= after) {
                log.warn("Stream {} page did not move above after={} (last created_utc={}); stopping", streamId, after, key);
                exhausted = true;
                return;
            }
            after = key;
            if (before != null && key >= before - 1) {
                exhausted = true;
            }
        }
    }

    /** Share of the stream's time range already walked, 0..100; -1 when the range is open. */
    public int progressPercent() {
        if (initialAfter == null || initialBefore == null || initialBefore - initialAfter <= 1) {
            return -1;
        }
        if (exhausted) {
            return 100;
        }
        double span = initialBefore - initialAfter;
        double walked = direction == SortOrder.DESC ? initialBefore - before : after - initialAfter;
        return (int) Math.max(0, Math.min(100, Math.round(walked * 100.0 / span)));
    }

    public StreamBoundary boundary() {
        return new StreamBoundary(streamId, after, before, pages);
    }

    public String streamId() {
        return streamId;
    }

    public SortOrder direction() {
        return direction;
    }

    public Long after() {
        return after;
    }

    public Long before() {
        return before;
    }

    public Integer remaining() {
        return remaining;
    }

    public int pages() {
        return pages;
    }

    public Long lastSortKey() {
        return lastSortKey;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public boolean isPaginated() {
        return paginated;
    }
}
