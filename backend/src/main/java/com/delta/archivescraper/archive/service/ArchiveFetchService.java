package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.merge.RecordMerger;
import com.delta.archivescraper.archive.merge.ResultSet;
import com.delta.archivescraper.archive.model.ArchiveQuery;
import com.delta.archivescraper.archive.model.ArchiveRecord;
import com.delta.archivescraper.archive.model.DuplicateAction;
import com.delta.archivescraper.archive.model.FetchParams;
import com.delta.archivescraper.archive.model.FetchRequest;
import com.delta.archivescraper.archive.model.FetchResult;
import com.delta.archivescraper.archive.model.PageCursor;
import com.delta.archivescraper.archive.model.SortType;
import com.delta.archivescraper.archive.model.StreamBoundary;
import com.delta.archivescraper.archive.query.ArchiveQueryBuilder;
import com.delta.archivescraper.archive.query.InvalidFetchRequestException;
import com.delta.archivescraper.archive.util.TimeRangeSplitter;
import com.delta.archivescraper.archive.util.TimeRangeSplitter.TimeSlice;
import com.delta.archivescraper.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for fetching from the archive. Picks a pagination strategy, runs it, orders and
 * optionally enriches the result, and writes it out when a file name is given.
 * <p>
 * A request with both time bounds (or only {@code after}, closed at now) is swept in parallel
 * slices. Anything else walks one cursor shared by the workers, capped at {@code limit} records or
 * a single page.
 */
@Service
public class ArchiveFetchService {
    private static final Logger log = LoggerFactory.getLogger(ArchiveFetchService.class);
    static final String PARTIAL_SUFFIX = "_partial";

    private final ArchiveQueryBuilder queryBuilder;
    private final PaginationTaskPool taskPool;
    private final CommentAttachmentService commentAttachmentService;
    private final ResultWriter resultWriter;
    private final ScraperProperties properties;

    public ArchiveFetchService(
        ArchiveQueryBuilder queryBuilder,
        PaginationTaskPool taskPool,
        CommentAttachmentService commentAttachmentService,
        ResultWriter resultWriter,
        ScraperProperties properties
    ) {
        this.queryBuilder = queryBuilder;
        this.taskPool = taskPool;
        this.commentAttachmentService = commentAttachmentService;
        this.resultWriter = resultWriter;
        this.properties = properties;
    }

    /**
     * @throws InvalidFetchRequestException before any request is sent when the request is unusable
     * @throws PartialFetchException        when a stream fails or the result cannot be saved; carries
     *                                      what was merged up to then
     */
    public FetchResult fetch(FetchRequest request) {
        Instant startedAt = Instant.now();
        queryBuilder.validate(request);
        DuplicateAction duplicateAction = request.duplicateAction() != null
            ? request.duplicateAction()
            : DuplicateAction.fromValue(properties.getDuplicateAction());
        int concurrency = request.concurrency() != null ? request.concurrency() : properties.getTaskNum();
        FetchPlan plan = plan(request, concurrency);

        ResultSet results = new ResultSet();
        RecordMerger merger = new RecordMerger(duplicateAction);
        try {
            taskPool.run(plan, merger, results);
            order(results, request, plan);
            if (request.getComments()) {
                int commentConcurrency = request.concurrency() != null ? request.concurrency() : properties.getCommentTaskNum();
                commentAttachmentService.attach(results, request, duplicateAction, commentConcurrency);
            }
        } catch (StreamFailureException e) {
            throw partialFailure(request, results, plan, startedAt, e.boundary(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw partialFailure(request, results, plan, startedAt, null, e);
        }

        FetchResult result = toResult(request, results, plan, startedAt);
        if (request.fileName() != null) {
            try {
                result = result.withFile(resultWriter.write(result, request.fileName()));
            } catch (UncheckedIOException e) {
                log.error("Fetched {} records but could not save them: {}", result.size(), e.getMessage());
                throw new PartialFetchException(result, null, new ResultWriteException(request.fileName(), e));
            }
        }
        log.info(
            "Fetched {} {} in {} ms ({} duplicate ids, {} stream(s))",
            result.size(),
            request.mode().value(),
            result.duration().toMillis(),
            result.duplicates().size(),
            result.streams()
        );
        return result;
    }

    FetchPlan plan(FetchRequest request, int concurrency) {
        FetchParams params = request.params();
        if (params.after() != null) {
            long upper = params.before() != null ? params.before() : Instant.now().getEpochSecond();
            if (upper <= params.after()) {
                throw new InvalidFetchRequestException("'after' must lie in the past when 'before' is not given");
            }
            if (upper - params.after() < 2) {
                throw new InvalidFetchRequestException("No second lies strictly between 'after' and 'before'");
            }
            ArchiveQuery query = queryBuilder.build(request, true);
            // slices cover the seconds strictly inside the exclusive bounds
            List<TimeSlice> slices = TimeRangeSplitter.split(params.after() + 1, upper - 1, concurrency);
            List<PageCursor> cursors = new ArrayList<>(slices.size());
            for (int i = 0; i < slices.size(); i++) {
                String streamId = "slice-" + (i + 1) + "/" + slices.size();
                cursors.add(PageCursor.forSlice(streamId, slices.get(i), request.sortOrder(), true));
            }
            return FetchPlan.timeSlices(query, cursors);
        }

        ArchiveQuery query = queryBuilder.build(request, false);
        if (!query.isPaged()) {
            // single-response lookup
            PageCursor cursor = PageCursor.forBounds("lookup", null, null, request.sortOrder(), request.limit(), false);
            return FetchPlan.handOff(query, cursor, 1);
        }
        int cap = request.limit() != null ? request.limit() : properties.getPageSize();
        PageCursor cursor = PageCursor.forBounds(
            "stream-1",
            null,
            params.before(),
            request.sortOrder(),
            cap,
            request.sortType() == SortType.CREATED_UTC
        );
        return FetchPlan.handOff(query, cursor, concurrency);
    }

    private static void order(ResultSet results, FetchRequest request, FetchPlan plan) {
        results.sort(request.sortType(), request.sortOrder());
        if (plan.strategy() == FetchPlan.Strategy.TIME_SLICE && request.limit() != null) {
            results.limitTo(request.limit());
        }
    }

    private PartialFetchException partialFailure(
        FetchRequest request,
        ResultSet results,
        FetchPlan plan,
        Instant startedAt,
        StreamBoundary boundary,
        Exception cause
    ) {
        results.sort(request.sortType(), request.sortOrder());
        FetchResult partial = toResult(request, results, plan, startedAt);
        log.error(
            "Fetch of {} stopped after {} records at {}: {}",
            request.mode().value(),
            partial.size(),
            boundary == null ? "<no stream>" : boundary.describe(),
            cause.getMessage()
        );
        if (request.fileName() != null && partial.size() > 0) {
            try {
                partial = partial.withFile(resultWriter.write(partial, request.fileName() + PARTIAL_SUFFIX));
            } catch (UncheckedIOException e) {
                log.warn("Could not persist partial result: {}", e.getMessage());
                cause.addSuppressed(e);
            }
        }
        return new PartialFetchException(partial, boundary, cause);
    }

    private static FetchResult toResult(FetchRequest request, ResultSet results, FetchPlan plan, Instant startedAt) {
        Map<String, ArchiveRecord> records = new LinkedHashMap<>();
        for (ArchiveRecord record : results.records()) {
            records.put(record.id(), record.withFields(request.fields()));
        }
        return new FetchResult(
            request.mode(),
            records,
            results.duplicates(),
            plan.cursors().size(),
            null,
            Duration.between(startedAt, Instant.now())
        );
    }
}
