package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.merge.RecordMerger;
import com.delta.archivescraper.archive.merge.ResultSet;
import com.delta.archivescraper.archive.model.ArchiveQuery;
import com.delta.archivescraper.archive.model.Page;
import com.delta.archivescraper.archive.model.PageCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs pagination streams on the shared fetch executor and merges their pages. The first stream
 * that fails cancels the rest; records merged before that point stay in the result set, and no
 * merge happens once cancellation is flagged.
 */
@Service
public class PaginationTaskPool {
    private static final Logger log = LoggerFactory.getLogger(PaginationTaskPool.class);
    private static final long HAND_OFF_POLL_MS = 50;

    private final PageFetcher pageFetcher;
    private final ExecutorService fetchExecutor;

    public PaginationTaskPool(
        PageFetcher pageFetcher,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor
    ) {
        this.pageFetcher = pageFetcher;
        this.fetchExecutor = fetchExecutor;
    }

    @FunctionalInterface
    public interface StreamTask {
        void run() throws Exception;
    }

    /**
     * Drives the plan to completion, merging into {@code target}.
     *
     * @throws StreamFailureException naming the first stream that failed
     * @throws InterruptedException   when the calling thread is interrupted; all streams are cancelled
     */
    public void run(FetchPlan plan, RecordMerger merger, ResultSet target) throws InterruptedException {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        List<StreamTask> tasks = new ArrayList<>();
        if (plan.strategy() == FetchPlan.Strategy.HAND_OFF) {
            PageCursor cursor = plan.cursors().get(0);
            BlockingQueue<PageCursor> slot = new ArrayBlockingQueue<>(1);
            slot.add(cursor);
            AtomicBoolean finished = new AtomicBoolean(cursor.isExhausted());
            for (int i = 0; i < plan.workers(); i++) {
                tasks.add(() -> handOffWorker(plan.query(), slot, finished, merger, target, cancelled));
            }
        } else {
            for (PageCursor cursor : plan.cursors()) {
                tasks.add(() -> drain(plan.query(), cursor, merger, target, cancelled));
            }
        }
        log.info(
            "Starting {} {} stream(s) with {} worker(s) for {}",
            plan.cursors().size(),
            plan.strategy(),
            tasks.size(),
            plan.query().mode().endpoint()
        );
        runAll(tasks, cancelled, target);
    }

    /**
     * Pages one cursor to exhaustion on the calling thread.
     *
     * @throws StreamFailureException when a page cannot be fetched
     */
    public void drain(
        ArchiveQuery query,
        PageCursor cursor,
        RecordMerger merger,
        ResultSet target,
        AtomicBoolean cancelled
    ) throws InterruptedException {
        while (!cursor.isExhausted() && !cancelled.get()) {
            fetchAndMerge(query, cursor, merger, target, cancelled);
        }
    }

    /**
     * Submits every task and waits for all of them. On the first failure the others are
     * interrupted, and {@code cancelled} is raised while holding {@code mergeLock} so no merge
     * can slip in afterwards.
     */
    public void runAll(List<StreamTask> tasks, AtomicBoolean cancelled, Object mergeLock) throws InterruptedException {
        ExecutorCompletionService<Void> completion = new ExecutorCompletionService<>(fetchExecutor);
        List<Future<Void>> futures = new ArrayList<>(tasks.size());
        for (StreamTask task : tasks) {
            futures.add(completion.submit(() -> {
                task.run();
                return null;
            }));
        }

        Throwable failure = null;
        try {
            for (int i = 0; i < futures.size(); i++) {
                Future<Void> done = completion.take();
                try {
                    done.get();
                } catch (CancellationException e) {
                    log.debug("Stream task cancelled");
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = e.getCause();
                        cancelAll(futures, cancelled, mergeLock);
                    } else {
                        log.debug("Additional stream failure after cancellation: {}", e.getCause().toString());
                    }
                }
            }
        } catch (InterruptedException e) {
            cancelAll(futures, cancelled, mergeLock);
            throw e;
        }

        if (failure == null) {
            return;
        }
        if (failure instanceof StreamFailureException streamFailure) {
            throw streamFailure;
        }
        if (failure instanceof InterruptedException interrupted) {
            throw interrupted;
        }
        throw new StreamFailureException(null, failure);
    }

    private void handOffWorker(
        ArchiveQuery query,
        BlockingQueue<PageCursor> slot,
        AtomicBoolean finished,
        RecordMerger merger,
        ResultSet target,
        AtomicBoolean cancelled
    ) throws InterruptedException {
        while (!cancelled.get() && !finished.get()) {
            PageCursor cursor = slot.poll(HAND_OFF_POLL_MS, TimeUnit.MILLISECONDS);
            if (cursor == null) {
                continue;
            }
            boolean handBack = false;
            try {
                fetchAndMerge(query, cursor, merger, target, cancelled);
                handBack = !cursor.isExhausted();
            } finally {
                if (handBack) {
                    slot.offer(cursor);
                } else {
                    finished.set(true);
                }
            }
        }
    }

    private void fetchAndMerge(
        ArchiveQuery query,
        PageCursor cursor,
        RecordMerger merger,
        ResultSet target,
        AtomicBoolean cancelled
    ) throws InterruptedException {
        Page page;
        try {
            page = pageFetcher.nextPage(query, cursor);
        } catch (StreamFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Stream {} failed on page {}: {}", cursor.streamId(), cursor.pages() + 1, e.getMessage());
            throw new StreamFailureException(cursor.boundary(), e);
        }
        synchronized (target) {
            if (cancelled.get()) {
                return;
            }
            merger.merge(target, page.records());
        }
        logProgress(cursor, page);
    }

    private static void logProgress(PageCursor cursor, Page page) {
        int percent = cursor.progressPercent();
        if (percent >= 0) {
            log.info(
                "Stream {}: page {} returned {} records, {}% of range done",
                cursor.streamId(),
                cursor.pages(),
                page.records().size(),
                percent
            );
        } else {
            log.debug("Stream {}: page {} returned {} records", cursor.streamId(), cursor.pages(), page.records().size());
        }
    }

    private static void cancelAll(List<Future<Void>> futures, AtomicBoolean cancelled, Object mergeLock) {
        synchronized (mergeLock) {
            cancelled.set(true);
        }
        for (Future<Void> future : futures) {
            future.cancel(true);
        }
    }
}
