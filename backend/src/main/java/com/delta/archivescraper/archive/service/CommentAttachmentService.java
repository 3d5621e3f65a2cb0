package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.merge.RecordMerger;
import com.delta.archivescraper.archive.merge.ResultSet;
import com.delta.archivescraper.archive.model.ArchiveQuery;
import com.delta.archivescraper.archive.model.ArchiveRecord;
import com.delta.archivescraper.archive.model.DuplicateAction;
import com.delta.archivescraper.archive.model.FetchRequest;
import com.delta.archivescraper.archive.model.PageCursor;
import com.delta.archivescraper.archive.query.ArchiveQueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches the comment thread of every submission in a finished result set and nests it under the
 * parent as a {@code comments} array.
 */
@Service
public class CommentAttachmentService {
    private static final Logger log = LoggerFactory.getLogger(CommentAttachmentService.class);

    private final ArchiveQueryBuilder queryBuilder;
    private final PaginationTaskPool taskPool;

    public CommentAttachmentService(ArchiveQueryBuilder queryBuilder, PaginationTaskPool taskPool) {
        this.queryBuilder = queryBuilder;
        this.taskPool = taskPool;
    }

    public void attach(
        ResultSet submissions,
        FetchRequest request,
        DuplicateAction duplicateAction,
        int concurrency
    ) throws InterruptedException {
        List<String> parentIds = submissions.ids();
        if (parentIds.isEmpty()) {
            return;
        }
        Queue<String> pending = new ConcurrentLinkedQueue<>(parentIds);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        AtomicInteger completed = new AtomicInteger();
        int workers = Math.max(1, Math.min(concurrency, parentIds.size()));
        log.info("Fetching comments for {} submissions with {} worker(s)", parentIds.size(), workers);

        List<PaginationTaskPool.StreamTask> tasks = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            tasks.add(() -> {
                String parentId;
                while (!cancelled.get() && (parentId = pending.poll()) != null) {
                    List<ArchiveRecord> comments = fetchThread(parentId, request, duplicateAction, cancelled);
                    synchronized (submissions) {
                        if (cancelled.get()) {
                            return;
                        }
                        ArchiveRecord parent = submissions.get(parentId);
                        if (parent != null) {
                            submissions.replace(parent.withComments(comments));
                        }
                    }
                    int done = completed.incrementAndGet();
                    log.debug("Attached {} comments to {} ({}/{})", comments.size(), parentId, done, parentIds.size());
                }
            });
        }
        taskPool.runAll(tasks, cancelled, submissions);
        log.info("Comment attachment finished for {} submissions", completed.get());
    }

    private List<ArchiveRecord> fetchThread(
        String parentId,
        FetchRequest request,
        DuplicateAction duplicateAction,
        AtomicBoolean cancelled
    ) throws InterruptedException {
        ArchiveQuery query = queryBuilder.buildForLink(parentId, request);
        PageCursor cursor = PageCursor.forBounds(
            "comments-" + parentId,
            null,
            null,
            request.sortOrder(),
            null,
            query.isPaged()
        );
        ResultSet thread = new ResultSet();
        taskPool.drain(query, cursor, new RecordMerger(duplicateAction), thread, cancelled);
        thread.sort(request.sortType(), request.sortOrder());
        return thread.records();
    }
}
