package com.delta.archivescraper.archive.merge;

import com.delta.archivescraper.archive.model.ArchiveRecord;
import com.delta.archivescraper.archive.model.DuplicateAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Folds pages into a {@link ResultSet}, reconciling ids that arrive more than once according to a
 * {@link DuplicateAction}.
 */
public class RecordMerger {
    private static final Logger log = LoggerFactory.getLogger(RecordMerger.class);

    private final DuplicateAction action;

    public RecordMerger(DuplicateAction action) {
        this.action = action == null ? DuplicateAction.KEEP_NEWEST : action;
    }

    public DuplicateAction action() {
        return action;
    }

    public MergeStats merge(ResultSet target, List<ArchiveRecord> incoming) {
        int inserted = 0;
        int replaced = 0;
        int kept = 0;
        int removed = 0;
        int ignored = 0;
        synchronized (target) {
            for (ArchiveRecord record : incoming) {
                String id = record.id();
                target.observe(id);
                if (target.isTombstoned(id)) {
                    ignored++;
                    continue;
                }
                ArchiveRecord stored = target.get(id);
                if (stored == null) {
                    target.put(record);
                    inserted++;
                    continue;
                }
                if (action == DuplicateAction.REMOVE) {
                    target.tombstone(id);
                    removed++;
                } else if (prefersIncoming(stored, record)) {
                    target.put(record);
                    replaced++;
                } else {
                    kept++;
                }
            }
        }
        MergeStats stats = new MergeStats(inserted, replaced, kept, removed, ignored);
        if (stats.duplicates() > 0) {
            log.debug("Merged page with {} duplicate ids under {}: {}", stats.duplicates(), action.value(), stats);
        }
        return stats;
    }

    boolean prefersIncoming(ArchiveRecord stored, ArchiveRecord incoming) {
        return switch (action) {
            case KEEP_NEWEST -> incoming.lastSeen() >= stored.lastSeen();
            case KEEP_OLDEST, REMOVE -> false;
            case KEEP_ORIGINAL -> stored.isRemoved() == incoming.isRemoved()
                ? incoming.lastSeen() >= stored.lastSeen()
                : stored.isRemoved();
            case KEEP_REMOVED -> stored.isRemoved() == incoming.isRemoved()
                ? incoming.lastSeen() >= stored.lastSeen()
                : incoming.isRemoved();
        };
    }
}
