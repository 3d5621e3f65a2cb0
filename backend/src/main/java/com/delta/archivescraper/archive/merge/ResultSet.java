package com.delta.archivescraper.archive.merge;

import com.delta.archivescraper.archive.model.ArchiveRecord;
import com.delta.archivescraper.archive.model.SortOrder;
import com.delta.archivescraper.archive.model.SortType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records of one fetch keyed by id. Every method synchronizes on the instance, which is also the
 * lock {@link RecordMerger} holds for a whole page merge.
 */
public class ResultSet {
    private final LinkedHashMap<String, ArchiveRecord> records = new LinkedHashMap<>();
    private final Set<String> tombstones = new HashSet<>();
    private final LinkedHashMap<String, Integer> observations = new LinkedHashMap<>();

    public synchronized ArchiveRecord get(String id) {
        return records.get(id);
    }

    public synchronized boolean contains(String id) {
        return records.containsKey(id);
    }

    public synchronized boolean isTombstoned(String id) {
        return tombstones.contains(id);
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized boolean isEmpty() {
        return records.isEmpty();
    }

    public synchronized List<String> ids() {
        return new ArrayList<>(records.keySet());
    }

    public synchronized List<ArchiveRecord> records() {
        return new ArrayList<>(records.values());
    }

    public synchronized Map<String, ArchiveRecord> asMap() {
        return new LinkedHashMap<>(records);
    }

    /** Ids seen more than once, with how many variants of each arrived. */
    public synchronized Map<String, Integer> duplicates() {
        Map<String, Integer> repeated = new LinkedHashMap<>();
        observations.forEach((id, count) -> {
            if (count > 1) {
                repeated.put(id, count);
            }
        });
        return repeated;
    }

    synchronized void put(ArchiveRecord record) {
        records.put(record.id(), record);
    }

    synchronized void tombstone(String id) {
        records.remove(id);
        tombstones.add(id);
    }

    synchronized void observe(String id) {
        observations.merge(id, 1, Integer::sum);
    }

    /** Replaces a stored record in place, keeping its position. No-op for unknown ids. */
    public synchronized void replace(ArchiveRecord record) {
        if (records.containsKey(record.id())) {
            records.put(record.id(), record);
        }
    }

    /** Stable re-sort by the given key; equal keys keep their arrival order. */
    public synchronized void sort(SortType sortType, SortOrder order) {
        Comparator<ArchiveRecord> comparator = Comparator.comparingLong(record -> record.sortValue(sortType));
        if (order == SortOrder.DESC) {
            comparator = comparator.reversed();
        }
        List<ArchiveRecord> sorted = new ArrayList<>(records.values());
        sorted.sort(comparator);
        records.clear();
        for (ArchiveRecord record : sorted) {
            records.put(record.id(), record);
        }
    }

    /** Drops everything after the first {@code limit} records in the current order. */
    public synchronized void limitTo(int limit) {
        if (records.size() <= limit) {
            return;
        }
        List<String> overflow = new ArrayList<>(records.keySet()).subList(Math.max(0, limit), records.size());
        for (String id : new ArrayList<>(overflow)) {
            records.remove(id);
        }
    }
}
