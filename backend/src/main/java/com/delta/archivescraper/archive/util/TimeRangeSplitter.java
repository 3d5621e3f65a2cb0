package com.delta.archivescraper.archive.util;

import java.util.ArrayList;
import java.util.List;

public final class TimeRangeSplitter {

    private TimeRangeSplitter() {}

    /**
     * Splits the inclusive range {@code [low, high]} into at most {@code parts} contiguous,
     * non-overlapping inclusive slices ordered oldest first. Earlier slices absorb the remainder.
     */
    public static List<TimeSlice> split(long low, long high, int parts) {
        if (high < low) {
            throw new IllegalArgumentException("high must not be lower than low");
        }
        long span = high - low + 1;
        int count = (int) Math.max(1, Math.min(parts, span));
        long segment = span / count;
        long remainder = span % count;

        List<TimeSlice> slices = new ArrayList<>(count);
        long current = low;
        for (int i = 0; i < count; i++) {
            long end = current + segment - 1;
            if (remainder > 0) {
                end++;
                remainder--;
            }
            slices.add(new TimeSlice(current, end));
            current = end + 1;
        }
        return slices;
    }

    public record TimeSlice(long start, long end) {
        public long span() {
            return end - start + 1;
        }
    }
}
