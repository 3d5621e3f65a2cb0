package com.delta.archivescraper.archive.merge;

public record MergeStats(int inserted, int replaced, int kept, int removed, int ignored) {
    public static final MergeStats EMPTY = new MergeStats(0, 0, 0, 0, 0);

    public int duplicates() {
        return replaced + kept + removed;
    }

    public MergeStats plus(MergeStats other) {
        return new MergeStats(
            inserted + other.inserted,
            replaced + other.replaced,
            kept + other.kept,
            removed + other.removed,
            ignored + other.ignored
        );
    }
}
