package com.delta.archivescraper.archive.model;

/**
 * Kind of lookup behind an endpoint. Only {@link #SEARCH} is paged with time bounds; the other
 * lookups answer in one response.
 */
public enum ArchiveLookup {
    SEARCH("search", true),
    IDS("ids", false),
    TREE("tree", false);

    private final String value;
    private final boolean paged;

    ArchiveLookup(String value, boolean paged) {
        this.value = value;
        this.paged = paged;
    }

    public String value() {
        return value;
    }

    public boolean paged() {
        return paged;
    }
}
