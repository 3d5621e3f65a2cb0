package com.delta.archivescraper.archive.model;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Validated query against one archive endpoint. Immutable; cursor bounds are layered on with
 * {@link #with(String, Object)}.
 */
public record ArchiveQuery(
    String baseUrl,
    ArchiveBackend backend,
    FetchMode mode,
    ArchiveLookup lookup,
    Map<String, String> params
) {

    public ArchiveQuery {
        backend = backend == null ? ArchiveBackend.PULLPUSH : backend;
        lookup = lookup == null ? ArchiveLookup.SEARCH : lookup;
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params == null ? Map.of() : params));
    }

    /** PullPush search query. */
    public ArchiveQuery(String baseUrl, FetchMode mode, Map<String, String> params) {
        this(baseUrl, ArchiveBackend.PULLPUSH, mode, ArchiveLookup.SEARCH, params);
    }

    public ArchiveQuery with(String key, Object value) {
        Map<String, String> next = new LinkedHashMap<>(params);
        if (value == null) {
            next.remove(key);
        } else {
            next.put(key, String.valueOf(value));
        }
        return new ArchiveQuery(baseUrl, backend, mode, lookup, next);
    }

    public ArchiveQuery without(String key) {
        return with(key, null);
    }

    public String param(String key) {
        return params.get(key);
    }

    public boolean isPaged() {
        return lookup.paged();
    }

    public String toUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            query.add(encode(entry.getKey()) + "=" + encode(entry.getValue()));
        }
        String url = base + "/" + backend.path(mode, lookup);
        return query.length() == 0 ? url : url + "?" + query;
    }

    public URI toUri() {
        return URI.create(toUrl());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
