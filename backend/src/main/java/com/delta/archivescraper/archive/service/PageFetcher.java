package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.http.ArchiveHttpClient;
import com.delta.archivescraper.archive.model.ArchiveLookup;
import com.delta.archivescraper.archive.model.ArchiveQuery;
import com.delta.archivescraper.archive.model.ArchiveRecord;
import com.delta.archivescraper.archive.model.ArchiveResponse;
import com.delta.archivescraper.archive.model.Page;
import com.delta.archivescraper.archive.model.PageCursor;
import com.delta.archivescraper.archive.pacing.Pacer;
import com.delta.archivescraper.archive.retry.RetryPolicy;
import com.delta.archivescraper.config.ScraperProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Service
public class PageFetcher {
    private final ArchiveHttpClient httpClient;
    private final Pacer pacer;
    private final RetryPolicy retryPolicy;
    private final ScraperProperties properties;

    public PageFetcher(
        ArchiveHttpClient httpClient,
        Pacer pacer,
        RetryPolicy retryPolicy,
        ScraperProperties properties
    ) {
        this.httpClient = httpClient;
        this.pacer = pacer;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
    }

    /**
     * Requests the page after the cursor's current position and advances the cursor past it.
     * An exhausted cursor yields an empty page without touching the network.
     */
    public Page nextPage(ArchiveQuery base, PageCursor cursor) throws InterruptedException {
        if (cursor.isExhausted()) {
            return new Page(List.of(), cursor, true);
        }
        int size = cursor.requestSize(Math.min(properties.getPageSize(), base.backend().maxPageSize()));
        ArchiveQuery query = base;
        if (base.isPaged()) {
            query = base
                .with("after", cursor.after())
                .with("before", cursor.before())
                .with(base.backend().sizeParam(), size);
        }
        String label = cursor.streamId() + " page " + (cursor.pages() + 1);
        ArchiveQuery request = query;
        ArchiveResponse response = retryPolicy.execute(label, () -> send(request));

        List<ArchiveRecord> records = decode(response.body().get("data"), base.lookup() == ArchiveLookup.TREE);
        List<ArchiveRecord> accepted = cursor.advance(records, size);
        return new Page(accepted, cursor, cursor.isExhausted());
    }

    private ArchiveResponse send(ArchiveQuery query) throws InterruptedException {
        pacer.acquire();
        ArchiveResponse response = httpClient.get(query);
        pacer.update(response.rateLimit());
        if (response.statusCode() == 429) {
            double waitSec = response.hasRateLimit() && response.rateLimit().resetSeconds() > 0
                ? response.rateLimit().resetSeconds()
                : properties.getRateLimit().getCooldownSec();
            pacer.cooldown(Duration.ofMillis(Math.round(waitSec * 1000.0)));
        }
        return response;
    }

    private static List<ArchiveRecord> decode(JsonNode data, boolean treeNodes) {
        List<ArchiveRecord> records = new ArrayList<>(data.size());
        for (JsonNode node : data) {
            // tree lookups wrap each comment as {"kind": ..., "data": {...}}
            JsonNode record = treeNodes && node.path("data").isObject() ? node.get("data") : node;
            records.add(ArchiveRecord.of(record));
        }
        return records;
    }
}
