package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.http.ArchiveHttpClient;
import com.delta.archivescraper.archive.model.ArchiveQuery;
import com.delta.archivescraper.archive.model.ArchiveResponse;
import com.delta.archivescraper.archive.model.FetchMode;
import com.delta.archivescraper.archive.model.Page;
import com.delta.archivescraper.archive.model.PageCursor;
import com.delta.archivescraper.archive.model.RateLimitSignal;
import com.delta.archivescraper.archive.model.SortOrder;
import com.delta.archivescraper.archive.pacing.Pacer;
import com.delta.archivescraper.archive.retry.RetryPolicy;
import com.delta.archivescraper.config.ScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.delta.archivescraper.archive.ArchiveFixtures.dataBody;
import static com.delta.archivescraper.archive.ArchiveFixtures.ok;
import static com.delta.archivescraper.archive.ArchiveFixtures.status;
import static com.delta.archivescraper.archive.ArchiveFixtures.submission;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageFetcherTest {

    @Mock
    private ArchiveHttpClient httpClient;
    @Mock
    private Pacer pacer;

    private PageFetcher fetcher;
    private final ArchiveQuery base = new ArchiveQuery(
        "http://archive/reddit/search",
        FetchMode.SUBMISSIONS,
        Map.of("subreddit", "java", "size", "100")
    );

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.setMaxRetries(3);
        properties.setBackoffSec(0.0);
        properties.setPageSize(100);
        fetcher = new PageFetcher(httpClient, pacer, new RetryPolicy(properties), properties);
    }

    @Test
    void requestsOnlyWhatTheQuotaAllowsAndAdvancesTheCursor() throws Exception {
        RateLimitSignal signal = new RateLimitSignal(20, 30);
        when(httpClient.get(any())).thenReturn(new ArchiveResponse(
            "http://archive",
            200,
            dataBody(List.of(submission("a", 300), submission("b", 200))),
            signal,
            Instant.now(),
            Duration.ZERO,
            null,
            null
        ));
        PageCursor cursor = PageCursor.forBounds("stream-1", null, 500L, SortOrder.DESC, 2, true);

        Page page = fetcher.nextPage(base, cursor);

        ArgumentCaptor<ArchiveQuery> sent = ArgumentCaptor.forClass(ArchiveQuery.class);
        verify(httpClient).get(sent.capture());
        assertThat(sent.getValue().params())
            .containsEntry("size", "2")
            .containsEntry("before", "500")
            .containsEntry("subreddit", "java")
            .doesNotContainKey("after");
        assertThat(page.records()).hasSize(2);
        assertThat(page.exhausted()).isTrue();
        assertThat(cursor.before()).isEqualTo(200L);
        verify(pacer).acquire();
        verify(pacer).update(signal);
    }

    @Test
    void rateLimitedResponseTriggersCooldownAndRetry() throws Exception {
        when(httpClient.get(any())).thenReturn(
            status(429, new RateLimitSignal(0, 2)),
            status(429),
            ok(dataBody(List.of(submission("a", 300))))
        );
        PageCursor cursor = PageCursor.forBounds("stream-1", null, null, SortOrder.DESC, null, true);

        Page page = fetcher.nextPage(base, cursor);

        assertThat(page.records()).hasSize(1);
        verify(pacer).cooldown(Duration.ofMillis(2000));
        verify(pacer).cooldown(Duration.ofMillis(5000));
        verify(pacer, times(3)).acquire();
    }

    @Test
    void exhaustedCursorDoesNotTouchTheNetwork() throws Exception {
        PageCursor cursor = PageCursor.forBounds("stream-1", null, null, SortOrder.DESC, 0, true);

        Page page = fetcher.nextPage(base, cursor);

        assertThat(page.exhausted()).isTrue();
        assertThat(page.records()).isEmpty();
        verifyNoInteractions(httpClient, pacer);
    }
}
