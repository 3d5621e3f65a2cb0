package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.model.FetchMode;
import com.delta.archivescraper.archive.model.FetchRequest;
import com.delta.archivescraper.archive.model.FetchResult;
import com.delta.archivescraper.archive.model.SortOrder;
import com.delta.archivescraper.archive.model.StreamBoundary;
import com.delta.archivescraper.archive.model.SubmissionParams;
import com.delta.archivescraper.archive.http.NonRetryableResponseException;
import com.delta.archivescraper.archive.util.ReasonCodeClassifier;
import com.delta.archivescraper.config.ScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.delta.archivescraper.archive.ArchiveFixtures.submission;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchCliRunnerTest {

    @Mock
    private ArchiveFetchService fetchService;
    @Mock
    private ConfigurableApplicationContext applicationContext;

    private ScraperProperties properties;
    private FetchCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        runner = new FetchCliRunner(properties, fetchService, applicationContext);
    }

    @Test
    void disabledRunnerDoesNothing() {
        properties.getCli().setRun(false);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(fetchService);
    }

    @Test
    void cliPropertiesBecomeATypedRequest() {
        ScraperProperties.Cli cli = properties.getCli();
        cli.setSubreddit("java");
        cli.setAfter("2024-01-01");
        cli.setBefore("1704153600");
        cli.setSort("asc");
        cli.setLimit(50);
        cli.setFileName("java-jan");
        cli.setFields(List.of("title", "author"));
        when(fetchService.fetch(any())).thenReturn(emptyResult());

        assertThat(runner.execute()).isEqualTo(FetchCliRunner.EXIT_OK);

        ArgumentCaptor<FetchRequest> captor = ArgumentCaptor.forClass(FetchRequest.class);
        verify(fetchService).fetch(captor.capture());
        FetchRequest request = captor.getValue();
        assertThat(request.params()).isInstanceOf(SubmissionParams.class);
        assertThat(request.params().subreddit()).isEqualTo("java");
        assertThat(request.params().after()).isEqualTo(1704067200L);
        assertThat(request.params().before()).isEqualTo(1704153600L);
        assertThat(request.sortOrder()).isEqualTo(SortOrder.ASC);
        assertThat(request.limit()).isEqualTo(50);
        assertThat(request.fileName()).isEqualTo("java-jan");
        assertThat(request.fields()).containsExactly("title", "author");
    }

    @Test
    void partialResultMapsToItsOwnExitCode() {
        when(fetchService.fetch(any())).thenThrow(partial(1));

        assertThat(runner.execute()).isEqualTo(FetchCliRunner.EXIT_PARTIAL);
    }

    @Test
    void totalFailureMapsToFailedExitCode() {
        when(fetchService.fetch(any())).thenThrow(partial(0));

        assertThat(runner.execute()).isEqualTo(FetchCliRunner.EXIT_FAILED);
    }

    @Test
    void invalidCliInputFailsWithoutFetching() {
        properties.getCli().setAfter("yesterday-ish");

        assertThat(runner.execute()).isEqualTo(FetchCliRunner.EXIT_FAILED);
        verifyNoInteractions(fetchService);
    }

    private static FetchResult emptyResult() {
        return new FetchResult(FetchMode.SUBMISSIONS, Map.of(), Map.of(), 1, null, Duration.ZERO);
    }

    private static PartialFetchException partial(int records) {
        FetchResult result = records == 0
            ? emptyResult()
            : new FetchResult(FetchMode.SUBMISSIONS, Map.of("a", submission("a", 10)), Map.of(), 1, null, Duration.ZERO);
        return new PartialFetchException(
            result,
            new StreamBoundary("stream-1", null, 10L, 1),
            new NonRetryableResponseException(ReasonCodeClassifier.HTTP_4XX, 404, "gone")
        );
    }
}
