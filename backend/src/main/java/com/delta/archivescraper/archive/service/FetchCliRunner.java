package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.http.ArchiveFetchException;
import com.delta.archivescraper.archive.model.ArchiveBackend;
import com.delta.archivescraper.archive.model.FetchCriteria;
import com.delta.archivescraper.archive.model.FetchRequest;
import com.delta.archivescraper.archive.model.FetchResult;
import com.delta.archivescraper.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class FetchCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(FetchCliRunner.class);
    static final int EXIT_OK = 0;
    static final int EXIT_PARTIAL = 1;
    static final int EXIT_FAILED = 2;

    private final ScraperProperties properties;
    private final ArchiveFetchService fetchService;
    private final ConfigurableApplicationContext applicationContext;

    public FetchCliRunner(
        ScraperProperties properties,
        ArchiveFetchService fetchService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.fetchService = fetchService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int exitCode = execute();
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int execute() {
        try {
            FetchRequest request = toCriteria(properties.getCli())
                .toRequest(ArchiveBackend.fromValue(properties.getBackend()), properties.getZoneId());
            FetchResult result = fetchService.fetch(request);
            log.info(
                "Fetch completed: mode={}, records={}, duplicateIds={}, file={}",
                result.mode().value(),
                result.size(),
                result.duplicates().size(),
                result.file() == null ? "-" : result.file()
            );
            return EXIT_OK;
        } catch (PartialFetchException e) {
            log.error(
                "Fetch {} ({}): {} records kept, file={}",
                e.isTotalFailure() ? "failed" : "incomplete",
                e.reasonCode(),
                e.partialResult().size(),
                e.partialResult().file() == null ? "-" : e.partialResult().file()
            );
            return e.isTotalFailure() ? EXIT_FAILED : EXIT_PARTIAL;
        } catch (ArchiveFetchException e) {
            log.error("Fetch rejected ({}): {}", e.reasonCode(), e.getMessage());
            return EXIT_FAILED;
        }
    }

    static FetchCriteria toCriteria(ScraperProperties.Cli cli) {
        return new FetchCriteria(
            cli.getMode(),
            cli.getQ(),
            null,
            cli.getAuthor(),
            cli.getSubreddit(),
            cli.getAfter(),
            cli.getBefore(),
            null,
            null,
            null,
            null,
            cli.getLinkId(),
            cli.getSort(),
            cli.getSortType(),
            cli.getLimit(),
            null,
            cli.isGetComments(),
            null,
            cli.getFileName(),
            cli.getFields(),
            cli.getBackend(),
            cli.getTimezone()
        );
    }
}
