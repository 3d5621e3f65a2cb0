package com.delta.archivescraper.archive.api;

import com.delta.archivescraper.archive.model.ArchiveBackend;
import com.delta.archivescraper.archive.model.FetchCriteria;
import com.delta.archivescraper.archive.model.FetchResult;
import com.delta.archivescraper.archive.model.FetchSummary;
import com.delta.archivescraper.archive.model.PacerStatus;
import com.delta.archivescraper.archive.pacing.Pacer;
import com.delta.archivescraper.archive.service.ArchiveFetchService;
import com.delta.archivescraper.config.ScraperProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class FetchController {
    private final ArchiveFetchService fetchService;
    private final Pacer pacer;
    private final ScraperProperties properties;

    public FetchController(ArchiveFetchService fetchService, Pacer pacer, ScraperProperties properties) {
        this.fetchService = fetchService;
        this.pacer = pacer;
        this.properties = properties;
    }

    @PostMapping("/fetch")
    public FetchSummary fetch(@RequestBody(required = false) FetchCriteria criteria) {
        if (criteria == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Request body is required");
        }
        FetchResult result = fetchService.fetch(
            criteria.toRequest(ArchiveBackend.fromValue(properties.getBackend()), properties.getZoneId())
        );
        return FetchSummary.complete(result);
    }

    @GetMapping("/pacer")
    public PacerStatus pacer() {
        return pacer.status();
    }
}
