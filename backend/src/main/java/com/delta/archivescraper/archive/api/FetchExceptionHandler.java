package com.delta.archivescraper.archive.api;

import com.delta.archivescraper.archive.http.ArchiveFetchException;
import com.delta.archivescraper.archive.model.FetchResult;
import com.delta.archivescraper.archive.model.FetchSummary;
import com.delta.archivescraper.archive.query.InvalidFetchRequestException;
import com.delta.archivescraper.archive.service.PartialFetchException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class FetchExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(FetchExceptionHandler.class);

  @ExceptionHandler(InvalidFetchRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidFetchRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", ex.reasonCode(), "message", ex.getMessage()));
  }

  /** Partial results are still reported; the status tells the caller the data is incomplete. */
  @ExceptionHandler(PartialFetchException.class)
  public ResponseEntity<FetchSummary> handlePartial(PartialFetchException ex) {
    FetchResult partial = ex.partialResult();
    FetchSummary summary = new FetchSummary(
        ex.isTotalFailure() ? FetchSummary.STATUS_FAILED : FetchSummary.STATUS_PARTIAL,
        partial.mode().value(),
        partial.size(),
        partial.duplicates().size(),
        partial.streams(),
        partial.file() == null ? null : partial.file().toString(),
        partial.duration() == null ? 0L : partial.duration().toMillis(),
        ex.reasonCode(),
        ex.getMessage());
    HttpStatus status = ex.isTotalFailure() ? HttpStatus.BAD_GATEWAY : HttpStatus.PARTIAL_CONTENT;
    return ResponseEntity.status(status).body(summary);
  }

  @ExceptionHandler(ArchiveFetchException.class)
  public ResponseEntity<Map<String, String>> handleFetchFailure(ArchiveFetchException ex) {
    log.warn("Archive fetch failed ({}): {}", ex.reasonCode(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", ex.reasonCode(), "message", ex.getMessage()));
  }
}
