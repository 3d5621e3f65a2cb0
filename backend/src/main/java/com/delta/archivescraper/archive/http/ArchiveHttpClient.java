package com.delta.archivescraper.archive.http;

import com.delta.archivescraper.archive.model.ArchiveQuery;
import com.delta.archivescraper.archive.model.ArchiveResponse;
import com.delta.archivescraper.archive.model.RateLimitSignal;
import com.delta.archivescraper.config.ScraperProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Single-attempt GET against the archive. Never throws for transport problems; failures come back
 * as an {@link ArchiveResponse} with an error code so the retry layer can classify them.
 */
@Service
public class ArchiveHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ArchiveHttpClient.class);
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";
    private static final long EPOCH_RESET_THRESHOLD = 1_000_000_000L;

    private final ScraperProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public ArchiveHttpClient(
        ScraperProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public ArchiveResponse get(ArchiveQuery query) {
        Instant startedAt = Instant.now();
        String url;
        URI uri;
        try {
            url = query.toUrl();
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return errorResponse(query.baseUrl(), startedAt, "invalid_url", e.getMessage());
        }
        if (uri.getHost() == null || uri.getScheme() == null) {
            return errorResponse(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "application/json")
            .GET()
            .build();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            String body = bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8);
            JsonNode json = null;
            String errorCode = null;
            String errorMessage = null;
            if (!body.isBlank()) {
                try {
                    json = objectMapper.readTree(body);
                } catch (JsonProcessingException e) {
                    if (response.statusCode() >= 200 && response.statusCode() < 300) {
                        errorCode = "malformed_body";
                        errorMessage = e.getOriginalMessage();
                    }
                }
            } else if (response.statusCode() >= 200 && response.statusCode() < 300) {
                errorCode = "malformed_body";
                errorMessage = "Empty response body";
            }
            RateLimitSignal signal = rateLimitFromHeaders(response.headers());
            if (signal == null && query.backend().rateLimitHeadersRequired()) {
                if (errorCode == null && response.statusCode() >= 200 && response.statusCode() < 300) {
                    errorCode = "missing_rate_limit";
                    errorMessage = "Expected " + REMAINING_HEADER + " and " + RESET_HEADER + " headers";
                }
            } else if (signal == null) {
                signal = rateLimitFromBody(json);
            }
            log.debug("GET {} -> {} in {} ms", url, response.statusCode(), Duration.between(startedAt, Instant.now()).toMillis());
            return new ArchiveResponse(
                url,
                response.statusCode(),
                json,
                signal,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                errorCode,
                errorMessage
            );
        } catch (HttpTimeoutException e) {
            return errorResponse(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResponse(url, startedAt, "io_error", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResponse(url, startedAt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return errorResponse(url, startedAt, "http_error", e.toString());
        }
    }

    static RateLimitSignal rateLimitFromHeaders(HttpHeaders headers) {
        Double remaining = parseNumber(headers.firstValue(REMAINING_HEADER).orElse(null));
        Double reset = parseNumber(headers.firstValue(RESET_HEADER).orElse(null));
        if (remaining == null || reset == null) {
            return null;
        }
        return new RateLimitSignal(remaining.intValue(), resetSeconds(reset));
    }

    /** Fallback for deployments that report quota inside the body as {@code "rate_limit": {...}}. */
    static RateLimitSignal rateLimitFromBody(JsonNode body) {
        if (body == null || !body.has("rate_limit")) {
            return null;
        }
        JsonNode node = body.get("rate_limit");
        JsonNode remaining = node.get("remaining");
        JsonNode reset = node.get("reset");
        if (remaining == null || reset == null || !remaining.isNumber() || !reset.isNumber()) {
            return null;
        }
        return new RateLimitSignal(remaining.asInt(), resetSeconds(reset.asDouble()));
    }

    private static double resetSeconds(double raw) {
        if (raw > EPOCH_RESET_THRESHOLD) {
            return Math.max(0.0, raw - Instant.now().getEpochSecond());
        }
        return raw;
    }

    private static Double parseNumber(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable rate-limit header value {}", raw);
            return null;
        }
    }

    private ArchiveResponse errorResponse(String url, Instant startedAt, String code, String message) {
        return new ArchiveResponse(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
