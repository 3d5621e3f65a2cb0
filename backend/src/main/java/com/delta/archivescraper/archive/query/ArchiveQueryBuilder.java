package com.delta.archivescraper.archive.query;

import com.delta.archivescraper.archive.model.ArchiveBackend;
import com.delta.archivescraper.archive.model.ArchiveLookup;
import com.delta.archivescraper.archive.model.ArchiveQuery;
import com.delta.archivescraper.archive.model.ArcticShiftParams;
import com.delta.archivescraper.archive.model.CommentParams;
import com.delta.archivescraper.archive.model.FetchMode;
import com.delta.archivescraper.archive.model.FetchParams;
import com.delta.archivescraper.archive.model.FetchRequest;
import com.delta.archivescraper.archive.model.SortType;
import com.delta.archivescraper.archive.model.SubmissionParams;
import com.delta.archivescraper.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates fetch requests and turns them into endpoint queries. Everything here runs before any
 * network activity, so a bad request never costs a rate-limit token.
 */
@Component
public class ArchiveQueryBuilder {
    private static final Logger log = LoggerFactory.getLogger(ArchiveQueryBuilder.class);

    private static final Pattern AUTHOR = Pattern.compile("^[A-Za-z0-9_-]{3,20}$");
    private static final Pattern SUBREDDIT = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_]{1,20}$");
    private static final Pattern BASE36_ID = Pattern.compile("^[0-9a-zA-Z]+$");
    private static final Pattern COMPARISON = Pattern.compile("^(?:\\d+|>=\\d+|<=\\d+|>\\d+|<\\d+)$");
    private static final Pattern FIELD_NAME = Pattern.compile("^[A-Za-z0-9_]+$");
    static final int MAX_TREE_SIZE = 25_000;
    static final int MAX_LOOKUP_IDS = 500;

    private final ScraperProperties properties;

    public ArchiveQueryBuilder(ScraperProperties properties) {
        this.properties = properties;
    }

    public void validate(FetchRequest request) {
        FetchParams params = request.params();
        if (params.q() != null && params.q().isBlank()) {
            throw new InvalidFetchRequestException("Search term 'q' must not be blank");
        }
        if (params.author() != null && !AUTHOR.matcher(params.author().trim()).matches()) {
            throw new InvalidFetchRequestException("Invalid author name: " + params.author());
        }
        if (params.subreddit() != null && !SUBREDDIT.matcher(stripSubredditPrefix(params.subreddit())).matches()) {
            throw new InvalidFetchRequestException("Invalid subreddit name: " + params.subreddit());
        }
        for (String id : params.ids()) {
            if (id == null || !BASE36_ID.matcher(id.trim()).matches()) {
                throw new InvalidFetchRequestException("Invalid id (expected base-36): " + id);
            }
        }
        if (params.after() != null && params.before() != null && params.after() >= params.before()) {
            throw new InvalidFetchRequestException("'after' must be less than 'before'");
        }
        if (params.after() != null && params.after() < 0 || params.before() != null && params.before() < 0) {
            throw new InvalidFetchRequestException("Time bounds must be non-negative epoch seconds");
        }
        if (params instanceof SubmissionParams submission) {
            validateComparison("score", submission.score());
            validateComparison("num_comments", submission.numComments());
        } else if (params instanceof CommentParams comment) {
            validateLinkId(comment.linkId());
        } else if (params instanceof ArcticShiftParams arctic) {
            validateArcticShift(arctic);
        }
        if (request.getComments() && request.mode() != FetchMode.SUBMISSIONS) {
            throw new InvalidFetchRequestException("get_comments is only supported for submissions");
        }
        if (request.limit() != null && request.limit() < 1) {
            throw new InvalidFetchRequestException("limit must be at least 1");
        }
        if (request.concurrency() != null && request.concurrency() < 1) {
            throw new InvalidFetchRequestException("concurrency must be at least 1");
        }
        for (String field : request.fields()) {
            if (field == null || !FIELD_NAME.matcher(field).matches()) {
                throw new InvalidFetchRequestException("Invalid field name: " + field);
            }
        }
        String fileName = request.fileName();
        if (fileName != null && (fileName.contains("/") || fileName.contains("\\") || fileName.contains(".."))) {
            throw new InvalidFetchRequestException("file_name must be a plain file name: " + fileName);
        }
    }

    /**
     * Builds the endpoint query without cursor bounds. When {@code timeSweep} is set the query is
     * forced onto {@code created_utc}, the only key a time cursor can walk.
     */
    public ArchiveQuery build(FetchRequest request, boolean timeSweep) {
        validate(request);
        FetchParams params = request.params();
        if (params instanceof ArcticShiftParams arctic) {
            return buildArcticShift(request, arctic);
        }
        SortType wireSort = request.sortType();
        if (timeSweep && wireSort != SortType.CREATED_UTC) {
            log.warn(
                "sort_type={} cannot paginate a time range; querying by created_utc and sorting by {} afterwards",
                wireSort.value(),
                wireSort.value()
            );
            wireSort = SortType.CREATED_UTC;
        }

        Map<String, String> query = new LinkedHashMap<>();
        putIfPresent(query, "q", params.q());
        if (!params.ids().isEmpty()) {
            query.put("ids", String.join(",", params.ids().stream().map(String::trim).toList()));
        }
        putIfPresent(query, "author", params.author());
        putIfPresent(query, "subreddit", params.subreddit() == null ? null : stripSubredditPrefix(params.subreddit()));
        if (params instanceof SubmissionParams submission) {
            putIfPresent(query, "title", submission.title());
            putIfPresent(query, "selftext", submission.selftext());
            putIfPresent(query, "score", submission.score());
            putIfPresent(query, "num_comments", submission.numComments());
        } else if (params instanceof CommentParams comment) {
            putIfPresent(query, "link_id", comment.linkId() == null ? null : stripLinkPrefix(comment.linkId()));
        }
        query.put("sort", request.sortOrder().value());
        query.put("sort_type", wireSort.value());
        query.put("size", String.valueOf(properties.getPageSize()));
        return new ArchiveQuery(properties.getBaseUrl(), params.mode(), query);
    }

    /**
     * Comment query for one parent submission. Always walks {@code created_utc} in the parent's
     * direction so every comment of the thread is paged through.
     */
    public ArchiveQuery buildForLink(String linkId, FetchRequest parentRequest) {
        if (parentRequest.params().backend() == ArchiveBackend.ARCTIC_SHIFT) {
            validateLinkId(linkId);
            Map<String, String> query = new LinkedHashMap<>();
            query.put("link_id", stripLinkPrefix(linkId));
            query.put("limit", String.valueOf(MAX_TREE_SIZE));
            return new ArchiveQuery(
                properties.getArcticShiftBaseUrl(),
                ArchiveBackend.ARCTIC_SHIFT,
                FetchMode.COMMENTS,
                ArchiveLookup.TREE,
                query
            );
        }
        FetchRequest commentRequest = new FetchRequest(
            CommentParams.forLink(linkId),
            SortType.CREATED_UTC,
            parentRequest.sortOrder(),
            null,
            parentRequest.duplicateAction(),
            false,
            null,
            null,
            List.of()
        );
        return build(commentRequest, false);
    }

    /**
     * Arctic Shift only orders by creation time, so any other sort key is applied locally after the
     * fetch. The {@code ids} lookup ignores ordering and paging altogether.
     */
    private ArchiveQuery buildArcticShift(FetchRequest request, ArcticShiftParams params) {
        Map<String, String> query = new LinkedHashMap<>();
        if (params.lookup() == ArchiveLookup.IDS) {
            query.put("ids", String.join(",", params.ids().stream().map(String::trim).toList()));
        } else {
            if (request.sortType() != SortType.CREATED_UTC) {
                log.warn(
                    "arcticshift only sorts by created_utc; querying by created_utc and sorting by {} afterwards",
                    request.sortType().value()
                );
            }
            putIfPresent(query, params.mode() == FetchMode.SUBMISSIONS ? "query" : "body", params.q());
            putIfPresent(query, "author", params.author());
            putIfPresent(query, "subreddit", params.subreddit() == null ? null : stripSubredditPrefix(params.subreddit()));
            putIfPresent(query, "title", params.title());
            putIfPresent(query, "selftext", params.selftext());
            putIfPresent(query, "link_id", params.linkId() == null ? null : stripLinkPrefix(params.linkId()));
            query.put("sort", request.sortOrder().value());
            query.put("limit", String.valueOf(Math.min(properties.getPageSize(), ArchiveBackend.ARCTIC_SHIFT.maxPageSize())));
        }
        return new ArchiveQuery(
            properties.getArcticShiftBaseUrl(),
            ArchiveBackend.ARCTIC_SHIFT,
            params.mode(),
            params.lookup(),
            query
        );
    }

    private static void validateArcticShift(ArcticShiftParams params) {
        if (params.mode() == FetchMode.SUBMISSIONS && params.linkId() != null) {
            throw new InvalidFetchRequestException("Field 'link_id' is not supported for endpoint 'posts'");
        }
        if (params.mode() == FetchMode.COMMENTS && (params.title() != null || params.selftext() != null)) {
            throw new InvalidFetchRequestException("Fields 'title' and 'selftext' are not supported for endpoint 'comments'");
        }
        validateLinkId(params.linkId());
        if (params.lookup() == ArchiveLookup.IDS) {
            if (params.ids().size() > MAX_LOOKUP_IDS) {
                throw new InvalidFetchRequestException("At most " + MAX_LOOKUP_IDS + " ids can be looked up at once");
            }
            boolean filtered = params.q() != null || params.author() != null || params.subreddit() != null
                || params.after() != null || params.before() != null || params.title() != null
                || params.selftext() != null || params.linkId() != null;
            if (filtered) {
                throw new InvalidFetchRequestException("The ids lookup takes no other filter");
            }
        }
    }

    private static void validateLinkId(String linkId) {
        if (linkId != null && !BASE36_ID.matcher(stripLinkPrefix(linkId)).matches()) {
            throw new InvalidFetchRequestException("Invalid link_id (expected base-36): " + linkId);
        }
    }

    private static void validateComparison(String field, String value) {
        if (value != null && !COMPARISON.matcher(value.trim()).matches()) {
            throw new InvalidFetchRequestException(
                "Invalid " + field + " filter (expected N, >N, <N, >=N or <=N): " + value
            );
        }
    }

    private static void putIfPresent(Map<String, String> query, String key, String value) {
        if (value != null && !value.isBlank()) {
            query.put(key, value.trim());
        }
    }

    private static String stripSubredditPrefix(String subreddit) {
        String value = subreddit.trim();
        return value.toLowerCase(Locale.ROOT).startsWith("r/") ? value.substring(2) : value;
    }

    private static String stripLinkPrefix(String linkId) {
        String value = linkId.trim();
        return value.startsWith("t3_") ? value.substring(3) : value;
    }
}
