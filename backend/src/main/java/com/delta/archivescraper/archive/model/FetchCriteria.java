package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.query.InvalidFetchRequestException;
import com.delta.archivescraper.archive.util.EpochParser;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Loosely typed fetch input as it arrives from the REST body or the CLI properties.
 * {@link #toRequest(ArchiveBackend, ZoneId)} resolves it into the mode-tagged {@link FetchRequest},
 * rejecting parameters the chosen backend or endpoint does not support.
 */
public record FetchCriteria(
    String mode,
    String q,
    List<String> ids,
    String author,
    String subreddit,
    String after,
    String before,
    String title,
    String selftext,
    String score,
    String numComments,
    String linkId,
    String sort,
    String sortType,
    Integer limit,
    String duplicateAction,
    @JsonProperty("getComments") Boolean getComments,
    Integer concurrency,
    String fileName,
    List<String> fields,
    String backend,
    String timezone
) {

    /** Resolves against PullPush with zone-less times read as UTC. */
    public FetchRequest toRequest() {
        return toRequest(ArchiveBackend.PULLPUSH, ZoneOffset.UTC);
    }

    /**
     * @param defaultBackend backend used when the input names none
     * @param defaultZone    zone for date-times without an offset when the input names none
     */
    public FetchRequest toRequest(ArchiveBackend defaultBackend, ZoneId defaultZone) {
        FetchMode fetchMode = FetchMode.fromValue(mode);
        ArchiveBackend archiveBackend = hasText(backend) ? ArchiveBackend.fromValue(backend) : defaultBackend;
        ZoneId zone = hasText(timezone) ? parseZone(timezone) : defaultZone;
        Long afterEpoch = parseTime("after", after, zone);
        Long beforeEpoch = parseTime("before", before, zone);

        FetchParams params;
        if (archiveBackend == ArchiveBackend.ARCTIC_SHIFT) {
            params = arcticShiftParams(fetchMode, afterEpoch, beforeEpoch);
        } else if (fetchMode == FetchMode.SUBMISSIONS) {
            if (hasText(linkId)) {
                throw new InvalidFetchRequestException("Field 'link_id' is not supported for endpoint 'submission'");
            }
            params = new SubmissionParams(q, ids, author, subreddit, afterEpoch, beforeEpoch, title, selftext, score, numComments);
        } else {
            rejectForComments("title", title);
            rejectForComments("selftext", selftext);
            rejectForComments("score", score);
            rejectForComments("num_comments", numComments);
            if (Boolean.TRUE.equals(getComments)) {
                throw new InvalidFetchRequestException("get_comments is only supported for submissions");
            }
            params = new CommentParams(q, ids, author, subreddit, afterEpoch, beforeEpoch, linkId);
        }

        return new FetchRequest(
            params,
            SortType.fromValue(sortType),
            SortOrder.fromValue(sort),
            limit,
            hasText(duplicateAction) ? DuplicateAction.fromValue(duplicateAction) : null,
            Boolean.TRUE.equals(getComments),
            concurrency,
            fileName,
            fields
        );
    }

    private ArcticShiftParams arcticShiftParams(FetchMode fetchMode, Long afterEpoch, Long beforeEpoch) {
        rejectForBackend("score", score);
        rejectForBackend("num_comments", numComments);
        if (fetchMode == FetchMode.SUBMISSIONS) {
            if (hasText(linkId)) {
                throw new InvalidFetchRequestException("Field 'link_id' is not supported for endpoint 'posts'");
            }
        } else {
            if (hasText(title) || hasText(selftext)) {
                String field = hasText(title) ? "title" : "selftext";
                throw new InvalidFetchRequestException("Field '" + field + "' is not supported for endpoint 'comments'");
            }
            if (Boolean.TRUE.equals(getComments)) {
                throw new InvalidFetchRequestException("get_comments is only supported for submissions");
            }
        }
        return new ArcticShiftParams(fetchMode, q, ids, author, subreddit, afterEpoch, beforeEpoch, title, selftext, linkId);
    }

    private static Long parseTime(String field, String raw, ZoneId zone) {
        try {
            return EpochParser.parse(raw, zone);
        } catch (IllegalArgumentException e) {
            throw new InvalidFetchRequestException("Invalid '" + field + "': " + e.getMessage(), e);
        }
    }

    private static ZoneId parseZone(String raw) {
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            throw new InvalidFetchRequestException("Invalid timezone: " + raw, e);
        }
    }

    private static void rejectForBackend(String field, String value) {
        if (hasText(value)) {
            throw new InvalidFetchRequestException("Field '" + field + "' is not supported by backend 'arcticshift'");
        }
    }

    private static void rejectForComments(String field, String value) {
        if (hasText(value)) {
            throw new InvalidFetchRequestException("Field '" + field + "' is not supported for endpoint 'comment'");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
