package com.delta.archivescraper.archive.model;

import com.delta.archivescraper.archive.http.MalformedResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One submission or comment as returned by the archive. The JSON body is kept as-is; only the
 * handful of fields the fetch engine reasons about are read from it.
 */
public final class ArchiveRecord {
    private static final Pattern BRACKETED = Pattern.compile("^\\[.*]$", Pattern.DOTALL);
    private static final int REMOVAL_TEXT_MAX_LENGTH = 100;
    private static final List<String> LAST_SEEN_FIELDS = List.of("edited", "retrieved_on", "retrieved_utc", "updated_utc");

    private final String id;
    private final ObjectNode node;

    private ArchiveRecord(String id, ObjectNode node) {
        this.id = id;
        this.node = node;
    }

    public static ArchiveRecord of(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("Record is not a JSON object");
        }
        JsonNode idNode = node.get("id");
        if (idNode == null || idNode.isNull() || idNode.asText().isBlank()) {
            throw new MalformedResponseException("Record without id");
        }
        return new ArchiveRecord(idNode.asText().trim(), (ObjectNode) node);
    }

    public String id() {
        return id;
    }

    public ObjectNode node() {
        return node;
    }

    public Long createdUtc() {
        return longValue(node.get("created_utc"));
    }

    /** Sort key for the given type; missing values sort as the smallest. */
    public long sortValue(SortType sortType) {
        Long value = longValue(node.get(sortType.value()));
        return value == null ? Long.MIN_VALUE : value;
    }

    /** Latest of the edit and retrieval timestamps, 0 when the record carries none. */
    public long lastSeen() {
        long latest = 0L;
        for (String field : LAST_SEEN_FIELDS) {
            Long value = longValue(node.get(field));
            if (value != null && value > latest) {
                latest = value;
            }
        }
        return latest;
    }

    public String linkId() {
        String raw = text(node.get("link_id"));
        if (raw == null) {
            return null;
        }
        return raw.startsWith("t3_") ? raw.substring(3) : raw;
    }

    public boolean isSubmission() {
        return node.has("title");
    }

    /**
     * Whether this revision looks deleted or moderated away. Submissions carry their text in
     * {@code selftext}, comments in {@code body}.
     */
    public boolean isRemoved() {
        if (text(node.get("removed_by_category")) != null || text(node.get("removal_reason")) != null) {
            return true;
        }
        String author = text(node.get("author"));
        if (author == null || BRACKETED.matcher(author).matches()) {
            return true;
        }
        String title = text(node.get("title"));
        String content = title != null ? text(node.get("selftext")) : text(node.get("body"));
        if (content == null && title == null) {
            return true;
        }
        if (content != null && content.length() <= REMOVAL_TEXT_MAX_LENGTH && BRACKETED.matcher(content).matches()) {
            String lower = content.toLowerCase(Locale.ROOT);
            return lower.contains("deleted") || lower.contains("removed");
        }
        return false;
    }

    public ArchiveRecord withComments(Collection<ArchiveRecord> comments) {
        ObjectNode copy = node.deepCopy();
        ArrayNode array = copy.putArray("comments");
        for (ArchiveRecord comment : comments) {
            array.add(comment.node());
        }
        return new ArchiveRecord(id, copy);
    }

    /** Keeps only the requested keys; {@code comments} survives so attached children are not lost. */
    public ArchiveRecord withFields(Collection<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return this;
        }
        Set<String> keep = new HashSet<>(fields);
        keep.add("comments");
        ObjectNode copy = node.deepCopy();
        copy.retain(keep);
        return new ArchiveRecord(id, copy);
    }

    private static Long longValue(JsonNode value) {
        if (value == null || value.isNull() || value.isBoolean()) {
            return null;
        }
        if (value.isNumber()) {
            return Math.round(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return Math.round(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    @Override
    public String toString() {
        return "ArchiveRecord[" + id + "]";
    }
}
