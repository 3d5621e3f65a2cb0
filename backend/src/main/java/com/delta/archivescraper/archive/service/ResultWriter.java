package com.delta.archivescraper.archive.service;

import com.delta.archivescraper.archive.model.ArchiveRecord;
import com.delta.archivescraper.archive.model.FetchResult;
import com.delta.archivescraper.config.ScraperProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Persists fetch results as a pretty-printed JSON object keyed by record id. Files are written
 * next to their destination first and moved into place, so readers never see half a file.
 */
@Service
public class ResultWriter {
    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);
    static final String DUPLICATES_SUFFIX = "_duplicates";

    private final ObjectMapper objectMapper;
    private final ScraperProperties properties;

    public ResultWriter(ObjectMapper objectMapper, ScraperProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @return the path of the written records file
     * @throws UncheckedIOException when the save directory or file cannot be written
     */
    public Path write(FetchResult result, String fileName) {
        Path dir = Paths.get(properties.getSaveDir());
        Path target = dir.resolve(withJsonExtension(fileName));
        ObjectNode root = objectMapper.createObjectNode();
        for (Map.Entry<String, ArchiveRecord> entry : result.records().entrySet()) {
            root.set(entry.getKey(), entry.getValue().node());
        }
        writeAtomically(dir, target, root);
        log.info("Wrote {} records to {}", result.size(), target.toAbsolutePath());

        if (!result.duplicates().isEmpty()) {
            Path duplicates = dir.resolve(stripJsonExtension(fileName) + DUPLICATES_SUFFIX + ".json");
            writeAtomically(dir, duplicates, objectMapper.valueToTree(result.duplicates()));
            log.info("Wrote duplicate counts for {} ids to {}", result.duplicates().size(), duplicates.toAbsolutePath());
        }
        return target;
    }

    private void writeAtomically(Path dir, Path target, Object content) {
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private static String withJsonExtension(String fileName) {
        return stripJsonExtension(fileName) + ".json";
    }

    private static String stripJsonExtension(String fileName) {
        return fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
    }
}
