package com.williamcallahan.chatrelay.service.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.williamcallahan.chatrelay.domain.session.SessionRecord;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes and reads the flat JSON snapshot of all sessions.
 *
 * <p>Neither direction ever throws: persistence is best-effort durability, so failures are logged and
 * the service keeps running with whatever is in memory.</p>
 */
public class SessionSnapshotPersister {

    private static final Logger log = LoggerFactory.getLogger(SessionSnapshotPersister.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private final ObjectMapper objectMapper;

    public SessionSnapshotPersister() {
        this.objectMapper = new ObjectMapper();
        // Register JavaTimeModule to handle Java 8 time types
        this.objectMapper.registerModule(new JavaTimeModule());
        // Configure to write timestamps as ISO-8601 strings instead of numbers
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Writes the sessions to a sibling temp file and moves it over the target, so a crash mid-write never
     * leaves a truncated snapshot behind.
     *
     * @param path snapshot file
     * @param sessions sessions keyed by user id
     * @return true when the snapshot was written
     */
    public boolean save(Path path, Map<String, SessionRecord> sessions) {
        Path tempFile = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), sessions);
            moveIntoPlace(tempFile, path);
            log.debug("Saved {} sessions to {}", sessions.size(), path);
            return true;
        } catch (IOException e) {
            log.error("Failed to save session snapshot to {}", path, e);
            return false;
        }
    }

    /**
     * Loads a snapshot. A missing file yields an empty map; an unreadable file is logged and yields an
     * empty map; individual malformed sessions are skipped.
     *
     * @param path snapshot file
     * @return sessions keyed by user id
     */
    public Map<String, SessionRecord> load(Path path) {
        Map<String, SessionRecord> loaded = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            log.info("No session snapshot at {}, starting empty", path);
            return loaded;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            log.error("Failed to read session snapshot from {}, starting empty", path, e);
            return loaded;
        }
        if (root == null || !root.isObject()) {
            log.error("Session snapshot at {} is not a JSON object, starting empty", path);
            return loaded;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                loaded.put(field.getKey(), objectMapper.treeToValue(field.getValue(), SessionRecord.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping malformed session for user {}: {}", field.getKey(), e.getMessage());
            }
        }
        log.info("Loaded {} sessions from {}", loaded.size(), path);
        return loaded;
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
