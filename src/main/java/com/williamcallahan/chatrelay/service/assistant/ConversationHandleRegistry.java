package com.williamcallahan.chatrelay.service.assistant;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable mapping from user id to assistant thread id, kept in a small JSON file so a user returns to the
 * same assistant conversation after their session expires or the service restarts.
 */
public class ConversationHandleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConversationHandleRegistry.class);
    private static final TypeReference<LinkedHashMap<String, String>> MAPPING_TYPE = new TypeReference<>() {};

    private final Path mappingFile;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, String> threadsByUser;

    public ConversationHandleRegistry(Path mappingFile) {
        this.mappingFile = mappingFile;
        this.threadsByUser = loadMapping();
    }

    public synchronized Optional<String> find(String userId) {
        return Optional.ofNullable(threadsByUser.get(userId));
    }

    /**
     * Returns the user's thread, creating and persisting one when none is recorded. Lookup and creation
     * happen under the registry's monitor, so concurrent first messages from one user share a thread.
     *
     * @param userId opaque user identifier
     * @param threadFactory creates a new thread and returns its id
     * @return existing or newly created thread id
     */
    public synchronized String findOrCreate(String userId, Supplier<String> threadFactory) {
        String existing = threadsByUser.get(userId);
        if (existing != null) {
            return existing;
        }
        String created = threadFactory.get();
        threadsByUser.put(userId, created);
        saveMapping();
        return created;
    }

    public synchronized void remember(String userId, String threadId) {
        threadsByUser.put(userId, threadId);
        saveMapping();
    }

    public synchronized void forget(String userId) {
        if (threadsByUser.remove(userId) != null) {
            saveMapping();
        }
    }

    public synchronized int size() {
        return threadsByUser.size();
    }

    private Map<String, String> loadMapping() {
        if (!Files.exists(mappingFile)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, String> loaded = objectMapper.readValue(mappingFile.toFile(), MAPPING_TYPE);
            log.info("Loaded {} assistant thread mappings from {}", loaded.size(), mappingFile);
            return loaded;
        } catch (IOException e) {
            log.warn("Failed to load assistant thread mappings from {}, starting empty", mappingFile, e);
            return new LinkedHashMap<>();
        }
    }

    private void saveMapping() {
        try {
            Path parent = mappingFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(mappingFile.toFile(), threadsByUser);
        } catch (IOException e) {
            log.error("Failed to save assistant thread mappings to {}", mappingFile, e);
        }
    }
}
