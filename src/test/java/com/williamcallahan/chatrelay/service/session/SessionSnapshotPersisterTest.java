package com.williamcallahan.chatrelay.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.chatrelay.domain.session.HistoryEntry;
import com.williamcallahan.chatrelay.domain.session.MessageRole;
import com.williamcallahan.chatrelay.domain.session.SessionMeta;
import com.williamcallahan.chatrelay.domain.session.SessionRecord;
import com.williamcallahan.chatrelay.domain.session.SessionState;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionSnapshotPersisterTest {

    @TempDir
    Path tempDir;

    private final SessionSnapshotPersister persister = new SessionSnapshotPersister();

    @Test
    void savedSnapshotLoadsBackUnchanged() {
        Instant created = Instant.parse("2025-03-01T12:00:00Z");
        Instant active = Instant.parse("2025-03-01T12:04:10Z");
        SessionRecord session = new SessionRecord(created, active, SessionState.TICKET_CREATION,
                Map.of("ticket_subject", "No puedo entrar"), "thread_123",
                List.of(HistoryEntry.user("tengo un problema", created), HistoryEntry.systemNotice("¿Sigues ahí?", active)),
                true, false, new SessionMeta(7, 2));
        Map<String, SessionRecord> sessions = new LinkedHashMap<>();
        sessions.put("5215512345678", session);
        Path file = tempDir.resolve("nested/dir/sessions.json");

        assertTrue(persister.save(file, sessions));

        assertEquals(sessions, persister.load(file));
        assertFalse(Files.exists(file.resolveSibling("sessions.json.tmp")));
    }

    @Test
    void savedSnapshotUsesLegacyPropertyNamesAndIsoTimestamps() throws IOException {
        Instant now = Instant.parse("2025-03-01T12:00:00Z");
        Path file = tempDir.resolve("sessions.json");
        persister.save(file, Map.of("u1", SessionRecord.fresh(now, SessionMeta.empty())));

        String json = Files.readString(file, StandardCharsets.UTF_8);

        assertTrue(json.contains("\"last_activity\" : \"2025-03-01T12:00:00Z\""));
        assertTrue(json.contains("\"message_history\""));
        assertTrue(json.contains("\"inactivity_warning_sent\" : false"));
        assertTrue(json.contains("\"total_messages\" : 0"));
    }

    @Test
    void missingFileLoadsEmpty() {
        assertTrue(persister.load(tempDir.resolve("absent.json")).isEmpty());
    }

    @Test
    void malformedFileLoadsEmpty() throws IOException {
        Path file = tempDir.resolve("sessions.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        assertTrue(persister.load(file).isEmpty());
    }

    @Test
    void nonObjectRootLoadsEmpty() throws IOException {
        Path file = tempDir.resolve("sessions.json");
        Files.writeString(file, "[1, 2, 3]", StandardCharsets.UTF_8);

        assertTrue(persister.load(file).isEmpty());
    }

    @Test
    @DisplayName("Files from the previous deployment load with defaults for missing fields")
    void loadsLegacyFormat() throws IOException {
        String legacy = """
                {
                  "5215512345678": {
                    "created_at": "2025-02-28T18:59:18.123456",
                    "last_activity": "2025-02-28T19:03:00.000001",
                    "state": "AWAITING_QUERY",
                    "context": {},
                    "thread_id": null,
                    "message_history": [
                      {"role": "user", "content": "hola", "timestamp": "2025-02-28T18:59:18.200000"},
                      {"role": "assistant", "content": "¿Sigues ahí?", "timestamp": "2025-02-28T19:08:00", "type": "system"}
                    ]
                  },
                  "5215500000000": {
                    "last_activity": "2025-02-28T19:00:00",
                    "state": "SOMETHING_NEW",
                    "inactivity_warning_sent": true,
                    "meta": {"total_messages": 12, "session_restarts": 3}
                  }
                }
                """;
        Path file = tempDir.resolve("sessions.json");
        Files.writeString(file, legacy, StandardCharsets.UTF_8);

        Map<String, SessionRecord> loaded = persister.load(file);

        assertEquals(2, loaded.size());
        SessionRecord first = loaded.get("5215512345678");
        Instant expectedActivity = LocalDateTime.parse("2025-02-28T19:03:00.000001")
                .atZone(ZoneId.systemDefault()).toInstant();
        assertEquals(expectedActivity, first.lastActivityAt());
        assertEquals(SessionState.AWAITING_QUERY, first.state());
        assertNull(first.conversationHandle());
        assertFalse(first.warningSent());
        assertFalse(first.closeNoticeSent());
        assertEquals(new SessionMeta(2, 0), first.meta());
        assertEquals(MessageRole.USER, first.history().get(0).role());
        assertTrue(first.history().get(1).isSystemNotice());

        SessionRecord second = loaded.get("5215500000000");
        assertEquals(SessionState.INITIAL, second.state());
        assertEquals(second.lastActivityAt(), second.createdAt());
        assertTrue(second.warningSent());
        assertEquals(new SessionMeta(12, 3), second.meta());
        assertTrue(second.history().isEmpty());
    }

    @Test
    void malformedEntryIsSkippedWithoutDroppingOthers() throws IOException {
        String mixed = """
                {
                  "good": {"last_activity": "2025-03-01T12:00:00Z"},
                  "no-timestamps": {"state": "INITIAL"},
                  "not-an-object": "oops"
                }
                """;
        Path file = tempDir.resolve("sessions.json");
        Files.writeString(file, mixed, StandardCharsets.UTF_8);

        Map<String, SessionRecord> loaded = persister.load(file);

        assertEquals(List.of("good"), List.copyOf(loaded.keySet()));
    }
}
