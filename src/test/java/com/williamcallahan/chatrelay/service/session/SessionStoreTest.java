package com.williamcallahan.chatrelay.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.chatrelay.domain.session.HistoryEntry;
import com.williamcallahan.chatrelay.domain.session.InactivityScan;
import com.williamcallahan.chatrelay.domain.session.MessageRole;
import com.williamcallahan.chatrelay.domain.session.SessionMeta;
import com.williamcallahan.chatrelay.domain.session.SessionRecord;
import com.williamcallahan.chatrelay.domain.session.SessionState;
import com.williamcallahan.chatrelay.domain.session.SessionUpdate;
import com.williamcallahan.chatrelay.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SessionStoreTest {

    private static final String USER = "5215512345678";
    private static final Duration TIMEOUT = Duration.ofSeconds(600);
    private static final Duration WARNING = Duration.ofSeconds(300);

    private MutableClock clock;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
        store = new SessionStore(clock, TIMEOUT);
    }

    @Test
    @DisplayName("First contact creates an INITIAL session with empty history and zeroed meta")
    void getOrCreateCreatesFreshSession() {
        SessionRecord session = store.getOrCreate(USER);

        assertEquals(SessionState.INITIAL, session.state());
        assertTrue(session.context().isEmpty());
        assertTrue(session.history().isEmpty());
        assertNull(session.conversationHandle());
        assertEquals(SessionMeta.empty(), session.meta());
        assertEquals(clock.instant(), session.createdAt());
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("Removing a session forgets it entirely and a later contact starts over")
    void removeDeletesSession() {
        store.getOrCreate(USER);
        store.appendHistory(USER, MessageRole.USER, "hola");

        store.remove(USER);

        assertTrue(store.find(USER).isEmpty());
        assertFalse(store.isActive(USER));
        assertEquals(0, store.size());
        assertEquals(SessionMeta.empty(), store.getOrCreate(USER).meta());
        store.remove("unknown");
    }

    @Test
    @DisplayName("Returning user gets the same session with refreshed activity")
    void getOrCreateRefreshesExistingSession() {
        store.getOrCreate(USER);
        store.update(USER, SessionUpdate.state(SessionState.AWAITING_QUERY));
        clock.advance(Duration.ofSeconds(42));

        SessionRecord session = store.getOrCreate(USER);

        assertEquals(SessionState.AWAITING_QUERY, session.state());
        assertEquals(clock.instant(), session.lastActivityAt());
        assertEquals(1, store.size());
    }

    @Test
    void updateAppliesOnlyProvidedFields() {
        store.getOrCreate(USER);
        store.update(USER, SessionUpdate.stateAndContext(SessionState.TICKET_CREATION, Map.of("ticket_subject", "VPN")));
        store.update(USER, SessionUpdate.conversationHandle("thread_abc"));

        SessionRecord session = store.find(USER).orElseThrow();
        assertEquals(SessionState.TICKET_CREATION, session.state());
        assertEquals(Map.of("ticket_subject", "VPN"), session.context());
        assertEquals("thread_abc", session.conversationHandle());
    }

    @Test
    void updateOfUnknownUserIsNoOp() {
        store.update("nobody", SessionUpdate.state(SessionState.AWAITING_QUERY));

        assertTrue(store.find("nobody").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Restart keeps the message count, bumps restarts and resets everything else")
    void restartPreservesMeta() {
        store.getOrCreate(USER);
        store.appendHistory(USER, MessageRole.USER, "hola");
        store.appendHistory(USER, MessageRole.ASSISTANT, "¡Hola!");
        store.update(USER, SessionUpdate.stateAndContext(SessionState.TICKET_CREATION, Map.of("ticket_subject", "x")));
        store.update(USER, SessionUpdate.conversationHandle("thread_1"));

        store.restart(USER);

        SessionRecord session = store.find(USER).orElseThrow();
        assertEquals(SessionState.INITIAL, session.state());
        assertTrue(session.context().isEmpty());
        assertTrue(session.history().isEmpty());
        assertNull(session.conversationHandle());
        assertEquals(new SessionMeta(2, 1), session.meta());
    }

    @Test
    void isActiveHonorsTimeout() {
        store.getOrCreate(USER);

        clock.advance(TIMEOUT.minusSeconds(1));
        assertTrue(store.isActive(USER));

        clock.advance(Duration.ofSeconds(1));
        assertFalse(store.isActive(USER));
        assertFalse(store.isActive("nobody"));
    }

    @Test
    void recentHistoryReturnsBoundedSuffixInOrder() {
        store.getOrCreate(USER);
        for (int i = 1; i <= 5; i++) {
            store.appendHistory(USER, MessageRole.USER, "m" + i);
        }

        List<HistoryEntry> recent = store.recentHistory(USER, 3);

        assertEquals(List.of("m3", "m4", "m5"), recent.stream().map(HistoryEntry::content).toList());
        assertEquals(5, store.recentHistory(USER, 50).size());
        assertTrue(store.recentHistory("nobody", 3).isEmpty());
        assertTrue(store.recentHistory(USER, 0).isEmpty());
    }

    @Test
    @DisplayName("Appending history counts as activity and clears inactivity flags")
    void appendClearsFlags() {
        store.getOrCreate(USER);
        clock.advance(WARNING);
        InactivityScan scan = store.scanInactive(WARNING, TIMEOUT);
        assertEquals(List.of(USER), scan.toWarn());
        assertTrue(store.find(USER).orElseThrow().warningSent());

        clock.advance(Duration.ofSeconds(5));
        store.appendHistory(USER, MessageRole.USER, "sigo aquí");

        SessionRecord session = store.find(USER).orElseThrow();
        assertFalse(session.warningSent());
        assertFalse(session.closeNoticeSent());
        assertEquals(clock.instant(), session.lastActivityAt());
    }

    @Test
    @DisplayName("System notices neither refresh activity nor count as messages")
    void systemNoticeDoesNotTouchActivity() {
        SessionRecord created = store.getOrCreate(USER);
        clock.advance(Duration.ofMinutes(6));

        store.appendSystemNotice(USER, "¿Sigues ahí?");

        SessionRecord session = store.find(USER).orElseThrow();
        assertEquals(created.lastActivityAt(), session.lastActivityAt());
        assertEquals(0, session.meta().messageCount());
        assertTrue(session.history().get(0).isSystemNotice());
        assertEquals(MessageRole.ASSISTANT, session.history().get(0).role());
    }

    @Test
    void lastActivityNeverMovesBackwards() {
        store.getOrCreate(USER);
        Instant later = clock.instant();
        clock.set(later.minusSeconds(30));

        store.appendHistory(USER, MessageRole.USER, "late clock");

        assertEquals(later, store.find(USER).orElseThrow().lastActivityAt());
    }

    @Test
    @DisplayName("Scan collects each session for warning once and for closing once")
    void scanMarksFlagsOnce() {
        store.getOrCreate(USER);

        clock.advance(WARNING);
        assertEquals(List.of(USER), store.scanInactive(WARNING, TIMEOUT).toWarn());
        assertTrue(store.scanInactive(WARNING, TIMEOUT).isEmpty());

        clock.advance(TIMEOUT.minus(WARNING));
        InactivityScan closing = store.scanInactive(WARNING, TIMEOUT);
        assertEquals(List.of(USER), closing.toClose());
        assertTrue(closing.toWarn().isEmpty());
        assertTrue(store.scanInactive(WARNING, TIMEOUT).isEmpty());
    }

    @Test
    void closeIfExpiredRemovesSessionAndRecordsNotice() {
        store.getOrCreate(USER);
        store.appendHistory(USER, MessageRole.USER, "hola");
        clock.advance(TIMEOUT);
        store.scanInactive(WARNING, TIMEOUT);

        SessionRecord closed = store.closeIfExpired(USER, "cerrada").orElseThrow();

        assertTrue(store.find(USER).isEmpty());
        HistoryEntry last = closed.history().get(closed.history().size() - 1);
        assertEquals("cerrada", last.content());
        assertTrue(last.isSystemNotice());
        assertEquals(1, closed.meta().messageCount());
    }

    @Test
    @DisplayName("A session that became active after the scan is not closed")
    void closeIfExpiredSkipsReactivatedSession() {
        store.getOrCreate(USER);
        clock.advance(TIMEOUT);
        assertEquals(List.of(USER), store.scanInactive(WARNING, TIMEOUT).toClose());

        store.appendHistory(USER, MessageRole.USER, "¡espera!");

        assertTrue(store.closeIfExpired(USER, "cerrada").isEmpty());
        assertTrue(store.find(USER).isPresent());
    }

    @Test
    void snapshotIsDetachedCopy() {
        store.getOrCreate(USER);
        Map<String, SessionRecord> snapshot = store.snapshot();

        store.appendHistory(USER, MessageRole.USER, "after snapshot");

        assertTrue(snapshot.get(USER).history().isEmpty());
        assertEquals(1, store.find(USER).orElseThrow().history().size());
    }

    @Test
    void restoreLoadsSessionsWithDefaults() {
        Instant lastActivity = clock.instant().minusSeconds(30);
        SessionRecord partial = new SessionRecord(null, lastActivity, null, null, "thread_9",
                List.of(HistoryEntry.user("hola", lastActivity), HistoryEntry.assistant("¡Hola!", lastActivity)),
                false, false, null);

        store.restore(Map.of(USER, partial));

        SessionRecord restored = store.find(USER).orElseThrow();
        assertEquals(SessionState.INITIAL, restored.state());
        assertEquals(lastActivity, restored.createdAt());
        assertEquals(new SessionMeta(2, 0), restored.meta());
        assertEquals("thread_9", restored.conversationHandle());
        assertTrue(store.isActive(USER));
    }

    @Test
    @DisplayName("Restore clears a persisted closing flag and keeps the warning flag")
    void restoreReopensInterruptedClosure() {
        Instant longAgo = clock.instant().minus(Duration.ofHours(2));
        store.restore(Map.of(USER, new SessionRecord(longAgo, longAgo, SessionState.AWAITING_QUERY,
                Map.of(), null, List.of(), true, true, null)));

        SessionRecord restored = store.find(USER).orElseThrow();
        assertTrue(restored.warningSent());
        assertFalse(restored.closeNoticeSent());

        InactivityScan scan = store.scanInactive(WARNING, TIMEOUT);
        assertEquals(List.of(USER), scan.toClose());
        assertTrue(store.closeIfExpired(USER, "cerrada").isPresent());
        assertEquals(0, store.size());
    }

    @Test
    void totalMessageCountSumsAllSessions() {
        store.getOrCreate("a");
        store.getOrCreate("b");
        store.appendHistory("a", MessageRole.USER, "1");
        store.appendHistory("a", MessageRole.ASSISTANT, "2");
        store.appendHistory("b", MessageRole.USER, "3");

        assertEquals(3, store.totalMessageCount());
    }

    @Test
    @DisplayName("Concurrent appends are all counted")
    void concurrentAppendsAreAtomic() throws Exception {
        int threads = 8;
        int appendsPerThread = 250;
        store.getOrCreate(USER);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    startGate.await();
                    for (int i = 0; i < appendsPerThread; i++) {
                        store.appendHistory(USER, MessageRole.USER, "msg");
                        store.scanInactive(WARNING, TIMEOUT);
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        SessionRecord session = store.find(USER).orElseThrow();
        assertEquals(threads * appendsPerThread, session.meta().messageCount());
        assertEquals(threads * appendsPerThread, session.history().size());
    }
}
