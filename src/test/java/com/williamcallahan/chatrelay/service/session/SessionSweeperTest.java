package com.williamcallahan.chatrelay.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.chatrelay.config.SessionSettings;
import com.williamcallahan.chatrelay.domain.session.HistoryEntry;
import com.williamcallahan.chatrelay.domain.session.MessageRole;
import com.williamcallahan.chatrelay.domain.session.SessionRecord;
import com.williamcallahan.chatrelay.domain.session.SessionState;
import com.williamcallahan.chatrelay.service.MessageNotifier;
import com.williamcallahan.chatrelay.support.MutableClock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionSweeperTest {

    private static final String USER = "5215512345678";
    private static final String WARNING = "¿Sigues ahí? Tu sesión se cerrará por inactividad en 5 minutos.";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SessionStore store;
    private MessageNotifier notifier;
    private SessionSnapshotPersister persister;
    private Path snapshotPath;
    private SessionSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
        SessionSettings settings = new SessionSettings();
        snapshotPath = tempDir.resolve("sessions.json");
        settings.setSnapshotPath(snapshotPath.toString());
        store = new SessionStore(clock, settings.getTimeout());
        notifier = mock(MessageNotifier.class);
        when(notifier.send(anyString(), anyString())).thenReturn(true);
        persister = new SessionSnapshotPersister();
        sweeper = new SessionSweeper(store, notifier, persister, clock, settings);
    }

    @AfterEach
    void tearDown() {
        sweeper.stop();
    }

    @Test
    void warningTextStatesRemainingMinutes() {
        assertEquals(WARNING, sweeper.warningText());
    }

    @Test
    @DisplayName("An idle session is warned exactly once")
    void warnsOnce() {
        store.getOrCreate(USER);
        clock.advance(Duration.ofSeconds(300));

        sweeper.sweep();
        clock.advance(Duration.ofSeconds(30));
        sweeper.sweep();

        verify(notifier, times(1)).send(USER, WARNING);
        SessionRecord session = store.find(USER).orElseThrow();
        assertTrue(session.warningSent());
        HistoryEntry notice = session.history().get(session.history().size() - 1);
        assertTrue(notice.isSystemNotice());
        assertEquals(WARNING, notice.content());
    }

    @Test
    @DisplayName("A timed-out session gets one closing notice and is removed")
    void closesOnceAndRemoves() {
        store.getOrCreate(USER);
        clock.advance(Duration.ofSeconds(300));
        sweeper.sweep();
        clock.advance(Duration.ofSeconds(300));

        sweeper.sweep();
        sweeper.sweep();

        verify(notifier, times(1)).send(USER, SessionSweeper.CLOSING_NOTICE);
        assertTrue(store.find(USER).isEmpty());
    }

    @Test
    void activityAfterWarningRearmsTheWarning() {
        store.getOrCreate(USER);
        clock.advance(Duration.ofSeconds(300));
        sweeper.sweep();

        store.appendHistory(USER, MessageRole.USER, "aquí estoy");
        clock.advance(Duration.ofSeconds(299));
        sweeper.sweep();
        verify(notifier, times(1)).send(USER, WARNING);

        clock.advance(Duration.ofSeconds(1));
        sweeper.sweep();
        verify(notifier, times(2)).send(USER, WARNING);
        verify(notifier, never()).send(USER, SessionSweeper.CLOSING_NOTICE);
    }

    @Test
    @DisplayName("A failing notifier does not keep a timed-out session alive")
    void closesEvenWhenNotifierFails() {
        doThrow(new IllegalStateException("down")).when(notifier).send(eq(USER), anyString());
        store.getOrCreate(USER);
        clock.advance(Duration.ofSeconds(600));

        sweeper.sweep();

        assertTrue(store.find(USER).isEmpty());
    }

    @Test
    void snapshotsOnlyAfterSnapshotIntervalElapses() {
        store.getOrCreate(USER);

        clock.advance(Duration.ofMinutes(4));
        sweeper.sweep();
        assertFalse(Files.exists(snapshotPath));

        clock.advance(Duration.ofMinutes(1));
        sweeper.sweep();
        assertTrue(Files.exists(snapshotPath));
        Map<String, SessionRecord> saved = persister.load(snapshotPath);
        assertTrue(saved.containsKey(USER));
    }

    @Test
    void stopWritesFinalSnapshot() {
        store.getOrCreate(USER);
        sweeper.start();
        assertTrue(sweeper.isRunning());

        sweeper.stop();

        assertFalse(sweeper.isRunning());
        assertTrue(persister.load(snapshotPath).containsKey(USER));
    }

    @Test
    void snapshotRequestIsIgnoredWhenNotRunning() {
        store.getOrCreate(USER);

        sweeper.requestSnapshot();

        assertFalse(Files.exists(snapshotPath));
    }

    @Test
    void snapshotRequestIsServedBySweeperThread() throws InterruptedException {
        store.getOrCreate(USER);
        sweeper.start();

        sweeper.requestSnapshot();

        long deadline = System.currentTimeMillis() + 5_000;
        while (!Files.exists(snapshotPath) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(Files.exists(snapshotPath));
    }

    @Test
    @DisplayName("A restored session left mid-closure is closed by the next sweep")
    void closesRestoredSessionWhoseClosureWasInterrupted() {
        Instant twoHoursAgo = clock.instant().minus(Duration.ofHours(2));
        store.restore(Map.of(USER, new SessionRecord(twoHoursAgo, twoHoursAgo, SessionState.AWAITING_QUERY,
                Map.of(), "thread_1", List.of(), true, true, null)));

        sweeper.sweep();

        assertTrue(store.find(USER).isEmpty());
        assertEquals(0, store.size());
        verify(notifier, times(1)).send(USER, SessionSweeper.CLOSING_NOTICE);
        verify(notifier, never()).send(USER, WARNING);
    }

    @Test
    @DisplayName("Stop skips the final snapshot while the sweeper thread is still busy")
    void stopDoesNotWriteWhileSweeperThreadIsStuck() throws InterruptedException {
        CountDownLatch sending = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        MessageNotifier stuckNotifier = mock(MessageNotifier.class);
        when(stuckNotifier.send(anyString(), anyString())).thenAnswer(invocation -> {
            sending.countDown();
            awaitIgnoringInterrupts(release);
            return true;
        });
        SessionSettings settings = new SessionSettings();
        settings.setSnapshotPath(snapshotPath.toString());
        settings.setSweepInterval(Duration.ofMillis(10));
        SessionSweeper busySweeper = new SessionSweeper(
                store, stuckNotifier, persister, clock, settings, Duration.ofMillis(50));
        store.getOrCreate(USER);
        clock.advance(Duration.ofSeconds(300));

        busySweeper.start();
        try {
            assertTrue(sending.await(5, TimeUnit.SECONDS));
            busySweeper.stop();

            assertFalse(busySweeper.isRunning());
            assertFalse(Files.exists(snapshotPath));
        } finally {
            release.countDown();
        }
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
