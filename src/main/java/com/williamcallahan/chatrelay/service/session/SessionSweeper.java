package com.williamcallahan.chatrelay.service.session;

import com.williamcallahan.chatrelay.config.SessionSettings;
import com.williamcallahan.chatrelay.domain.session.InactivityScan;
import com.williamcallahan.chatrelay.domain.session.SessionRecord;
import com.williamcallahan.chatrelay.service.MessageNotifier;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background worker that warns idle users, closes timed-out sessions and periodically snapshots the store.
 *
 * <p>Runs on a single dedicated thread. Each tick collects due sessions in one store call, then sends
 * notices outside the store lock so slow deliveries never block request threads. The sweeper thread is
 * also the only writer of the snapshot file; other components ask for a snapshot through
 * {@link #requestSnapshot()}.</p>
 */
public class SessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(SessionSweeper.class);
    private static final String THREAD_NAME = "session-sweeper";
    private static final Duration DEFAULT_SHUTDOWN_WAIT = Duration.ofSeconds(5);

    static final String WARNING_TEMPLATE =
            "¿Sigues ahí? Tu sesión se cerrará por inactividad en %d minutos.";
    static final String CLOSING_NOTICE =
            "Tu sesión ha sido cerrada debido a inactividad. Puedes iniciar una nueva conversación cuando lo necesites.";

    private final SessionStore sessionStore;
    private final MessageNotifier notifier;
    private final SessionSnapshotPersister persister;
    private final Clock clock;
    private final Path snapshotPath;
    private final Duration sweepInterval;
    private final Duration warningThreshold;
    private final Duration sessionTimeout;
    private final Duration snapshotInterval;
    private final Duration shutdownWait;
    private final AtomicBoolean snapshotRequested = new AtomicBoolean(false);

    private volatile Instant lastSnapshotAt;
    private ScheduledExecutorService scheduler;

    public SessionSweeper(
            SessionStore sessionStore,
            MessageNotifier notifier,
            SessionSnapshotPersister persister,
            Clock clock,
            SessionSettings settings) {
        this(sessionStore, notifier, persister, clock, settings, DEFAULT_SHUTDOWN_WAIT);
    }

    SessionSweeper(
            SessionStore sessionStore,
            MessageNotifier notifier,
            SessionSnapshotPersister persister,
            Clock clock,
            SessionSettings settings,
            Duration shutdownWait) {
        this.sessionStore = sessionStore;
        this.notifier = notifier;
        this.persister = persister;
        this.clock = clock;
        this.snapshotPath = Path.of(settings.getSnapshotPath());
        this.sweepInterval = settings.getSweepInterval();
        this.warningThreshold = settings.getWarningThreshold();
        this.sessionTimeout = settings.getTimeout();
        this.snapshotInterval = settings.getSnapshotInterval();
        this.shutdownWait = shutdownWait;
        this.lastSnapshotAt = clock.instant();
    }

    /**
     * Starts the periodic sweep. Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        lastSnapshotAt = clock.instant();
        long intervalMillis = sweepInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Session sweeper started (interval={}s, warning={}s, timeout={}s, snapshot={})",
                sweepInterval.toSeconds(), warningThreshold.toSeconds(), sessionTimeout.toSeconds(), snapshotPath);
    }

    /**
     * Stops the sweeper and writes a final snapshot once the sweeper thread has finished. When the thread
     * cannot be stopped the final snapshot is skipped, leaving the previous file intact.
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        ScheduledExecutorService stopping = scheduler;
        scheduler = null;
        if (!awaitSweeperExit(stopping)) {
            log.error("Session sweeper thread is still running, skipping final snapshot to {}", snapshotPath);
            return;
        }
        saveSnapshot();
        log.info("Session sweeper stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    /**
     * Asks for an out-of-cycle snapshot. Requests made while one is already pending collapse into it.
     */
    public void requestSnapshot() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = scheduler;
        }
        if (current == null || current.isShutdown()) {
            log.debug("Snapshot requested while sweeper is not running, ignoring");
            return;
        }
        if (snapshotRequested.compareAndSet(false, true)) {
            current.execute(() -> {
                snapshotRequested.set(false);
                saveSnapshot();
            });
        }
    }

    /**
     * Runs one sweep: warnings, closures, then the snapshot when the snapshot interval has elapsed.
     */
    public void sweep() {
        InactivityScan scan = sessionStore.scanInactive(warningThreshold, sessionTimeout);
        if (!scan.isEmpty()) {
            log.debug("Sweep found {} sessions to warn and {} to close", scan.toWarn().size(), scan.toClose().size());
        }
        String warning = warningText();
        for (String userId : scan.toWarn()) {
            try {
                notifier.send(userId, warning);
                sessionStore.appendSystemNotice(userId, warning);
                log.info("Sent inactivity warning to user {}", userId);
            } catch (RuntimeException e) {
                log.warn("Failed to warn user {} about inactivity", userId, e);
            }
        }
        for (String userId : scan.toClose()) {
            try {
                notifier.send(userId, CLOSING_NOTICE);
            } catch (RuntimeException e) {
                log.warn("Failed to send closing notice to user {}", userId, e);
            }
            sessionStore.closeIfExpired(userId, CLOSING_NOTICE).ifPresentOrElse(
                    closed -> logClosedSession(userId, closed),
                    () -> log.info("Session for user {} became active again before closing", userId));
        }
        Instant now = clock.instant();
        if (Duration.between(lastSnapshotAt, now).compareTo(snapshotInterval) >= 0) {
            saveSnapshot();
        }
    }

    String warningText() {
        long remainingMinutes = Math.max(1, sessionTimeout.minus(warningThreshold).toMinutes());
        return String.format(Locale.ROOT, WARNING_TEMPLATE, remainingMinutes);
    }

    private boolean awaitSweeperExit(ScheduledExecutorService stopping) {
        stopping.shutdown();
        try {
            if (stopping.awaitTermination(shutdownWait.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Session sweeper did not finish within {}ms, interrupting", shutdownWait.toMillis());
            stopping.shutdownNow();
            return stopping.awaitTermination(shutdownWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            stopping.shutdownNow();
            Thread.currentThread().interrupt();
            return stopping.isTerminated();
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Session sweep failed, will retry next interval", e);
        }
    }

    private void saveSnapshot() {
        if (persister.save(snapshotPath, sessionStore.snapshot())) {
            lastSnapshotAt = clock.instant();
        }
    }

    private static void logClosedSession(String userId, SessionRecord closed) {
        Duration duration = Duration.between(closed.createdAt(), closed.lastActivityAt());
        log.info("Closed session for user {} after inactivity (duration={}s, messages={}, restarts={})",
                userId, duration.toSeconds(), closed.meta().messageCount(), closed.meta().restartCount());
    }
}
