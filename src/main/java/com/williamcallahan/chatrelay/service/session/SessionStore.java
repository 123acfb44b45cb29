package com.williamcallahan.chatrelay.service.session;

import com.williamcallahan.chatrelay.domain.session.HistoryEntry;
import com.williamcallahan.chatrelay.domain.session.InactivityScan;
import com.williamcallahan.chatrelay.domain.session.MessageRole;
import com.williamcallahan.chatrelay.domain.session.SessionMeta;
import com.williamcallahan.chatrelay.domain.session.SessionRecord;
import com.williamcallahan.chatrelay.domain.session.SessionUpdate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory, thread-safe owner of every live conversation session, keyed by user id.
 *
 * <p>Request threads and the expiration sweeper share one instance. Every mutation runs under the write
 * lock and every read returns an immutable {@link SessionRecord} copy, so no caller ever observes a
 * half-applied change. Public updates and appends count as activity: they advance the last-activity
 * time (which never moves backwards) and clear both inactivity flags.</p>
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<String, Session> sessions = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final Duration sessionTimeout;

    /**
     * Creates an empty store.
     *
     * @param clock time source for activity timestamps
     * @param sessionTimeout inactivity after which a session is no longer active
     */
    public SessionStore(Clock clock, Duration sessionTimeout) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionTimeout = Objects.requireNonNull(sessionTimeout, "sessionTimeout");
    }

    /**
     * Returns the user's session, creating a fresh INITIAL one when none exists.
     * An existing session is treated as active again.
     *
     * @param userId opaque user identifier
     * @return snapshot of the session after the call
     */
    public SessionRecord getOrCreate(String userId) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            Session session = sessions.get(userId);
            if (session == null) {
                session = Session.fresh(now, SessionMeta.empty());
                sessions.put(userId, session);
                log.info("Created new session for user {}", userId);
            } else {
                session.touch(now);
            }
            return session.toRecord();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Reads a session without counting the read as activity.
     *
     * @param userId opaque user identifier
     * @return session snapshot, or empty when the user has no session
     */
    public Optional<SessionRecord> find(String userId) {
        lock.readLock().lock();
        try {
            Session session = sessions.get(userId);
            return session == null ? Optional.empty() : Optional.of(session.toRecord());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies the fields present in the update. Unknown users are ignored.
     *
     * @param userId opaque user identifier
     * @param update partial change
     */
    public void update(String userId, SessionUpdate update) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            Session session = sessions.get(userId);
            if (session == null) {
                return;
            }
            update.state().ifPresent(session::setState);
            update.context().ifPresent(session::replaceContext);
            update.conversationHandle().ifPresent(session::setConversationHandle);
            session.touch(now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the session with a fresh INITIAL one, carrying the message count over and bumping the
     * restart count. Unknown users are ignored.
     *
     * @param userId opaque user identifier
     */
    public void restart(String userId) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            Session previous = sessions.get(userId);
            if (previous == null) {
                return;
            }
            sessions.put(userId, Session.fresh(now, previous.meta().withRestart()));
            log.info("Restarted session for user {}", userId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(String userId) {
        lock.writeLock().lock();
        try {
            sessions.remove(userId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns whether the user has a session whose inactivity is still below the timeout.
     *
     * @param userId opaque user identifier
     * @return true when the session exists and has not timed out
     */
    public boolean isActive(String userId) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            Session session = sessions.get(userId);
            return session != null && now.isBefore(session.lastActivityAt().plus(sessionTimeout));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Appends a user or assistant message, counting it in the session meta and treating it as activity.
     * Unknown users are ignored.
     *
     * @param userId opaque user identifier
     * @param role message author
     * @param content message text
     */
    public void appendHistory(String userId, MessageRole role, String content) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            Session session = sessions.get(userId);
            if (session == null) {
                return;
            }
            session.appendCounted(new HistoryEntry(role, content, now, null));
            session.touch(now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends a sweeper notice. Notices are not activity and are not counted, so a warning can never keep
     * a session alive.
     *
     * @param userId opaque user identifier
     * @param content notice text
     */
    public void appendSystemNotice(String userId, String content) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            Session session = sessions.get(userId);
            if (session != null) {
                session.appendUncounted(HistoryEntry.systemNotice(content, now));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the last {@code limit} history entries in insertion order.
     *
     * @param userId opaque user identifier
     * @param limit maximum number of entries
     * @return bounded history suffix, empty for unknown users
     */
    public List<HistoryEntry> recentHistory(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            Session session = sessions.get(userId);
            if (session == null) {
                return List.of();
            }
            List<HistoryEntry> history = session.history();
            int fromIndex = Math.max(0, history.size() - limit);
            return List.copyOf(history.subList(fromIndex, history.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds sessions that crossed the warning threshold or the timeout and marks them in the same lock
     * acquisition, so each session is collected for a warning at most once and for closing at most once
     * per period of inactivity.
     *
     * @param warningThreshold inactivity after which a warning is due
     * @param timeout inactivity after which the session is closed
     * @return user ids to warn and to close
     */
    public InactivityScan scanInactive(Duration warningThreshold, Duration timeout) {
        Instant now = clock.instant();
        List<String> toWarn = new ArrayList<>();
        List<String> toClose = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, Session> entry : sessions.entrySet()) {
                Session session = entry.getValue();
                Duration inactive = Duration.between(session.lastActivityAt(), now);
                if (inactive.compareTo(timeout) >= 0) {
                    if (!session.isCloseNoticeSent()) {
                        session.markCloseNoticeSent();
                        toClose.add(entry.getKey());
                    }
                } else if (inactive.compareTo(warningThreshold) >= 0 && !session.isWarningSent()) {
                    session.markWarningSent();
                    toWarn.add(entry.getKey());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return new InactivityScan(toWarn, toClose);
    }

    /**
     * Deletes a session collected for closing, unless the user became active again after the scan.
     * The closing notice is appended to the history before deletion.
     *
     * @param userId opaque user identifier
     * @param closingNotice text of the closing notice
     * @return the closed session, or empty when it was reactivated or already gone
     */
    public Optional<SessionRecord> closeIfExpired(String userId, String closingNotice) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            Session session = sessions.get(userId);
            if (session == null || !session.isCloseNoticeSent()) {
                return Optional.empty();
            }
            session.appendUncounted(HistoryEntry.systemNotice(closingNotice, now));
            sessions.remove(userId);
            return Optional.of(session.toRecord());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copies every session for persistence. The copy is taken under the read lock; serializing it happens
     * outside, so the snapshot is consistent without holding the lock during I/O.
     *
     * @return point-in-time copy keyed by user id
     */
    public Map<String, SessionRecord> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, SessionRecord> copy = new LinkedHashMap<>();
            sessions.forEach((userId, session) -> copy.put(userId, session.toRecord()));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Loads persisted sessions into the store, replacing any live session with the same user id.
     * The closing flag is cleared so the next sweep closes sessions whose closure was interrupted;
     * the warning flag is kept so a restart does not repeat a warning already sent.
     *
     * @param records sessions keyed by user id
     */
    public void restore(Map<String, SessionRecord> records) {
        lock.writeLock().lock();
        try {
            records.forEach((userId, sessionRecord) -> {
                if (userId != null && sessionRecord != null) {
                    Session session = Session.from(sessionRecord);
                    session.clearCloseNotice();
                    sessions.put(userId, session);
                }
            });
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Restored {} sessions", records.size());
    }

    public int size() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sums the message counters of all live sessions.
     *
     * @return total counted messages
     */
    public long totalMessageCount() {
        lock.readLock().lock();
        try {
            long total = 0;
            for (Session session : sessions.values()) {
                total += session.meta().messageCount();
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }
}
