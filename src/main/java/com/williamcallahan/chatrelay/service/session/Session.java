package com.williamcallahan.chatrelay.service.session;

import com.williamcallahan.chatrelay.domain.session.HistoryEntry;
import com.williamcallahan.chatrelay.domain.session.SessionMeta;
import com.williamcallahan.chatrelay.domain.session.SessionRecord;
import com.williamcallahan.chatrelay.domain.session.SessionState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable session owned by {@link SessionStore}. Only ever touched while the store's write lock is held.
 */
final class Session {

    private final Instant createdAt;
    private Instant lastActivityAt;
    private SessionState state;
    private final Map<String, String> context;
    private String conversationHandle;
    private final List<HistoryEntry> history;
    private boolean warningSent;
    private boolean closeNoticeSent;
    private SessionMeta meta;

    private Session(SessionRecord source) {
        this.createdAt = source.createdAt();
        this.lastActivityAt = source.lastActivityAt();
        this.state = source.state();
        this.context = new LinkedHashMap<>(source.context());
        this.conversationHandle = source.conversationHandle();
        this.history = new ArrayList<>(source.history());
        this.warningSent = source.warningSent();
        this.closeNoticeSent = source.closeNoticeSent();
        this.meta = source.meta();
    }

    static Session from(SessionRecord source) {
        return new Session(source);
    }

    static Session fresh(Instant now, SessionMeta meta) {
        return new Session(SessionRecord.fresh(now, meta));
    }

    SessionRecord toRecord() {
        return new SessionRecord(createdAt, lastActivityAt, state, context, conversationHandle, history,
                warningSent, closeNoticeSent, meta);
    }

    /**
     * Records activity: last activity never moves backwards and both notice flags are cleared.
     */
    void touch(Instant now) {
        if (now.isAfter(lastActivityAt)) {
            lastActivityAt = now;
        }
        warningSent = false;
        closeNoticeSent = false;
    }

    Instant lastActivityAt() {
        return lastActivityAt;
    }

    SessionMeta meta() {
        return meta;
    }

    void setState(SessionState state) {
        this.state = state;
    }

    void replaceContext(Map<String, String> newContext) {
        context.clear();
        context.putAll(newContext);
    }

    void setConversationHandle(String conversationHandle) {
        this.conversationHandle = conversationHandle;
    }

    void appendCounted(HistoryEntry entry) {
        history.add(entry);
        meta = meta.withMessage();
    }

    void appendUncounted(HistoryEntry entry) {
        history.add(entry);
    }

    List<HistoryEntry> history() {
        return history;
    }

    boolean isWarningSent() {
        return warningSent;
    }

    void markWarningSent() {
        warningSent = true;
    }

    boolean isCloseNoticeSent() {
        return closeNoticeSent;
    }

    void markCloseNoticeSent() {
        closeNoticeSent = true;
    }

    /**
     * Makes a restored session eligible for closing again; a persisted close flag may belong to a
     * closure that never completed.
     */
    void clearCloseNotice() {
        closeNoticeSent = false;
    }
}
