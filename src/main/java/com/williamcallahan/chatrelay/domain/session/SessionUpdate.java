package com.williamcallahan.chatrelay.domain.session;

import java.util.Map;
import java.util.Optional;

/**
 * Partial session mutation. Absent fields leave the stored value untouched.
 */
public final class SessionUpdate {

    private final SessionState state;
    private final Map<String, String> context;
    private final String conversationHandle;

    private SessionUpdate(SessionState state, Map<String, String> context, String conversationHandle) {
        this.state = state;
        this.context = context == null ? null : Map.copyOf(context);
        this.conversationHandle = conversationHandle;
    }

    public static SessionUpdate state(SessionState state) {
        return new SessionUpdate(state, null, null);
    }

    public static SessionUpdate stateAndContext(SessionState state, Map<String, String> context) {
        return new SessionUpdate(state, context, null);
    }

    public static SessionUpdate context(Map<String, String> context) {
        return new SessionUpdate(null, context, null);
    }

    public static SessionUpdate conversationHandle(String conversationHandle) {
        return new SessionUpdate(null, null, conversationHandle);
    }

    public Optional<SessionState> state() {
        return Optional.ofNullable(state);
    }

    public Optional<Map<String, String>> context() {
        return Optional.ofNullable(context);
    }

    public Optional<String> conversationHandle() {
        return Optional.ofNullable(conversationHandle);
    }
}
