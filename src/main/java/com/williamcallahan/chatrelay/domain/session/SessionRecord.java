package com.williamcallahan.chatrelay.domain.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.williamcallahan.chatrelay.support.LenientInstantDeserializer;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a session, used for reads, snapshots and restore.
 *
 * <p>The canonical constructor is the only place defaults are applied, so records built from an
 * older or partial snapshot file come out fully populated: missing flags are false, missing counters
 * are derived from the history, and a missing creation time falls back to the last activity.</p>
 *
 * @param createdAt when the session (or its latest restart) began
 * @param lastActivityAt last user-visible activity; drives warnings and expiry
 * @param state conversational state
 * @param context state-scoped key/value data such as the pending ticket subject
 * @param conversationHandle assistant thread id, null until the first assistant call
 * @param history ordered conversation history
 * @param warningSent whether the inactivity warning went out since the last activity
 * @param closeNoticeSent whether the closing notice went out since the last activity
 * @param meta counters preserved across restarts
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRecord(
        @JsonProperty("created_at") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant createdAt,
        @JsonProperty("last_activity") @JsonDeserialize(using = LenientInstantDeserializer.class)
                Instant lastActivityAt,
        @JsonProperty("state") SessionState state,
        @JsonProperty("context") Map<String, String> context,
        @JsonProperty("thread_id") String conversationHandle,
        @JsonProperty("message_history") List<HistoryEntry> history,
        @JsonProperty("inactivity_warning_sent") boolean warningSent,
        @JsonProperty("closing_notice_sent") boolean closeNoticeSent,
        @JsonProperty("meta") SessionMeta meta) {

    public SessionRecord {
        lastActivityAt = Objects.requireNonNull(lastActivityAt == null ? createdAt : lastActivityAt, "lastActivityAt");
        createdAt = createdAt == null ? lastActivityAt : createdAt;
        state = state == null ? SessionState.INITIAL : state;
        context = withoutNullValues(context);
        history = history == null ? List.of() : history.stream().filter(Objects::nonNull).toList();
        meta = meta == null ? new SessionMeta(history.size(), 0) : meta;
    }

    /**
     * Builds a fresh INITIAL session.
     *
     * @param now creation time
     * @param meta counters carried over from a previous session, or {@link SessionMeta#empty()}
     * @return new record with empty context and history
     */
    public static SessionRecord fresh(Instant now, SessionMeta meta) {
        return new SessionRecord(now, now, SessionState.INITIAL, Map.of(), null, List.of(), false, false, meta);
    }

    private static Map<String, String> withoutNullValues(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
