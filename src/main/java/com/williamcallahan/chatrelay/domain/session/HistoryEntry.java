package com.williamcallahan.chatrelay.domain.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.williamcallahan.chatrelay.support.LenientInstantDeserializer;
import java.time.Instant;
import java.util.Objects;

/**
 * One message in a session's conversation history.
 *
 * @param role author of the message
 * @param content message text
 * @param timestamp when the entry was recorded
 * @param type optional tag; {@value #SYSTEM_TYPE} marks notices emitted by the expiration sweeper
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntry(
        @JsonProperty("role") MessageRole role,
        @JsonProperty("content") String content,
        @JsonProperty("timestamp") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp,
        @JsonProperty("type") String type) {

    public static final String SYSTEM_TYPE = "system";

    public HistoryEntry {
        role = role == null ? MessageRole.ASSISTANT : role;
        content = content == null ? "" : content;
        timestamp = Objects.requireNonNullElse(timestamp, Instant.EPOCH);
    }

    public static HistoryEntry user(String content, Instant timestamp) {
        return new HistoryEntry(MessageRole.USER, content, timestamp, null);
    }

    public static HistoryEntry assistant(String content, Instant timestamp) {
        return new HistoryEntry(MessageRole.ASSISTANT, content, timestamp, null);
    }

    public static HistoryEntry systemNotice(String content, Instant timestamp) {
        return new HistoryEntry(MessageRole.ASSISTANT, content, timestamp, SYSTEM_TYPE);
    }

    @JsonIgnore
    public boolean isSystemNotice() {
        return SYSTEM_TYPE.equals(type);
    }
}
