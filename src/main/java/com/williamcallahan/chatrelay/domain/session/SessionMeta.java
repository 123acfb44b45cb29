package com.williamcallahan.chatrelay.domain.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters that survive a session restart and are only reset when the session is deleted.
 *
 * @param messageCount number of user and assistant messages appended
 * @param restartCount number of explicit restarts
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionMeta(
        @JsonProperty("total_messages") int messageCount,
        @JsonProperty("session_restarts") int restartCount) {

    public static SessionMeta empty() {
        return new SessionMeta(0, 0);
    }

    public SessionMeta withMessage() {
        return new SessionMeta(messageCount + 1, restartCount);
    }

    public SessionMeta withRestart() {
        return new SessionMeta(messageCount, restartCount + 1);
    }
}
