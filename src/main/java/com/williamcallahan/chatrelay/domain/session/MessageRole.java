package com.williamcallahan.chatrelay.domain.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Author of a history entry.
 */
public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    MessageRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a persisted role name, treating anything that is not "user" as an assistant entry.
     *
     * @param value persisted role name
     * @return matching role
     */
    @JsonCreator
    public static MessageRole fromWireName(String value) {
        if (value != null && USER.wireName.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return USER;
        }
        return ASSISTANT;
    }
}
