package com.williamcallahan.chatrelay.domain.session;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Conversational states a live session can be in. A closed session is simply absent from the store.
 */
public enum SessionState {
    /** Fresh session, no greeting handled yet. */
    @JsonEnumDefaultValue
    INITIAL,
    /** Greeted or finished a ticket; free-form questions go to the assistant. */
    AWAITING_QUERY,
    /** Collecting a ticket subject, then its description. */
    TICKET_CREATION
}
