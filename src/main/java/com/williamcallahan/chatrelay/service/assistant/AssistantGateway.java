package com.williamcallahan.chatrelay.service.assistant;

import com.williamcallahan.chatrelay.domain.assistant.AssistantResult;

/**
 * Conversational assistant as seen by the message router. Implementations never throw.
 */
public interface AssistantGateway {

    /**
     * Sends a user message to the assistant and waits for the reply.
     *
     * @param userId user identifier, used to find or create the user's assistant thread
     * @param displayName user's display name, may be blank
     * @param text message text
     * @return completed reply, failure or timeout
     */
    AssistantResult reply(String userId, String displayName, String text);

    /**
     * Drops the user's assistant thread so the next message starts a new conversation.
     *
     * @param userId user identifier
     */
    void forgetConversation(String userId);
}
