package com.williamcallahan.chatrelay.domain.assistant;

/**
 * Outcome of one assistant call. Callers switch on the variant instead of catching exceptions.
 */
public sealed interface AssistantResult
        permits AssistantResult.Completed, AssistantResult.Failed, AssistantResult.TimedOut {

    /**
     * The assistant produced a reply.
     *
     * @param text reply text
     * @param conversationHandle assistant thread the reply belongs to
     */
    record Completed(String text, String conversationHandle) implements AssistantResult {}

    /**
     * The call failed before a reply was produced.
     *
     * @param reason diagnostic reason, for logs only
     */
    record Failed(String reason) implements AssistantResult {}

    /**
     * The run did not finish within the configured wait.
     */
    record TimedOut() implements AssistantResult {}
}
