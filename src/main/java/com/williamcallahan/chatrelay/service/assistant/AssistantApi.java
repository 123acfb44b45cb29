package com.williamcallahan.chatrelay.service.assistant;

import com.williamcallahan.chatrelay.domain.assistant.RunPhase;
import java.util.Optional;

/**
 * Thin seam over the Assistants API calls the relay needs. Methods throw unchecked exceptions on
 * transport or API errors.
 */
public interface AssistantApi {

    String createThread();

    void addUserMessage(String threadId, String text);

    String startRun(String threadId, String assistantId);

    RunPhase runPhase(String threadId, String runId);

    void cancelRun(String threadId, String runId);

    /**
     * Returns the text of the newest assistant-authored message in the thread.
     *
     * @param threadId assistant thread
     * @return joined text blocks, or empty when the newest messages carry no assistant text
     */
    Optional<String> latestAssistantText(String threadId);
}
