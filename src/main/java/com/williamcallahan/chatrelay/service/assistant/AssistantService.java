package com.williamcallahan.chatrelay.service.assistant;

import com.williamcallahan.chatrelay.config.AppProperties;
import com.williamcallahan.chatrelay.config.Assistant;
import com.williamcallahan.chatrelay.domain.assistant.AssistantResult;
import com.williamcallahan.chatrelay.domain.assistant.RunPhase;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Relays a user message to the configured assistant and polls the run until it finishes or the
 * wall-clock limit passes. Every failure is turned into an {@link AssistantResult}; nothing is thrown.
 */
@Service
public class AssistantService implements AssistantGateway {

    private static final Logger log = LoggerFactory.getLogger(AssistantService.class);

    static final String NAME_PREFIX = "The user's name is %s. ";
    static final String NO_TEXT_REPLY = "No se encontró una respuesta de texto.";

    private final AssistantApi assistantApi;
    private final ConversationHandleRegistry handleRegistry;
    private final Assistant settings;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public AssistantService(
            AssistantApi assistantApi, ConversationHandleRegistry handleRegistry, AppProperties appProperties,
            Clock clock) {
        this(assistantApi, handleRegistry, appProperties.getAssistant(), clock, Sleeper.THREAD_SLEEP);
    }

    AssistantService(
            AssistantApi assistantApi, ConversationHandleRegistry handleRegistry, Assistant settings, Clock clock,
            Sleeper sleeper) {
        this.assistantApi = assistantApi;
        this.handleRegistry = handleRegistry;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public AssistantResult reply(String userId, String displayName, String text) {
        if (!settings.isConfigured()) {
            log.error("Assistant call skipped for user {}: API key or assistant id not configured", userId);
            return new AssistantResult.Failed("assistant not configured");
        }
        String threadId = null;
        String runId = null;
        try {
            threadId = resolveThread(userId);
            assistantApi.addUserMessage(threadId, withDisplayName(displayName, text));
            runId = assistantApi.startRun(threadId, settings.getAssistantId());
            return awaitRun(threadId, runId);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            cancelQuietly(threadId, runId);
            return new AssistantResult.Failed("interrupted while waiting for the assistant");
        } catch (RuntimeException e) {
            log.error("Assistant call failed for user {} (thread={}, run={})", userId, threadId, runId, e);
            return new AssistantResult.Failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    @Override
    public void forgetConversation(String userId) {
        handleRegistry.forget(userId);
    }

    private AssistantResult awaitRun(String threadId, String runId) throws InterruptedException {
        Instant deadline = clock.instant().plus(settings.getMaxWait());
        Duration pollInterval = settings.getPollInterval();
        while (true) {
            RunPhase phase = assistantApi.runPhase(threadId, runId);
            switch (phase) {
                case COMPLETED:
                    String replyText = assistantApi.latestAssistantText(threadId).orElse(NO_TEXT_REPLY);
                    return new AssistantResult.Completed(replyText, threadId);
                case FAILED:
                case REQUIRES_ACTION:
                    log.warn("Assistant run {} on thread {} ended with {}", runId, threadId, phase);
                    return new AssistantResult.Failed("run ended with " + phase);
                default:
                    break;
            }
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Assistant run {} on thread {} exceeded {}s, cancelling",
                        runId, threadId, settings.getMaxWait().toSeconds());
                cancelQuietly(threadId, runId);
                return new AssistantResult.TimedOut();
            }
            sleeper.sleep(pollInterval);
        }
    }

    private String resolveThread(String userId) {
        return handleRegistry.findOrCreate(userId, () -> {
            String threadId = assistantApi.createThread();
            log.info("Created assistant thread {} for user {}", threadId, userId);
            return threadId;
        });
    }

    private void cancelQuietly(String threadId, String runId) {
        if (threadId == null || runId == null) {
            return;
        }
        try {
            assistantApi.cancelRun(threadId, runId);
        } catch (RuntimeException e) {
            log.warn("Failed to cancel assistant run {} on thread {}: {}", runId, threadId, e.getMessage());
        }
    }

    static String withDisplayName(String displayName, String text) {
        if (displayName == null || displayName.isBlank()) {
            return text;
        }
        return String.format(NAME_PREFIX, displayName.trim()) + text;
    }
}
