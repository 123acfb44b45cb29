package com.williamcallahan.chatrelay.service.assistant;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.beta.threads.ThreadCreateParams;
import com.openai.models.beta.threads.messages.Message;
import com.openai.models.beta.threads.messages.MessageContent;
import com.openai.models.beta.threads.messages.MessageCreateParams;
import com.openai.models.beta.threads.messages.MessageListParams;
import com.openai.models.beta.threads.runs.Run;
import com.openai.models.beta.threads.runs.RunCancelParams;
import com.openai.models.beta.threads.runs.RunCreateParams;
import com.openai.models.beta.threads.runs.RunRetrieveParams;
import com.openai.models.beta.threads.runs.RunStatus;
import com.williamcallahan.chatrelay.config.AppProperties;
import com.williamcallahan.chatrelay.config.Assistant;
import com.williamcallahan.chatrelay.domain.assistant.RunPhase;
import com.williamcallahan.chatrelay.support.OpenAiSdkUrlNormalizer;
import jakarta.annotation.PostConstruct;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link AssistantApi} backed by the OpenAI Java SDK's Assistants (beta) endpoints.
 */
@Component
public class OpenAiAssistantApi implements AssistantApi {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAssistantApi.class);

    private final Assistant settings;
    private OpenAIClient client;
    private boolean isAvailable = false;

    public OpenAiAssistantApi(AppProperties appProperties) {
        this.settings = appProperties.getAssistant();
    }

    @PostConstruct
    public void initializeClient() {
        String apiKey = settings.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No OPENAI_API_KEY configured - assistant replies will not be available");
            return;
        }
        try {
            String baseUrl = OpenAiSdkUrlNormalizer.normalize(settings.getBaseUrl());
            this.client = OpenAIOkHttpClient.builder()
                    .apiKey(apiKey)
                    .baseUrl(baseUrl)
                    .timeout(settings.getRequestTimeout())
                    .build();
            this.isAvailable = true;
            log.info("OpenAI assistant client initialized ({})", baseUrl);
        } catch (RuntimeException e) {
            log.error("Failed to initialize OpenAI assistant client", e);
            this.isAvailable = false;
        }
    }

    public boolean isAvailable() {
        return isAvailable && client != null;
    }

    @Override
    public String createThread() {
        return requireClient().beta().threads().create(ThreadCreateParams.builder().build()).id();
    }

    @Override
    public void addUserMessage(String threadId, String text) {
        MessageCreateParams params = MessageCreateParams.builder()
                .threadId(threadId)
                .role(MessageCreateParams.Role.USER)
                .content(text)
                .build();
        requireClient().beta().threads().messages().create(params);
    }

    @Override
    public String startRun(String threadId, String assistantId) {
        RunCreateParams params = RunCreateParams.builder()
                .threadId(threadId)
                .assistantId(assistantId)
                .build();
        return requireClient().beta().threads().runs().create(params).id();
    }

    @Override
    public RunPhase runPhase(String threadId, String runId) {
        RunRetrieveParams params = RunRetrieveParams.builder()
                .threadId(threadId)
                .runId(runId)
                .build();
        Run run = requireClient().beta().threads().runs().retrieve(params);
        return toPhase(run.status());
    }

    @Override
    public void cancelRun(String threadId, String runId) {
        RunCancelParams params = RunCancelParams.builder()
                .threadId(threadId)
                .runId(runId)
                .build();
        requireClient().beta().threads().runs().cancel(params);
    }

    @Override
    public Optional<String> latestAssistantText(String threadId) {
        MessageListParams params = MessageListParams.builder().threadId(threadId).build();
        // Messages are listed newest first.
        for (Message message : requireClient().beta().threads().messages().list(params).autoPager()) {
            if (!Message.Role.ASSISTANT.equals(message.role())) {
                continue;
            }
            Optional<String> text = firstTextBlock(message);
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first text block of a message, skipping images and other non-text content.
     */
    static Optional<String> firstTextBlock(Message message) {
        for (MessageContent content : message.content()) {
            if (content.text().isPresent()) {
                return Optional.of(content.text().get().text().value());
            }
        }
        return Optional.empty();
    }

    static RunPhase toPhase(RunStatus status) {
        if (RunStatus.COMPLETED.equals(status)) {
            return RunPhase.COMPLETED;
        }
        if (RunStatus.REQUIRES_ACTION.equals(status)) {
            return RunPhase.REQUIRES_ACTION;
        }
        if (RunStatus.FAILED.equals(status)
                || RunStatus.CANCELLED.equals(status)
                || RunStatus.EXPIRED.equals(status)
                || RunStatus.INCOMPLETE.equals(status)) {
            return RunPhase.FAILED;
        }
        return RunPhase.PENDING;
    }

    private OpenAIClient requireClient() {
        if (!isAvailable()) {
            throw new IllegalStateException("OpenAI assistant client is not configured");
        }
        return client;
    }
}
