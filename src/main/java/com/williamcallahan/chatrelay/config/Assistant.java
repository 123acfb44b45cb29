package com.williamcallahan.chatrelay.config;

import java.time.Duration;
import java.util.Locale;

/**
 * OpenAI Assistants configuration.
 */
public class Assistant {

    private static final String BASE_URL_DEF = "https://api.openai.com/v1";
    private static final Duration MAX_WAIT_DEF = Duration.ofSeconds(60);
    private static final Duration POLL_DEF = Duration.ofSeconds(1);
    private static final Duration TIMEOUT_DEF = Duration.ofSeconds(30);
    private static final String THREADS_FILE_DEF = "threads.json";
    private static final String MAX_WAIT_KEY = "app.assistant.max-wait";
    private static final String POLL_KEY = "app.assistant.poll-interval";
    private static final String TIMEOUT_KEY = "app.assistant.request-timeout";
    private static final String THREADS_FILE_KEY = "app.assistant.threads-file";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String POLL_ORDER_MSG =
            "app.assistant.poll-interval must not exceed app.assistant.max-wait.";

    private String apiKey = "";
    private String assistantId = "";
    private String baseUrl = BASE_URL_DEF;
    private Duration maxWait = MAX_WAIT_DEF;
    private Duration pollInterval = POLL_DEF;
    private Duration requestTimeout = TIMEOUT_DEF;
    private String threadsFile = THREADS_FILE_DEF;

    /**
     * Validates assistant settings.
     */
    public void validateConfiguration() {
        requirePositive(MAX_WAIT_KEY, maxWait);
        requirePositive(POLL_KEY, pollInterval);
        requirePositive(TIMEOUT_KEY, requestTimeout);
        if (threadsFile == null || threadsFile.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, THREADS_FILE_KEY));
        }
        if (pollInterval.compareTo(maxWait) > 0) {
            throw new IllegalArgumentException(POLL_ORDER_MSG);
        }
    }

    /**
     * Returns whether both the API key and the assistant id are present.
     *
     * @return true when assistant calls can be attempted
     */
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && assistantId != null && !assistantId.isBlank();
    }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getAssistantId() { return assistantId; }
    public void setAssistantId(String assistantId) { this.assistantId = assistantId; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public Duration getMaxWait() { return maxWait; }
    public void setMaxWait(Duration maxWait) { this.maxWait = maxWait; }

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public String getThreadsFile() { return threadsFile; }
    public void setThreadsFile(String threadsFile) { this.threadsFile = threadsFile; }

    private static void requirePositive(String propertyKey, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
