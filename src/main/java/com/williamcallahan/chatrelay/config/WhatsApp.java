package com.williamcallahan.chatrelay.config;

import java.time.Duration;
import java.util.Locale;

/**
 * WhatsApp Cloud API configuration for webhook verification and outbound delivery.
 */
public class WhatsApp {

    private static final String API_BASE_DEF = "https://graph.facebook.com";
    private static final String API_VERSION_DEF = "v18.0";
    private static final int MAX_ATTEMPTS_DEF = 3;
    private static final Duration BACKOFF_DEF = Duration.ofSeconds(1);
    private static final Duration TIMEOUT_DEF = Duration.ofSeconds(10);
    private static final String API_BASE_KEY = "app.whatsapp.api-base-url";
    private static final String API_VERSION_KEY = "app.whatsapp.api-version";
    private static final String MAX_ATTEMPTS_KEY = "app.whatsapp.max-attempts";
    private static final String BACKOFF_KEY = "app.whatsapp.initial-backoff";
    private static final String TIMEOUT_KEY = "app.whatsapp.request-timeout";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String apiBaseUrl = API_BASE_DEF;
    private String apiVersion = API_VERSION_DEF;
    private String phoneNumberId = "";
    private String accessToken = "";
    private String verifyToken = "";
    private String appSecret = "";
    private int maxAttempts = MAX_ATTEMPTS_DEF;
    private Duration initialBackoff = BACKOFF_DEF;
    private Duration requestTimeout = TIMEOUT_DEF;

    /**
     * Validates WhatsApp settings. Credentials may be blank so the service can boot for health checks.
     */
    public void validateConfiguration() {
        requireText(API_BASE_KEY, apiBaseUrl);
        requireText(API_VERSION_KEY, apiVersion);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_ATTEMPTS_KEY));
        }
        requirePositive(BACKOFF_KEY, initialBackoff);
        requirePositive(TIMEOUT_KEY, requestTimeout);
    }

    /**
     * Returns the messages endpoint for the configured phone number.
     *
     * @return absolute Graph API messages URL
     */
    public String messagesUrl() {
        String base = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        return base + "/" + apiVersion + "/" + phoneNumberId + "/messages";
    }

    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

    public String getApiVersion() { return apiVersion; }
    public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }

    public String getPhoneNumberId() { return phoneNumberId; }
    public void setPhoneNumberId(String phoneNumberId) { this.phoneNumberId = phoneNumberId; }

    public String getAccessToken() { return accessToken; }
    public void setAccessToken(String accessToken) { this.accessToken = accessToken; }

    public String getVerifyToken() { return verifyToken; }
    public void setVerifyToken(String verifyToken) { this.verifyToken = verifyToken; }

    public String getAppSecret() { return appSecret; }
    public void setAppSecret(String appSecret) { this.appSecret = appSecret; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    private static void requireText(String propertyKey, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, propertyKey));
        }
    }

    private static void requirePositive(String propertyKey, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
