package com.williamcallahan.chatrelay.support;

/**
 * Normalizes base URLs for the OpenAI Java SDK.
 *
 * <p>The SDK expects base URLs to end with the API version prefix (e.g., /v1).</p>
 */
public final class OpenAiSdkUrlNormalizer {

    private static final String VERSION_SUFFIX = "/v1";

    private OpenAiSdkUrlNormalizer() {}

    /**
     * Normalizes a base URL for the OpenAI Java SDK.
     *
     * @param baseUrl raw base URL from configuration
     * @return normalized URL suitable for OpenAIOkHttpClient.builder().baseUrl()
     * @throws IllegalStateException if baseUrl is null or blank
     */
    public static String normalize(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("OpenAI SDK base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith("/assistants")) {
            trimmed = trimmed.substring(0, trimmed.length() - "/assistants".length());
        }
        if (trimmed.endsWith(VERSION_SUFFIX)) {
            return trimmed;
        }
        return trimmed + VERSION_SUFFIX;
    }
}
