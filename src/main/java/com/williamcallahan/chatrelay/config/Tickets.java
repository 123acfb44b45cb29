package com.williamcallahan.chatrelay.config;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Support ticket forwarding configuration.
 */
public class Tickets {

    private static final String INVALID_URL_MSG = "app.tickets.webhook-url must be an absolute http(s) URL.";

    private String webhookUrl = "";

    /**
     * Validates ticket settings. A blank webhook URL disables forwarding.
     */
    public void validateConfiguration() {
        if (!isForwardingEnabled()) {
            return;
        }
        try {
            URI uri = new URI(webhookUrl.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException(INVALID_URL_MSG);
            }
        } catch (URISyntaxException syntaxException) {
            throw new IllegalArgumentException(INVALID_URL_MSG, syntaxException);
        }
    }

    public boolean isForwardingEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }
}
