package com.williamcallahan.chatrelay.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ApiKeyLoggingConfig {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyLoggingConfig.class);

    private final AppProperties appProperties;

    @Value("${spring.profiles.active:dev}")
    private String activeProfile;

    public ApiKeyLoggingConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @PostConstruct
    public void logApiKeyStatus() {
        logger.info("=== Credential Configuration Status ===");

        boolean isDev = "dev".equalsIgnoreCase(activeProfile);
        WhatsApp whatsapp = appProperties.getWhatsapp();
        Assistant assistant = appProperties.getAssistant();

        logCredential("WHATSAPP_TOKEN", whatsapp.getAccessToken(), isDev);
        logCredential("VERIFY_TOKEN", whatsapp.getVerifyToken(), isDev);
        logCredential("WHATSAPP_APP_SECRET", whatsapp.getAppSecret(), isDev);
        logCredential("OPENAI_API_KEY", assistant.getApiKey(), isDev);

        if (!hasValue(whatsapp.getPhoneNumberId())) {
            logger.warn("PHONE_NUMBER_ID: Not configured - replies cannot be delivered!");
        } else {
            logger.info("PHONE_NUMBER_ID: {}", whatsapp.getPhoneNumberId());
        }
        if (!hasValue(assistant.getAssistantId())) {
            logger.warn("ASSISTANT_ID: Not configured - free-form questions will get an apology");
        } else {
            logger.info("ASSISTANT_ID: {}", assistant.getAssistantId());
        }
        if (!hasValue(whatsapp.getAppSecret())) {
            logger.warn("Webhook signature verification is disabled");
        }

        logger.info("=======================================");
    }

    private void logCredential(String keyName, String keyValue, boolean isDev) {
        if (!hasValue(keyValue)) {
            logger.info("{}: Not configured", keyName);
        } else if (isDev) {
            String masked = maskSecret(keyValue, 4);
            logger.info("{}: Configured (***{})", keyName, masked);
        } else {
            logger.info("{}: Configured", keyName);
        }
    }

    private boolean hasValue(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private String maskSecret(String secret, int visibleChars) {
        if (secret == null || secret.length() <= visibleChars) {
            return "****";
        }
        return secret.substring(secret.length() - visibleChars);
    }
}
