package com.williamcallahan.chatrelay.config;

import com.williamcallahan.chatrelay.service.whatsapp.WebhookSignatureVerifier;
import com.williamcallahan.chatrelay.service.whatsapp.WhatsAppCloudClient;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * WhatsApp Cloud API collaborators: outbound delivery and inbound signature checking.
 */
@Configuration
public class WhatsAppClientConfig {

    @Bean
    public WhatsAppCloudClient whatsAppCloudClient(AppProperties appProperties, RestTemplateBuilder restTemplateBuilder) {
        return new WhatsAppCloudClient(appProperties.getWhatsapp(), restTemplateBuilder);
    }

    @Bean
    public WebhookSignatureVerifier webhookSignatureVerifier(AppProperties appProperties) {
        return new WebhookSignatureVerifier(appProperties.getWhatsapp().getAppSecret());
    }
}
