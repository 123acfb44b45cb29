package com.williamcallahan.chatrelay.service.whatsapp;

import com.williamcallahan.chatrelay.config.WhatsApp;
import com.williamcallahan.chatrelay.service.MessageNotifier;
import com.williamcallahan.chatrelay.support.DeliveryErrorClassifier;
import com.williamcallahan.chatrelay.support.RetrySupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Delivers text messages through the WhatsApp Cloud API.
 *
 * <p>Transient failures (I/O errors, rate limits, 5xx) are retried with exponential backoff. Once retries are
 * exhausted, or on a non-transient failure, the error is logged and {@code false} is returned.</p>
 */
public class WhatsAppCloudClient implements MessageNotifier {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppCloudClient.class);
    private static final int MAX_ERROR_SNIPPET = 512;

    private final WhatsApp settings;
    private final RestTemplate restTemplate;

    public WhatsAppCloudClient(WhatsApp settings, RestTemplateBuilder restTemplateBuilder) {
        this.settings = settings;
        this.restTemplate = restTemplateBuilder
                .connectTimeout(settings.getRequestTimeout())
                .readTimeout(settings.getRequestTimeout())
                .build();
    }

    @Override
    public boolean send(String userId, String text) {
        if (isBlank(settings.getAccessToken()) || isBlank(settings.getPhoneNumberId())) {
            log.error("Cannot deliver message to {}: WhatsApp access token or phone number id not configured", userId);
            return false;
        }
        try {
            RetrySupport.executeWithRetry(
                    () -> postMessage(userId, text),
                    "WhatsApp delivery to " + userId,
                    settings.getMaxAttempts(),
                    settings.getInitialBackoff(),
                    DeliveryErrorClassifier::isTransientDeliveryError);
            log.debug("Delivered message to {}", userId);
            return true;
        } catch (RestClientResponseException apiException) {
            log.error("WhatsApp delivery to {} failed: HTTP {} {}", userId,
                    apiException.getStatusCode().value(), truncate(apiException.getResponseBodyAsString()));
            return false;
        } catch (RestClientException | IllegalStateException deliveryException) {
            log.error("WhatsApp delivery to {} failed ({}): {}", userId,
                    DeliveryErrorClassifier.determineErrorType(deliveryException), deliveryException.getMessage());
            return false;
        }
    }

    private String postMessage(String userId, String text) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.getAccessToken());
        HttpEntity<WhatsAppTextMessage> entity = new HttpEntity<>(WhatsAppTextMessage.to(userId, text), headers);
        return restTemplate.postForObject(settings.messagesUrl(), entity, String.class);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_SNIPPET ? body : body.substring(0, MAX_ERROR_SNIPPET) + "...";
    }
}
