package com.williamcallahan.chatrelay.service;

import com.williamcallahan.chatrelay.config.AppProperties;
import com.williamcallahan.chatrelay.config.Tickets;
import com.williamcallahan.chatrelay.domain.messaging.TicketRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Records support tickets collected in chat and, when a ticket webhook is configured, forwards them to the
 * helpdesk.
 */
@Service
public class TicketService {

    private static final Logger log = LoggerFactory.getLogger(TicketService.class);
    private static final int CONNECT_TIMEOUT_SECONDS = 5;
    private static final int READ_TIMEOUT_SECONDS = 15;

    private final Tickets settings;
    private final RestTemplate restTemplate;

    public TicketService(AppProperties appProperties, RestTemplateBuilder restTemplateBuilder) {
        this.settings = appProperties.getTickets();
        this.restTemplate = restTemplateBuilder
                .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .readTimeout(Duration.ofSeconds(READ_TIMEOUT_SECONDS))
                .build();
    }

    /**
     * Creates a ticket.
     *
     * @param ticket ticket details
     * @return false only when forwarding was attempted and failed
     */
    public boolean createTicket(TicketRequest ticket) {
        log.info("Support ticket from user {} ({}): subject='{}'",
                ticket.userId(), ticket.requesterName(), ticket.subject());
        if (!settings.isForwardingEnabled()) {
            return true;
        }
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("user_id", ticket.userId());
        payload.put("name", ticket.requesterName());
        payload.put("subject", ticket.subject());
        payload.put("description", ticket.description());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForObject(settings.getWebhookUrl().trim(), new HttpEntity<>(payload, headers), String.class);
            log.info("Forwarded support ticket for user {}", ticket.userId());
            return true;
        } catch (RestClientException e) {
            log.error("Failed to forward support ticket for user {}: {}", ticket.userId(), e.getMessage());
            return false;
        }
    }
}
