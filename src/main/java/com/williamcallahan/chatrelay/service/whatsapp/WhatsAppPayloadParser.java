package com.williamcallahan.chatrelay.service.whatsapp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.chatrelay.domain.messaging.InboundMessage;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts the first user message from a WhatsApp Cloud API webhook delivery.
 *
 * <p>Deliveries that carry no message (status updates, read receipts), belong to another product, are
 * malformed, or come from a sender id that does not look like a phone number yield an empty result.</p>
 */
@Component
public class WhatsAppPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppPayloadParser.class);
    private static final String BUSINESS_ACCOUNT_OBJECT = "whatsapp_business_account";
    private static final int MIN_PHONE_DIGITS = 10;
    private static final int MAX_PHONE_DIGITS = 15;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public Optional<InboundMessage> parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            log.warn("Ignoring webhook delivery with empty body");
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring webhook delivery with malformed JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        return parse(root);
    }

    public Optional<InboundMessage> parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        String objectType = root.path("object").asText("");
        if (!objectType.isEmpty() && !BUSINESS_ACCOUNT_OBJECT.equals(objectType)) {
            log.debug("Ignoring webhook delivery for object type {}", objectType);
            return Optional.empty();
        }
        JsonNode value = root.path("entry").path(0).path("changes").path(0).path("value");
        if (value.has("statuses") && !value.has("messages")) {
            log.debug("Ignoring status update delivery");
            return Optional.empty();
        }
        JsonNode message = value.path("messages").path(0);
        if (message.isMissingNode() || !message.isObject()) {
            log.debug("Ignoring webhook delivery without messages");
            return Optional.empty();
        }
        JsonNode contact = value.path("contacts").path(0);
        String userId = contact.path("wa_id").asText("");
        if (userId.isEmpty()) {
            userId = message.path("from").asText("");
        }
        if (!isValidPhoneNumber(userId)) {
            log.warn("Ignoring message from invalid sender id '{}'", userId);
            return Optional.empty();
        }
        String displayName = contact.path("profile").path("name").asText("");
        String messageType = message.path("type").asText("");
        String text = InboundMessage.TEXT_TYPE.equals(messageType)
                ? message.path("text").path("body").asText("")
                : "";
        return Optional.of(new InboundMessage(userId, displayName, messageType, text));
    }

    /**
     * Accepts identifiers with 10 to 15 digits once spaces, dashes, parentheses and a leading plus are removed.
     *
     * @param phoneNumber raw identifier
     * @return true when the digit count is plausible for an international number
     */
    static boolean isValidPhoneNumber(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            return false;
        }
        long digits = phoneNumber.chars().filter(Character::isDigit).count();
        return digits >= MIN_PHONE_DIGITS && digits <= MAX_PHONE_DIGITS;
    }
}
