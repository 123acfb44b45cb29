package com.williamcallahan.chatrelay.service.whatsapp;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outbound text message envelope for the Cloud API messages endpoint.
 */
record WhatsAppTextMessage(
        @JsonProperty("messaging_product") String messagingProduct,
        @JsonProperty("recipient_type") String recipientType,
        @JsonProperty("to") String to,
        @JsonProperty("type") String type,
        @JsonProperty("text") TextBody text) {

    static WhatsAppTextMessage to(String recipient, String body) {
        return new WhatsAppTextMessage("whatsapp", "individual", recipient, "text", new TextBody(false, body));
    }

    record TextBody(@JsonProperty("preview_url") boolean previewUrl, @JsonProperty("body") String body) {}
}
