package com.williamcallahan.chatrelay.domain.messaging;

/**
 * A user message extracted from an inbound webhook delivery.
 *
 * @param userId sender identifier (WhatsApp id)
 * @param displayName sender's profile name, blank when unknown
 * @param messageType WhatsApp message type such as {@code text}, {@code image} or {@code audio}
 * @param text message body for text messages, empty otherwise
 */
public record InboundMessage(String userId, String displayName, String messageType, String text) {

    public static final String TEXT_TYPE = "text";

    public InboundMessage {
        displayName = displayName == null ? "" : displayName;
        messageType = messageType == null ? "" : messageType;
        text = text == null ? "" : text;
    }

    public static InboundMessage text(String userId, String displayName, String text) {
        return new InboundMessage(userId, displayName, TEXT_TYPE, text);
    }

    public boolean isText() {
        return TEXT_TYPE.equals(messageType);
    }
}
