package com.williamcallahan.chatrelay.service;

/**
 * Outbound channel to a user. Implementations handle their own retries and never throw for delivery
 * failures.
 */
public interface MessageNotifier {

    /**
     * Sends a text message to a user.
     *
     * @param userId recipient identifier
     * @param text message body
     * @return true when the message was accepted by the channel
     */
    boolean send(String userId, String text);
}
