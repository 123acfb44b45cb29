package com.williamcallahan.chatrelay.domain.messaging;

/**
 * Support ticket collected through the chat.
 *
 * @param userId requester's user id
 * @param requesterName requester's display name
 * @param subject short subject line
 * @param description problem description
 */
public record TicketRequest(String userId, String requesterName, String subject, String description) {}
