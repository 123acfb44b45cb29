package com.williamcallahan.chatrelay.web;

/**
 * JSON body returned by the relay's endpoints. Every variant carries a {@code status} field
 * ("ok", "success" or "error") that webhook senders and health checks can key on.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse, HealthResponse {

    String status();
}
