package com.williamcallahan.chatrelay.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Standardized JSON error payload.
 *
 * @param status fixed status indicator ("error")
 * @param message user-facing error message
 * @param details optional diagnostic details, omitted when null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse("error", message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse("error", message, details);
    }
}
