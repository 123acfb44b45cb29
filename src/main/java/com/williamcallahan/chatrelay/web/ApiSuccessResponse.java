package com.williamcallahan.chatrelay.web;

/**
 * Standardized JSON success payload.
 *
 * @param status fixed status indicator ("success")
 * @param message user-facing success message
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse("success", message);
    }
}
