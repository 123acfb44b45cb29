package com.williamcallahan.chatrelay.web;

/**
 * Liveness payload.
 *
 * @param status always "ok" while the process serves requests
 * @param version deployed application version
 */
public record HealthResponse(String status, String version) implements ApiResponse {

    public static HealthResponse ok(String version) {
        return new HealthResponse("ok", version);
    }
}
