package com.williamcallahan.chatrelay.web;

import com.williamcallahan.chatrelay.config.AppProperties;
import com.williamcallahan.chatrelay.service.session.SessionStore;
import com.williamcallahan.chatrelay.service.session.SessionSweeper;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and operational counters.
 */
@RestController
public class HealthController {

    private final AppProperties appProperties;
    private final SessionStore sessionStore;
    private final SessionSweeper sessionSweeper;

    public HealthController(AppProperties appProperties, SessionStore sessionStore, SessionSweeper sessionSweeper) {
        this.appProperties = appProperties;
        this.sessionStore = sessionStore;
        this.sessionSweeper = sessionSweeper;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.ok(appProperties.getVersion());
    }

    @GetMapping("/admin/stats")
    public SessionStatsResponse stats() {
        return new SessionStatsResponse(
                sessionStore.size(), sessionStore.totalMessageCount(), sessionSweeper.isRunning());
    }
}
