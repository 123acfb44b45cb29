package com.williamcallahan.chatrelay.config;

import com.williamcallahan.chatrelay.service.MessageNotifier;
import com.williamcallahan.chatrelay.service.session.SessionSnapshotPersister;
import com.williamcallahan.chatrelay.service.session.SessionStore;
import com.williamcallahan.chatrelay.service.session.SessionSweeper;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the session store, its snapshot persister and the expiration sweeper.
 * The store is restored from the last snapshot before any request can reach it.
 */
@Configuration
public class SessionLifecycleConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionSnapshotPersister sessionSnapshotPersister() {
        return new SessionSnapshotPersister();
    }

    @Bean
    public SessionStore sessionStore(AppProperties appProperties, Clock clock, SessionSnapshotPersister persister) {
        SessionSettings settings = appProperties.getSession();
        SessionStore sessionStore = new SessionStore(clock, settings.getTimeout());
        Path snapshotPath = Path.of(settings.getSnapshotPath());
        sessionStore.restore(persister.load(snapshotPath));
        log.info("Session store ready (timeout={}s, snapshot={})", settings.getTimeout().toSeconds(), snapshotPath);
        return sessionStore;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SessionSweeper sessionSweeper(
            SessionStore sessionStore,
            MessageNotifier messageNotifier,
            SessionSnapshotPersister persister,
            Clock clock,
            AppProperties appProperties) {
        return new SessionSweeper(sessionStore, messageNotifier, persister, clock, appProperties.getSession());
    }
}
