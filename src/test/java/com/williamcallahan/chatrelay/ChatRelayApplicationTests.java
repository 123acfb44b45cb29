package com.williamcallahan.chatrelay;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.chatrelay.service.assistant.AssistantService;
import com.williamcallahan.chatrelay.service.session.SessionStore;
import com.williamcallahan.chatrelay.service.session.SessionSweeper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
    "app.session.snapshot-path=target/test-sessions.json",
    "app.assistant.threads-file=target/test-threads.json",
    "app.assistant.api-key=",
    "app.assistant.assistant-id=",
    "app.whatsapp.access-token=",
    "app.whatsapp.app-secret="
})
class ChatRelayApplicationTests {

    @Autowired
    SessionStore sessionStore;

    @Autowired
    SessionSweeper sessionSweeper;

    @Autowired
    AssistantService assistantService;

    @Test
    void contextLoadsWithSweeperRunning() {
        assertTrue(sessionSweeper.isRunning());
        assertFalse(sessionStore.isActive("5215500000000"));
    }
}
