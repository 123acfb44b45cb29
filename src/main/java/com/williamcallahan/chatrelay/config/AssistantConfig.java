package com.williamcallahan.chatrelay.config;

import com.williamcallahan.chatrelay.service.assistant.ConversationHandleRegistry;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AssistantConfig {

    @Bean
    public ConversationHandleRegistry conversationHandleRegistry(AppProperties appProperties) {
        return new ConversationHandleRegistry(Path.of(appProperties.getAssistant().getThreadsFile()));
    }
}
