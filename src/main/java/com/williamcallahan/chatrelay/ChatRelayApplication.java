package com.williamcallahan.chatrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChatRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatRelayApplication.class, args);
    }

}
