package com.williamcallahan.chatrelay.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private static final String VERSION_DEF = "1.0.0";

    private SessionSettings session = new SessionSettings();
    private WhatsApp whatsapp = new WhatsApp();
    private Assistant assistant = new Assistant();
    private Tickets tickets = new Tickets();
    private String version = VERSION_DEF;

    /**
     * Validates every configuration section once binding completes.
     */
    @PostConstruct
    public void validateConfiguration() {
        session.validateConfiguration();
        whatsapp.validateConfiguration();
        assistant.validateConfiguration();
        tickets.validateConfiguration();
    }

    public SessionSettings getSession() {
        return session;
    }

    public void setSession(SessionSettings session) {
        this.session = session;
    }

    public WhatsApp getWhatsapp() {
        return whatsapp;
    }

    public void setWhatsapp(WhatsApp whatsapp) {
        this.whatsapp = whatsapp;
    }

    public Assistant getAssistant() {
        return assistant;
    }

    public void setAssistant(Assistant assistant) {
        this.assistant = assistant;
    }

    public Tickets getTickets() {
        return tickets;
    }

    public void setTickets(Tickets tickets) {
        this.tickets = tickets;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version == null || version.isBlank() ? VERSION_DEF : version;
    }
}
