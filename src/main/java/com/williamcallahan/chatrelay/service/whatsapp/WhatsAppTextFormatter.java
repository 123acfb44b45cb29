package com.williamcallahan.chatrelay.service.whatsapp;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Adapts assistant output to WhatsApp's lightweight markup.
 */
@Component
public class WhatsAppTextFormatter {

    private static final Pattern CITATION_MARKER = Pattern.compile("【.*?】");
    private static final Pattern MARKDOWN_BOLD = Pattern.compile("\\*\\*(.*?)\\*\\*");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[(.*?)\\]\\((.*?)\\)");
    // Line breaks and tabs survive; WhatsApp renders them.
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x08\\x0B-\\x1F\\x7F]");

    /**
     * Strips citation markers, converts markdown bold and links, and removes non-printable characters.
     *
     * @param text raw reply text, may be null
     * @return WhatsApp-ready text, never null
     */
    public String format(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String formatted = CITATION_MARKER.matcher(text).replaceAll("").strip();
        formatted = MARKDOWN_BOLD.matcher(formatted).replaceAll("*$1*");
        formatted = MARKDOWN_LINK.matcher(formatted).replaceAll("$1: $2");
        return CONTROL_CHARACTERS.matcher(formatted).replaceAll("");
    }
}
