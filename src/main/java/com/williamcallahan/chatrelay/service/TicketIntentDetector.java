package com.williamcallahan.chatrelay.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Spots messages asking for support, by case-insensitive keyword containment.
 */
@Component
public class TicketIntentDetector {

    private static final List<String> SUPPORT_KEYWORDS = List.of(
            "problema", "error", "falla", "ticket", "ayuda", "soporte", "no funciona",
            "issue", "bug", "help", "support", "not working", "broken", "doesn't work");

    /**
     * Returns the first support keyword contained in the message.
     *
     * @param text message text
     * @return matched keyword, or empty when the message shows no support intent
     */
    public Optional<String> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (String keyword : SUPPORT_KEYWORDS) {
            if (normalized.contains(keyword)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }
}
