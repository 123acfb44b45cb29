package com.williamcallahan.chatrelay.service;

/**
 * Canned replies sent to users.
 */
public final class ChatReplies {

    public static final String RESTARTED = "He reiniciado nuestra conversación. ¿En qué puedo ayudarte?";
    public static final String GREETING_TEMPLATE = "¡Hola %s! Bienvenido. ¿En qué puedo ayudarte hoy?";
    public static final String GREETING_ANONYMOUS = "¡Hola! Bienvenido. ¿En qué puedo ayudarte hoy?";
    public static final String TICKET_INTENT =
            "Parece que necesitas ayuda con un problema. ¿Podrías proporcionar un breve título o asunto para tu ticket de soporte?";
    public static final String TICKET_SUBJECT_RECEIVED = "Gracias. Por favor describe el problema en detalle.";
    public static final String TICKET_CREATED =
            "¡Gracias! Tu ticket ha sido creado. Un agente de soporte te contactará pronto.";
    public static final String ASSISTANT_FAILED = "Lo siento, hubo un problema al procesar tu mensaje.";
    public static final String ASSISTANT_TIMED_OUT = "Lo siento, la respuesta está tomando demasiado tiempo.";
    public static final String UNEXPECTED_ERROR =
            "Lo siento, ha ocurrido un error inesperado. Por favor, inténtalo de nuevo más tarde.";
    public static final String TEXT_ONLY = "Lo siento, actualmente solo puedo procesar mensajes de texto.";

    private ChatReplies() {}

    public static String greeting(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return GREETING_ANONYMOUS;
        }
        return String.format(GREETING_TEMPLATE, displayName.trim());
    }
}
