package com.williamcallahan.chatrelay.service;

import com.williamcallahan.chatrelay.domain.assistant.AssistantResult;
import com.williamcallahan.chatrelay.domain.messaging.InboundMessage;
import com.williamcallahan.chatrelay.domain.messaging.TicketRequest;
import com.williamcallahan.chatrelay.domain.session.MessageRole;
import com.williamcallahan.chatrelay.domain.session.SessionRecord;
import com.williamcallahan.chatrelay.domain.session.SessionState;
import com.williamcallahan.chatrelay.domain.session.SessionUpdate;
import com.williamcallahan.chatrelay.service.assistant.AssistantGateway;
import com.williamcallahan.chatrelay.service.session.SessionStore;
import com.williamcallahan.chatrelay.service.session.SessionSweeper;
import com.williamcallahan.chatrelay.service.whatsapp.WhatsAppTextFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-message conversation state machine.
 *
 * <p>For each inbound text message the router records it in the user's session, picks a reply from the
 * session state (restart, greeting, ticket collection, support intent, or the assistant as fallback),
 * records and delivers the reply, then asks for a snapshot. It never throws: any unexpected failure is
 * logged and answered with a generic apology.</p>
 */
@Service
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);
    private static final Logger RELAY_LOG = LoggerFactory.getLogger("RELAY");

    static final String TICKET_SUBJECT_KEY = "ticket_subject";
    private static final Set<String> RESTART_COMMANDS = Set.of("/restart", "/reiniciar");
    private static final Set<String> GREETINGS = Set.of("hola", "hi", "hello");

    private final SessionStore sessionStore;
    private final AssistantGateway assistant;
    private final MessageNotifier notifier;
    private final WhatsAppTextFormatter formatter;
    private final TicketIntentDetector intentDetector;
    private final TicketService ticketService;
    private final SessionSweeper sessionSweeper;
    private final AtomicLong messageSequence = new AtomicLong();

    public MessageRouter(
            SessionStore sessionStore,
            AssistantGateway assistant,
            MessageNotifier notifier,
            WhatsAppTextFormatter formatter,
            TicketIntentDetector intentDetector,
            TicketService ticketService,
            SessionSweeper sessionSweeper) {
        this.sessionStore = sessionStore;
        this.assistant = assistant;
        this.notifier = notifier;
        this.formatter = formatter;
        this.intentDetector = intentDetector;
        this.ticketService = ticketService;
        this.sessionSweeper = sessionSweeper;
    }

    /**
     * Handles one inbound message end to end.
     *
     * @param message parsed inbound message
     */
    public void handle(InboundMessage message) {
        String requestId = "MSG-" + messageSequence.incrementAndGet();
        String userId = message.userId();
        RELAY_LOG.info("[{}] Inbound {} message from {}", requestId, message.messageType(), userId);
        if (!message.isText()) {
            deliver(requestId, userId, ChatReplies.TEXT_ONLY);
            return;
        }
        String reply;
        try {
            reply = route(requestId, message);
        } catch (RuntimeException e) {
            log.error("[{}] Routing failed for user {}", requestId, userId, e);
            reply = ChatReplies.UNEXPECTED_ERROR;
        }
        String formattedReply = formatter.format(reply);
        try {
            sessionStore.appendHistory(userId, MessageRole.ASSISTANT, formattedReply);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to record reply for user {}", requestId, userId, e);
        }
        deliver(requestId, userId, formattedReply);
        try {
            sessionSweeper.requestSnapshot();
        } catch (RuntimeException e) {
            log.warn("[{}] Snapshot request failed: {}", requestId, e.getMessage());
        }
    }

    private String route(String requestId, InboundMessage message) {
        String userId = message.userId();
        String text = message.text();
        SessionRecord session = sessionStore.getOrCreate(userId);
        sessionStore.appendHistory(userId, MessageRole.USER, text);
        String normalized = text.trim().toLowerCase(Locale.ROOT);

        if (RESTART_COMMANDS.contains(normalized)) {
            sessionStore.restart(userId);
            assistant.forgetConversation(userId);
            RELAY_LOG.info("[{}] Restart requested", requestId);
            return ChatReplies.RESTARTED;
        }

        SessionState state = session.state();
        if (state == SessionState.INITIAL && GREETINGS.contains(normalized)) {
            sessionStore.update(userId, SessionUpdate.state(SessionState.AWAITING_QUERY));
            RELAY_LOG.info("[{}] Greeting: INITIAL -> AWAITING_QUERY", requestId);
            return ChatReplies.greeting(message.displayName());
        }

        if (state == SessionState.TICKET_CREATION) {
            return continueTicket(requestId, message, session);
        }

        Optional<String> supportKeyword = intentDetector.detect(text);
        if (supportKeyword.isPresent()) {
            sessionStore.update(userId, SessionUpdate.stateAndContext(SessionState.TICKET_CREATION, Map.of()));
            RELAY_LOG.info("[{}] Support intent ('{}'): {} -> TICKET_CREATION", requestId, supportKeyword.get(), state);
            return ChatReplies.TICKET_INTENT;
        }

        return askAssistant(requestId, message, session);
    }

    private String continueTicket(String requestId, InboundMessage message, SessionRecord session) {
        String userId = message.userId();
        String subject = session.context().get(TICKET_SUBJECT_KEY);
        if (subject == null) {
            sessionStore.update(userId, SessionUpdate.context(Map.of(TICKET_SUBJECT_KEY, message.text().trim())));
            RELAY_LOG.info("[{}] Ticket subject captured", requestId);
            return ChatReplies.TICKET_SUBJECT_RECEIVED;
        }
        TicketRequest ticket = new TicketRequest(userId, message.displayName(), subject, message.text().trim());
        if (!ticketService.createTicket(ticket)) {
            log.warn("[{}] Ticket for user {} was recorded locally but not forwarded", requestId, userId);
        }
        sessionStore.update(userId, SessionUpdate.stateAndContext(SessionState.AWAITING_QUERY, Map.of()));
        RELAY_LOG.info("[{}] Ticket created: TICKET_CREATION -> AWAITING_QUERY", requestId);
        return ChatReplies.TICKET_CREATED;
    }

    private String askAssistant(String requestId, InboundMessage message, SessionRecord session) {
        long startedAt = System.currentTimeMillis();
        AssistantResult result = assistant.reply(message.userId(), message.displayName(), message.text());
        long elapsedMillis = System.currentTimeMillis() - startedAt;
        if (result instanceof AssistantResult.Completed completed) {
            RELAY_LOG.info("[{}] Assistant replied in {}ms", requestId, elapsedMillis);
            String handle = completed.conversationHandle();
            if (handle != null && !handle.equals(session.conversationHandle())) {
                sessionStore.update(message.userId(), SessionUpdate.conversationHandle(handle));
            }
            return completed.text();
        }
        if (result instanceof AssistantResult.TimedOut) {
            RELAY_LOG.warn("[{}] Assistant timed out after {}ms", requestId, elapsedMillis);
            return ChatReplies.ASSISTANT_TIMED_OUT;
        }
        AssistantResult.Failed failed = (AssistantResult.Failed) result;
        RELAY_LOG.warn("[{}] Assistant failed after {}ms: {}", requestId, elapsedMillis, failed.reason());
        return ChatReplies.ASSISTANT_FAILED;
    }

    private void deliver(String requestId, String userId, String text) {
        try {
            boolean delivered = notifier.send(userId, text);
            RELAY_LOG.info("[{}] Reply {} to {}", requestId, delivered ? "delivered" : "NOT delivered", userId);
        } catch (RuntimeException e) {
            log.error("[{}] Delivery to {} failed", requestId, userId, e);
        }
    }
}
