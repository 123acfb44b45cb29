package com.williamcallahan.chatrelay.web;

import com.williamcallahan.chatrelay.config.AppProperties;
import com.williamcallahan.chatrelay.domain.messaging.InboundMessage;
import com.williamcallahan.chatrelay.service.MessageRouter;
import com.williamcallahan.chatrelay.service.whatsapp.WebhookSignatureVerifier;
import com.williamcallahan.chatrelay.service.whatsapp.WhatsAppPayloadParser;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * WhatsApp Cloud API webhook: subscription verification (GET) and message delivery (POST).
 *
 * <p>Once a delivery passes signature checking the endpoint always answers 200, even for payloads it
 * ignores or fails to process, so Meta does not keep redelivering them.</p>
 */
@RestController
@RequestMapping("/webhook")
public class WebhookController extends BaseController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);
    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
    private static final String SUBSCRIBE_MODE = "subscribe";

    private final AppProperties appProperties;
    private final WebhookSignatureVerifier signatureVerifier;
    private final WhatsAppPayloadParser payloadParser;
    private final MessageRouter messageRouter;

    public WebhookController(
            ExceptionResponseBuilder exceptionBuilder,
            AppProperties appProperties,
            WebhookSignatureVerifier signatureVerifier,
            WhatsAppPayloadParser payloadParser,
            MessageRouter messageRouter) {
        super(exceptionBuilder);
        this.appProperties = appProperties;
        this.signatureVerifier = signatureVerifier;
        this.payloadParser = payloadParser;
        this.messageRouter = messageRouter;
    }

    /**
     * Answers Meta's subscription challenge.
     */
    @GetMapping
    public ResponseEntity<?> verifySubscription(
            @RequestParam(name = "hub.mode", required = false) String mode,
            @RequestParam(name = "hub.verify_token", required = false) String verifyToken,
            @RequestParam(name = "hub.challenge", required = false) String challenge) {
        if (isBlank(mode) || isBlank(verifyToken)) {
            log.info("Webhook verification missing parameters");
            return errorResponse(HttpStatus.BAD_REQUEST, "Missing parameters");
        }
        String expectedToken = appProperties.getWhatsapp().getVerifyToken();
        if (SUBSCRIBE_MODE.equals(mode) && !isBlank(expectedToken) && expectedToken.equals(verifyToken)) {
            log.info("Webhook verified");
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(challenge == null ? "" : challenge);
        }
        log.warn("Webhook verification failed (mode={})", mode);
        return errorResponse(HttpStatus.FORBIDDEN, "Verification failed");
    }

    /**
     * Receives a message delivery.
     */
    @PostMapping
    public ResponseEntity<ApiResponse> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature) {
        byte[] rawBody = body == null ? new byte[0] : body;
        if (!signatureVerifier.verify(rawBody, signature)) {
            return errorResponse(HttpStatus.UNAUTHORIZED, "Invalid signature");
        }
        try {
            Optional<InboundMessage> inbound = payloadParser.parse(new String(rawBody, StandardCharsets.UTF_8));
            inbound.ifPresent(messageRouter::handle);
        } catch (RuntimeException e) {
            log.error("Failed to process webhook delivery", e);
        }
        return createSuccessResponse("Message received");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
