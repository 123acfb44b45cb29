package com.williamcallahan.chatrelay.service.whatsapp;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the {@code X-Hub-Signature-256} header Meta attaches to webhook deliveries: an HMAC-SHA256 of the
 * raw request body keyed with the app secret.
 */
public class WebhookSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    private final String appSecret;

    public WebhookSignatureVerifier(String appSecret) {
        this.appSecret = appSecret == null ? "" : appSecret;
    }

    public boolean isEnforced() {
        return !appSecret.isBlank();
    }

    /**
     * Verifies a delivery. Without a configured app secret every delivery is accepted.
     *
     * @param rawBody request body exactly as received
     * @param signatureHeader value of the signature header, may be null
     * @return true when the signature matches or verification is disabled
     */
    public boolean verify(byte[] rawBody, String signatureHeader) {
        if (!isEnforced()) {
            log.warn("Webhook app secret not configured - accepting unsigned delivery");
            return true;
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            log.warn("Webhook delivery rejected: missing signature header");
            return false;
        }
        String expected = SIGNATURE_PREFIX + sign(rawBody == null ? new byte[0] : rawBody);
        String provided = signatureHeader.trim().toLowerCase(Locale.ROOT);
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII), provided.getBytes(StandardCharsets.US_ASCII));
        if (!matches) {
            log.warn("Webhook delivery rejected: signature mismatch");
        }
        return matches;
    }

    /**
     * Computes the lowercase hex HMAC-SHA256 of a payload with the configured secret.
     *
     * @param payload bytes to sign
     * @return hex digest
     */
    public String sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(appSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
