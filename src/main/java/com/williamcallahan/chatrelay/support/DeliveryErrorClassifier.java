package com.williamcallahan.chatrelay.support;

import java.util.Locale;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Classifies outbound HTTP failures so only transient ones are retried.
 */
public final class DeliveryErrorClassifier {

    private static final int TOO_MANY_REQUESTS = 429;
    private static final int SERVER_ERROR_FLOOR = 500;

    private DeliveryErrorClassifier() {}

    /**
     * Determine a stable error category for logging.
     *
     * @param error failure encountered during delivery
     * @return normalized error category label
     */
    public static String determineErrorType(Throwable error) {
        if (error instanceof RestClientResponseException responseException) {
            int statusCode = responseException.getStatusCode().value();
            if (statusCode == 401 || statusCode == 403) {
                return "Authentication Error";
            }
            if (statusCode == TOO_MANY_REQUESTS) {
                return "429 Rate Limited";
            }
            if (statusCode >= SERVER_ERROR_FLOOR) {
                return "Server Error";
            }
            return "Client Error";
        }
        if (error instanceof ResourceAccessException) {
            return "Connection Error";
        }
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("timeout") || message.contains("timed out") || message.contains("connection")) {
            return "Connection Error";
        }
        return "Unknown Error";
    }

    /**
     * Determines whether a delivery failure is transient: I/O problems, timeouts, rate limits and 5xx responses.
     * Other 4xx responses mean the request itself is wrong and retrying cannot help.
     *
     * @param error the exception to classify
     * @return true if the call should be retried
     */
    public static boolean isTransientDeliveryError(Throwable error) {
        String errorType = determineErrorType(error);
        return "Connection Error".equals(errorType)
                || "429 Rate Limited".equals(errorType)
                || "Server Error".equals(errorType);
    }
}
