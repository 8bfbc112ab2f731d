package com.clapgrow.channels.whatsapp.transport.wasender;

import com.clapgrow.channels.common.provider.ProviderErrorCategory;
import com.clapgrow.channels.common.retry.FailureClassification;
import com.clapgrow.channels.whatsapp.exception.SessionLoggedOutException;
import com.clapgrow.channels.whatsapp.exception.TransportException;
import com.clapgrow.channels.whatsapp.transport.CloseReason;
import org.springframework.stereotype.Component;

/**
 * Maps gateway HTTP failures to transport exceptions.
 *
 * <ul>
 *   <li>429: RATE_LIMIT, connection lost (retry later)</li>
 *   <li>401/403 or an invalid key message: PERMANENT, the stored session is unusable</li>
 *   <li>404: PERMANENT, the session no longer exists at the gateway</li>
 *   <li>a "logged out" message: the device was unlinked</li>
 *   <li>other 4xx: PERMANENT request error</li>
 *   <li>5xx, network errors, timeouts: TRANSIENT</li>
 * </ul>
 */
@Component
public class TransportFailureClassifier {

    public FailureClassification classify(Integer httpStatus, String responseBody) {
        if (httpStatus != null && httpStatus == 429) {
            return FailureClassification.RATE_LIMIT;
        }
        if (httpStatus != null && httpStatus >= 400 && httpStatus < 500) {
            return FailureClassification.PERMANENT;
        }
        if (responseBody != null) {
            String lower = responseBody.toLowerCase();
            if (lower.contains("invalid api key") || lower.contains("unauthorized")) {
                return FailureClassification.PERMANENT;
            }
        }
        return FailureClassification.TRANSIENT;
    }

    public TransportException toException(String operation, Integer httpStatus, String responseBody, Throwable cause) {
        String body = responseBody == null ? "" : responseBody;
        String lower = body.toLowerCase();
        String message = operation + " failed" + (httpStatus != null ? " with HTTP " + httpStatus : "")
            + (cause != null && httpStatus == null ? ": " + cause.getMessage() : "");

        if (lower.contains("logged out") || lower.contains("logged_out")) {
            return new SessionLoggedOutException(message);
        }
        FailureClassification classification = classify(httpStatus, responseBody);
        if (classification == FailureClassification.RATE_LIMIT) {
            return new TransportException(message, CloseReason.CONNECTION_LOST, ProviderErrorCategory.TEMPORARY,
                httpStatus, cause);
        }
        if (httpStatus != null && (httpStatus == 401 || httpStatus == 403)) {
            return new TransportException(message, CloseReason.BAD_SESSION, ProviderErrorCategory.AUTH,
                httpStatus, cause);
        }
        if (httpStatus != null && httpStatus == 404) {
            return new TransportException(message + " (session not found)", CloseReason.BAD_SESSION,
                ProviderErrorCategory.PERMANENT, httpStatus, cause);
        }
        if (classification == FailureClassification.PERMANENT) {
            return new TransportException(message, CloseReason.UNKNOWN, ProviderErrorCategory.PERMANENT,
                httpStatus, cause);
        }
        CloseReason reason = httpStatus != null ? CloseReason.SERVER_ERROR : CloseReason.CONNECTION_LOST;
        return new TransportException(message, reason, ProviderErrorCategory.TEMPORARY, httpStatus, cause);
    }

    /**
     * The gateway answers a connect on a live session with an error that only says so.
     */
    public boolean isAlreadyConnected(String responseBody) {
        return responseBody != null && responseBody.toLowerCase().contains("already connected");
    }
}
