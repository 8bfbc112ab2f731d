package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.common.retry.RetryPolicy;
import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import com.clapgrow.channels.whatsapp.transport.CloseReason;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * What to do after a transport session ends, by close reason, and how long to wait before trying again.
 *
 * <p>A device that was unlinked, replaced by another client or left with unusable credentials
 * needs a person to pair it again, so those reasons never reconnect on their own. Their
 * credentials are dropped as well: the next QR request always starts a new pairing.
 */
@Component
public class ReconnectPolicy {

    public record Decision(boolean reconnect, boolean discardCredentials, boolean immediate) {

        static Decision stop(boolean discardCredentials) {
            return new Decision(false, discardCredentials, false);
        }

        static Decision retryWithBackoff() {
            return new Decision(true, false, false);
        }

        static Decision retryNow() {
            return new Decision(true, false, true);
        }
    }

    private static final Map<CloseReason, Decision> DECISIONS = new EnumMap<>(CloseReason.class);

    static {
        DECISIONS.put(CloseReason.LOGGED_OUT, Decision.stop(true));
        DECISIONS.put(CloseReason.BAD_SESSION, Decision.stop(true));
        DECISIONS.put(CloseReason.REPLACED, Decision.stop(true));
        DECISIONS.put(CloseReason.RESTART_REQUIRED, Decision.retryNow());
        DECISIONS.put(CloseReason.CONNECTION_LOST, Decision.retryWithBackoff());
        DECISIONS.put(CloseReason.CONNECTION_CLOSED, Decision.retryWithBackoff());
        DECISIONS.put(CloseReason.TIMED_OUT, Decision.retryWithBackoff());
        DECISIONS.put(CloseReason.SERVER_ERROR, Decision.retryWithBackoff());
        DECISIONS.put(CloseReason.UNKNOWN, Decision.retryWithBackoff());
    }

    private final RetryPolicy backoff;

    @Autowired
    public ReconnectPolicy(WorkerProperties properties) {
        this(properties.getReconnect().toRetryPolicy());
    }

    public ReconnectPolicy(RetryPolicy backoff) {
        this.backoff = backoff;
    }

    public Decision decide(CloseReason reason) {
        return DECISIONS.getOrDefault(reason == null ? CloseReason.UNKNOWN : reason,
            Decision.retryWithBackoff());
    }

    public boolean allowsAttempt(int attempt) {
        return backoff.allowsAttempt(attempt);
    }

    public long delayMs(int attempt, double random) {
        return backoff.delayMs(attempt, random);
    }
}
