package com.clapgrow.channels.whatsapp.store;

import com.clapgrow.channels.common.retry.FailureClassification;
import com.clapgrow.channels.common.retry.RetryPolicy;
import com.clapgrow.channels.common.retry.RetryPolicyResolver;
import com.clapgrow.channels.whatsapp.exception.StoreWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retries writes to the shared store with backoff and gives up with {@link StoreWriteException}.
 * Runs on the caller's thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreWriteRetrier {

    private final StoreFailureClassifier failureClassifier;
    private final RetryPolicyResolver retryPolicyResolver;

    public <T> T execute(String operation, String channelId, Supplier<T> action) {
        int retry = 0;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                retry++;
                FailureClassification classification = failureClassifier.classify(e);
                RetryPolicy policy = retryPolicyResolver.resolve(classification);
                if (!policy.allowsAttempt(retry)) {
                    log.error("Store write failed, giving up: operation={}, channelId={}, classification={}, retries={}, error={}",
                        operation, channelId, classification, retry - 1, e.getMessage());
                    throw new StoreWriteException(operation + " failed for channel " + channelId, e);
                }
                long delayMs = policy.delayMs(retry, ThreadLocalRandom.current().nextDouble());
                log.warn("Store write failed, retrying: operation={}, channelId={}, retry={}, delayMs={}, error={}",
                    operation, channelId, retry, delayMs, e.getMessage());
                pause(delayMs, operation, e);
            }
        }
    }

    public void run(String operation, String channelId, Runnable action) {
        execute(operation, channelId, () -> {
            action.run();
            return null;
        });
    }

    private void pause(long delayMs, String operation, RuntimeException cause) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreWriteException("Interrupted while retrying " + operation, cause);
        }
    }
}
