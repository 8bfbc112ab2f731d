package com.clapgrow.channels.whatsapp.store;

import com.clapgrow.channels.common.retry.FailureClassification;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.stereotype.Component;

/**
 * Classifies store write failures.
 *
 * <ul>
 *   <li>Integrity violations are TRANSIENT: they come from two writers inserting the same
 *       document, and the next attempt re-reads and updates it.</li>
 *   <li>Other non-transient data access errors and programming errors are PERMANENT.</li>
 *   <li>Everything else (lost connections, lock timeouts, failed transactions) is TRANSIENT.</li>
 * </ul>
 */
@Component
public class StoreFailureClassifier {

    public FailureClassification classify(RuntimeException failure) {
        if (failure instanceof DataIntegrityViolationException) {
            return FailureClassification.TRANSIENT;
        }
        if (failure instanceof NonTransientDataAccessException
                || failure instanceof IllegalArgumentException
                || failure instanceof IllegalStateException) {
            return FailureClassification.PERMANENT;
        }
        return FailureClassification.TRANSIENT;
    }
}
