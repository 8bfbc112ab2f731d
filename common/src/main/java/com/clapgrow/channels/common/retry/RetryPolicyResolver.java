package com.clapgrow.channels.common.retry;

/**
 * Resolves a retry policy from a failure classification.
 *
 * <p>Keeps "what went wrong" separate from "how do we retry it", so each worker can
 * tune its retry behaviour without touching its classification rules.
 */
public interface RetryPolicyResolver {

    /**
     * Resolve retry policy for a given failure classification.
     *
     * @param classification failure classification
     * @return retry policy to apply
     */
    RetryPolicy resolve(FailureClassification classification);
}
