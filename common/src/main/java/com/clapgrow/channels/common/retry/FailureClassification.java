package com.clapgrow.channels.common.retry;

/**
 * Classification of a failed call to an external collaborator (messaging provider,
 * document store, text-generation responder).
 *
 * <p>Used to pick a retry strategy:
 * <ul>
 *   <li>PERMANENT: do not retry (authentication errors, revoked sessions, bad requests)</li>
 *   <li>TRANSIENT: retry with the standard backoff (network errors, 5xx, timeouts)</li>
 *   <li>RATE_LIMIT: retry with a longer backoff (429 Too Many Requests)</li>
 * </ul>
 */
public enum FailureClassification {
    PERMANENT,
    TRANSIENT,
    RATE_LIMIT
}
