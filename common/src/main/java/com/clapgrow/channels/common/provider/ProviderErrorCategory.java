package com.clapgrow.channels.common.provider;

/**
 * Provider error category used to decide how an error is surfaced.
 *
 * <ul>
 *   <li>TEMPORARY: rate limits, timeouts, server errors. Retry with backoff.</li>
 *   <li>PERMANENT: malformed request, unknown recipient. Fail fast.</li>
 *   <li>AUTH: revoked session or invalid API key. Needs a human, never retried.</li>
 *   <li>CONFIG: missing endpoint or credentials in our own configuration.</li>
 * </ul>
 */
public enum ProviderErrorCategory {
    TEMPORARY,
    PERMANENT,
    AUTH,
    CONFIG
}
