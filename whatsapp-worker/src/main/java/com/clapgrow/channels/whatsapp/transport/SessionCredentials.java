package com.clapgrow.channels.whatsapp.transport;

/**
 * Credential material that lets a channel resume its linked-device session without a new pairing.
 *
 * @param channelId         owning channel
 * @param providerSessionId session id at the gateway
 * @param sessionApiKey     per-session key used for status polls and sends
 * @param createdAt         epoch millis when the session was first created
 */
public record SessionCredentials(
    String channelId,
    String providerSessionId,
    String sessionApiKey,
    long createdAt
) {
}
