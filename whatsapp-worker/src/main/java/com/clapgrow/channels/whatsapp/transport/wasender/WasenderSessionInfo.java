package com.clapgrow.channels.whatsapp.transport.wasender;

/**
 * Session fields returned by the gateway's session endpoints.
 */
public record WasenderSessionInfo(
    String id,
    String apiKey,
    String status,
    String phoneNumber
) {
}
