package com.clapgrow.channels.whatsapp.ingress;

/**
 * A message event reduced to the fields the worker stores.
 *
 * @param text      {@code null} for payloads without text (media, stickers, reactions)
 * @param timestamp epoch millis assigned by WhatsApp
 */
public record NormalizedMessage(
    String messageId,
    String jid,
    boolean fromMe,
    String text,
    long timestamp,
    String pushName
) {
}
