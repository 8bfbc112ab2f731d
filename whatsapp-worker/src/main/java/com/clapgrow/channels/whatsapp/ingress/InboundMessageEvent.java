package com.clapgrow.channels.whatsapp.ingress;

/**
 * Published to Kafka for every stored inbound message that was not sent by the channel itself.
 */
public record InboundMessageEvent(
    String channelId,
    String jid,
    String messageId,
    String text,
    long timestamp,
    String pushName
) {
}
