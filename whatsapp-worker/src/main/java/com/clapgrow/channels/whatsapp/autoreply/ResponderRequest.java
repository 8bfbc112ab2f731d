package com.clapgrow.channels.whatsapp.autoreply;

import java.util.List;

/**
 * Everything the responder gets for one reply: the system prompt built from the channel's
 * bot configuration, the conversation history (oldest first) and the inbound text to answer.
 */
public record ResponderRequest(
    String channelId,
    String jid,
    String systemPrompt,
    List<HistoryEntry> history,
    String inboundText
) {
}
