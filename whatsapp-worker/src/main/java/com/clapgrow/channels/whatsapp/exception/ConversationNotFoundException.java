package com.clapgrow.channels.whatsapp.exception;

public class ConversationNotFoundException extends RuntimeException {

    public ConversationNotFoundException(String channelId, String jid) {
        super("Conversation " + jid + " not found on channel " + channelId);
    }
}
