package com.clapgrow.channels.whatsapp.autoreply;

/**
 * One earlier message of the conversation as the responder sees it.
 */
public record HistoryEntry(boolean fromMe, String text, long timestamp) {
}
