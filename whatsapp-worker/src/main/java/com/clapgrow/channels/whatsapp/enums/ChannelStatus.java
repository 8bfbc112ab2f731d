package com.clapgrow.channels.whatsapp.enums;

/**
 * Externally visible connection status of a channel, as stored on the channel record.
 */
public enum ChannelStatus {
    DISCONNECTED,
    CONNECTING,
    QR,
    CONNECTED,
    ERROR
}
