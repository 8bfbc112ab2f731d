package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.whatsapp.enums.ChannelStatus;

/**
 * Connection state of one channel as tracked by its supervisor.
 */
public enum ConnectionState {
    IDLE(ChannelStatus.DISCONNECTED),
    CONNECTING(ChannelStatus.CONNECTING),
    AWAITING_SCAN(ChannelStatus.QR),
    CONNECTED(ChannelStatus.CONNECTED),
    CLOSING(ChannelStatus.DISCONNECTED),
    LOGGED_OUT(ChannelStatus.DISCONNECTED),
    ERROR(ChannelStatus.ERROR);

    private final ChannelStatus channelStatus;

    ConnectionState(ChannelStatus channelStatus) {
        this.channelStatus = channelStatus;
    }

    public ChannelStatus toChannelStatus() {
        return channelStatus;
    }

    /**
     * A session attempt is pending or established.
     */
    public boolean isLive() {
        return this == CONNECTING || this == AWAITING_SCAN || this == CONNECTED;
    }
}
