package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import com.clapgrow.channels.whatsapp.publisher.ChannelError;

/**
 * The supervisor's in-memory view of a channel at the moment an operation completed.
 */
public record ChannelSnapshot(
    String channelId,
    ConnectionState state,
    ChannelStatus status,
    String qr,
    String qrDataUrl,
    String phoneE164,
    ChannelError lastError
) {
}
