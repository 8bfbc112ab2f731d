package com.clapgrow.channels.whatsapp.dto;

import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;

import java.time.LocalDateTime;

/**
 * Stored channel record as the dashboard reads it.
 */
public record ChannelResponse(
    String id,
    String displayName,
    ChannelStatus status,
    String qr,
    String qrDataUrl,
    String phoneE164,
    boolean linked,
    LocalDateTime lastSeenAt,
    LocalDateTime lastQrAt,
    LocalDateTime connectedAt,
    ErrorInfo lastError,
    String companyId,
    String companyName,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public record ErrorInfo(String code, String message, LocalDateTime at) {
    }

    public static ChannelResponse from(ChannelEntity channel) {
        ErrorInfo lastError = channel.getLastErrorCode() == null && channel.getLastErrorMessage() == null
            ? null
            : new ErrorInfo(channel.getLastErrorCode(), channel.getLastErrorMessage(), channel.getLastErrorAt());
        return new ChannelResponse(
            channel.getId(),
            channel.getDisplayName(),
            channel.getStatus(),
            channel.getQr(),
            channel.getQrDataUrl(),
            channel.getPhoneE164(),
            channel.isLinked(),
            channel.getLastSeenAt(),
            channel.getLastQrAt(),
            channel.getConnectedAt(),
            lastError,
            channel.getCompanyId(),
            channel.getCompanyName(),
            channel.getCreatedAt(),
            channel.getUpdatedAt());
    }
}
