package com.clapgrow.channels.whatsapp.dto;

import com.clapgrow.channels.whatsapp.entity.BotConfigEntity;

import java.time.LocalDateTime;

public record BotConfigResponse(
    String channelId,
    boolean enabled,
    String productDetails,
    String salesStrategy,
    LocalDateTime updatedAt,
    String updatedByUid,
    String updatedByEmail,
    LocalDateTime lastAutoReplyAt,
    String lastError,
    LocalDateTime lastErrorAt
) {

    public static BotConfigResponse from(BotConfigEntity config) {
        return new BotConfigResponse(
            config.getChannelId(),
            config.isEnabled(),
            config.getProductDetails(),
            config.getSalesStrategy(),
            config.getUpdatedAt(),
            config.getUpdatedByUid(),
            config.getUpdatedByEmail(),
            config.getLastAutoReplyAt(),
            config.getLastError(),
            config.getLastErrorAt());
    }
}
