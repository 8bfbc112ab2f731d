package com.clapgrow.channels.whatsapp.dto;

import com.clapgrow.channels.whatsapp.entity.ConversationEntity;
import com.clapgrow.channels.whatsapp.enums.ConversationType;

import java.time.LocalDateTime;

public record ConversationResponse(
    String channelId,
    String jid,
    ConversationType type,
    String name,
    String lastMessageText,
    LocalDateTime lastMessageAt,
    int unreadCount,
    LocalDateTime updatedAt
) {

    public static ConversationResponse from(ConversationEntity conversation) {
        return new ConversationResponse(
            conversation.getChannelId(),
            conversation.getJid(),
            conversation.getType(),
            conversation.getName(),
            conversation.getLastMessageText(),
            conversation.getLastMessageAt(),
            conversation.getUnreadCount(),
            conversation.getUpdatedAt());
    }
}
