package com.clapgrow.channels.whatsapp.entity;

import com.clapgrow.channels.whatsapp.enums.ConversationType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "conversations", indexes = {
    @Index(name = "idx_conversations_last_message", columnList = "channel_id, last_message_at")
})
@IdClass(ConversationKey.class)
@Getter
@Setter
@NoArgsConstructor
public class ConversationEntity {

    @Id
    @Column(name = "channel_id", length = 128)
    private String channelId;

    @Id
    @Column(name = "jid", length = 128)
    private String jid;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private ConversationType type;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "last_message_text", columnDefinition = "TEXT")
    private String lastMessageText;

    @Column(name = "last_message_at")
    private LocalDateTime lastMessageAt;

    @Column(name = "last_message_id", length = 128)
    private String lastMessageId;

    @Column(name = "unread_count", nullable = false)
    private int unreadCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public ConversationEntity(String channelId, String jid) {
        this.channelId = channelId;
        this.jid = jid;
        this.type = ConversationType.fromJid(jid);
    }
}
