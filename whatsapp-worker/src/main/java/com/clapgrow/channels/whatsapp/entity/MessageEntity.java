package com.clapgrow.channels.whatsapp.entity;

import com.clapgrow.channels.whatsapp.enums.MessageDirection;
import com.clapgrow.channels.whatsapp.enums.MessageStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A message of a conversation. {@code timestamp} is assigned by WhatsApp (epoch millis) and is
 * not guaranteed to follow ingestion order; readers sort by it.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_conversation_ts", columnList = "channel_id, jid, timestamp_ms")
})
@IdClass(MessageKey.class)
@Getter
@Setter
@NoArgsConstructor
public class MessageEntity {

    @Id
    @Column(name = "channel_id", length = 128)
    private String channelId;

    @Id
    @Column(name = "jid", length = 128)
    private String jid;

    @Id
    @Column(name = "message_id", length = 128)
    private String messageId;

    @Column(name = "from_me", nullable = false)
    private boolean fromMe;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 8)
    private MessageDirection direction;

    @Column(name = "text", columnDefinition = "TEXT")
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16)
    private MessageStatus status;

    @Column(name = "timestamp_ms", nullable = false)
    private long timestamp;

    @Column(name = "raw", columnDefinition = "TEXT")
    private String raw;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public MessageEntity(String channelId, String jid, String messageId) {
        this.channelId = channelId;
        this.jid = jid;
        this.messageId = messageId;
    }
}
