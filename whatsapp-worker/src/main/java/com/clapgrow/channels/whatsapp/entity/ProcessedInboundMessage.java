package com.clapgrow.channels.whatsapp.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Marker written before an auto-reply is attempted, so a redelivered inbound event is answered at most once.
 */
@Entity
@Table(name = "bot_processed_messages")
@IdClass(ProcessedInboundMessage.Key.class)
@Getter
@Setter
@NoArgsConstructor
public class ProcessedInboundMessage {

    @Id
    @Column(name = "channel_id", length = 128)
    private String channelId;

    @Id
    @Column(name = "message_id", length = 128)
    private String messageId;

    @Column(name = "jid", length = 128)
    private String jid;

    @Column(name = "processed_at", nullable = false)
    private LocalDateTime processedAt;

    public ProcessedInboundMessage(String channelId, String messageId, String jid, LocalDateTime processedAt) {
        this.channelId = channelId;
        this.messageId = messageId;
        this.jid = jid;
        this.processedAt = processedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String channelId;
        private String messageId;
    }
}
