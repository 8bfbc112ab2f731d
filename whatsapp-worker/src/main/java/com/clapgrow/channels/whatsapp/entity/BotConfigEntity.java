package com.clapgrow.channels.whatsapp.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "bot_configs")
@Getter
@Setter
@NoArgsConstructor
public class BotConfigEntity {

    @Id
    @Column(name = "channel_id", length = 128)
    private String channelId;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "product_details", columnDefinition = "TEXT")
    private String productDetails = "";

    @Column(name = "sales_strategy", columnDefinition = "TEXT")
    private String salesStrategy = "";

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "updated_by_uid", length = 128)
    private String updatedByUid;

    @Column(name = "updated_by_email", length = 255)
    private String updatedByEmail;

    @Column(name = "last_auto_reply_at")
    private LocalDateTime lastAutoReplyAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_error_at")
    private LocalDateTime lastErrorAt;

    public BotConfigEntity(String channelId) {
        this.channelId = channelId;
    }
}
