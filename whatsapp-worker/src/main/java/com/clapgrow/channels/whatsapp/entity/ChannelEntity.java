package com.clapgrow.channels.whatsapp.entity;

import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One WhatsApp-linked number. Written only through {@code ChannelStatePublisher}.
 *
 * <p>companyId and companyName belong to the dashboard; the worker reads them but never writes them.
 */
@Entity
@Table(name = "channels", indexes = {
    @Index(name = "idx_channels_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
public class ChannelEntity {

    @Id
    @Column(name = "id", length = 128)
    private String id;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ChannelStatus status = ChannelStatus.DISCONNECTED;

    @Column(name = "qr", columnDefinition = "TEXT")
    private String qr;

    @Column(name = "qr_data_url", columnDefinition = "TEXT")
    private String qrDataUrl;

    @Column(name = "phone_e164", length = 32)
    private String phoneE164;

    @Column(name = "linked", nullable = false)
    private boolean linked;

    @Column(name = "last_seen_at")
    private LocalDateTime lastSeenAt;

    @Column(name = "last_qr_at")
    private LocalDateTime lastQrAt;

    @Column(name = "connected_at")
    private LocalDateTime connectedAt;

    @Column(name = "last_error_code", length = 64)
    private String lastErrorCode;

    @Column(name = "last_error_message", columnDefinition = "TEXT")
    private String lastErrorMessage;

    @Column(name = "last_error_at")
    private LocalDateTime lastErrorAt;

    @Column(name = "company_id", length = 128, insertable = false, updatable = false)
    private String companyId;

    @Column(name = "company_name", length = 255, insertable = false, updatable = false)
    private String companyName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public ChannelEntity(String id) {
        this.id = id;
    }
}
