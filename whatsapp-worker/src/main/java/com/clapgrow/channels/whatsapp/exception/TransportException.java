package com.clapgrow.channels.whatsapp.exception;

import com.clapgrow.channels.common.provider.ProviderErrorCategory;
import com.clapgrow.channels.whatsapp.transport.CloseReason;
import lombok.Getter;

/**
 * Failure talking to the WhatsApp gateway. Carries the close reason the supervisor
 * feeds into its reconnect policy when the failure ends a handshake.
 */
@Getter
public class TransportException extends RuntimeException {

    private final CloseReason closeReason;
    private final ProviderErrorCategory category;
    private final Integer httpStatus;

    public TransportException(String message, CloseReason closeReason, ProviderErrorCategory category) {
        this(message, closeReason, category, null, null);
    }

    public TransportException(String message, CloseReason closeReason, ProviderErrorCategory category,
                              Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.closeReason = closeReason;
        this.category = category;
        this.httpStatus = httpStatus;
    }
}
