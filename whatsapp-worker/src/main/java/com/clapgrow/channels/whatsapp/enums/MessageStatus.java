package com.clapgrow.channels.whatsapp.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery status of a stored message. Ordered by progress: an update never moves a
 * message back to an earlier status.
 */
public enum MessageStatus {
    RECEIVED("received", 0),
    PENDING("pending", 0),
    SENT("sent", 1),
    DELIVERED("delivered", 2),
    READ("read", 3),
    FAILED("failed", -1);

    private final String value;
    private final int rank;

    MessageStatus(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True when moving from this status to {@code next} is progress.
     */
    public boolean canAdvanceTo(MessageStatus next) {
        if (next == null || next == this) {
            return false;
        }
        if (next == FAILED) {
            return this == PENDING;
        }
        return next.rank > this.rank;
    }
}
