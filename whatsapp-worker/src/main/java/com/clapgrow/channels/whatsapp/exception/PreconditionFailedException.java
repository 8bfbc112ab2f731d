package com.clapgrow.channels.whatsapp.exception;

import lombok.Getter;

/**
 * A control operation was requested in a connection state that does not allow it.
 * Mapped to HTTP 409.
 */
@Getter
public class PreconditionFailedException extends RuntimeException {

    public enum Reason {
        NOT_CONNECTED,
        ALREADY_CONNECTED,
        NOT_IN_ERROR
    }

    private final Reason reason;

    public PreconditionFailedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static PreconditionFailedException notConnected(String channelId) {
        return new PreconditionFailedException(Reason.NOT_CONNECTED,
            "Channel " + channelId + " is not connected");
    }

    public static PreconditionFailedException alreadyConnected(String channelId) {
        return new PreconditionFailedException(Reason.ALREADY_CONNECTED,
            "Channel " + channelId + " is already connected");
    }

    public static PreconditionFailedException notInError(String channelId, Object status) {
        return new PreconditionFailedException(Reason.NOT_IN_ERROR,
            "Channel " + channelId + " is " + status + ", repair is only possible from ERROR");
    }
}
