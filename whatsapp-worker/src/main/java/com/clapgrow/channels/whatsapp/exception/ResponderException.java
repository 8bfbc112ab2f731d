package com.clapgrow.channels.whatsapp.exception;

/**
 * The auto-reply responder failed or timed out. The inbound message is left unanswered.
 */
public class ResponderException extends RuntimeException {

    public ResponderException(String message, Throwable cause) {
        super(message, cause);
    }
}
