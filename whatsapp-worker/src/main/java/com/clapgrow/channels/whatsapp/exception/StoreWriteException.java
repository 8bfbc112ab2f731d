package com.clapgrow.channels.whatsapp.exception;

/**
 * A write to the shared store failed after its retry budget was spent.
 */
public class StoreWriteException extends RuntimeException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
