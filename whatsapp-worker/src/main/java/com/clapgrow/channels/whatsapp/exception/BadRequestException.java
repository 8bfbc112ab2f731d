package com.clapgrow.channels.whatsapp.exception;

/**
 * Invalid input from a Control API caller. Mapped to HTTP 400.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
