package com.clapgrow.channels.whatsapp.exception;

/**
 * A webhook call carried no or a wrong signature. Mapped to HTTP 401.
 */
public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
