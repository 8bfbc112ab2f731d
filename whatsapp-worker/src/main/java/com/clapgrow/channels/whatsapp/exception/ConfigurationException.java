package com.clapgrow.channels.whatsapp.exception;

/**
 * Required configuration (gateway token, responder endpoint) is missing or invalid.
 * Never retried; mapped to HTTP 503.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
