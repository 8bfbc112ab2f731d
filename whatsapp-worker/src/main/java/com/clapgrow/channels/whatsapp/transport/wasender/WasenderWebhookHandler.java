package com.clapgrow.channels.whatsapp.transport.wasender;

import com.clapgrow.channels.whatsapp.config.WasenderProperties;
import com.clapgrow.channels.whatsapp.exception.ConfigurationException;
import com.clapgrow.channels.whatsapp.exception.WebhookAuthenticationException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Verifies the shared webhook secret and routes the event to the transport.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WasenderWebhookHandler {

    private final WasenderProperties properties;
    private final WasenderTransport transport;

    /**
     * @return true when the event belonged to a session held by this worker
     * @throws ConfigurationException when no webhook secret is configured
     * @throws WebhookAuthenticationException when the signature does not match the secret
     */
    public boolean handle(String signature, JsonNode payload) {
        verify(signature);
        if (payload == null || !payload.isObject()) {
            log.debug("Ignoring webhook without JSON object body");
            return false;
        }
        boolean routed = transport.handleWebhook(payload);
        log.debug("Webhook processed: event={}, routed={}", payload.path("event").asText(null), routed);
        return routed;
    }

    void verify(String signature) {
        String secret = properties.getWebhook().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("wasender.webhook.secret is not configured");
        }
        if (signature == null || !MessageDigest.isEqual(
                secret.getBytes(StandardCharsets.UTF_8), signature.trim().getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected webhook with invalid signature");
            throw new WebhookAuthenticationException("Invalid webhook signature");
        }
    }
}
