package com.clapgrow.channels.whatsapp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings for the WASender gateway that holds the linked-device sessions.
 */
@Configuration
@ConfigurationProperties(prefix = "wasender")
@Data
public class WasenderProperties {

    private Api api = new Api();
    private Webhook webhook = new Webhook();

    /**
     * How often a live session's status is polled. Webhooks deliver the same transitions
     * sooner when they are configured.
     */
    private Duration statusPollInterval = Duration.ofSeconds(5);

    /**
     * Consecutive failed status polls after which the connection counts as lost.
     */
    private int maxFailedPolls = 3;

    @Data
    public static class Api {
        private String baseUrl = "https://wasenderapi.com/api";

        /**
         * Account-level token used to create, connect and delete sessions.
         */
        private String personalAccessToken;

        private Duration requestTimeout = Duration.ofSeconds(30);

        private boolean accountProtection = true;
        private boolean logMessages = true;
    }

    @Data
    public static class Webhook {
        /**
         * Public URL of this worker's webhook endpoint, registered on each new session.
         */
        private String url;
        private String secret;
        private List<String> events = new ArrayList<>(List.of(
            "messages.upsert", "messages.update", "session.status", "qrcode.updated"));
    }
}
