package com.clapgrow.channels.whatsapp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "autoreply")
@Data
public class AutoReplyProperties {

    private String topic = "whatsapp-inbound-messages";

    /**
     * Number of most recent messages of the conversation given to the responder.
     */
    private int historySize = 20;

    private Responder responder = new Responder();

    @Data
    public static class Responder {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double temperature = 0.4;
        private int maxTokens = 400;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
