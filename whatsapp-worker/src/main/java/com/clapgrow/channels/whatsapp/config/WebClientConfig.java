package com.clapgrow.channels.whatsapp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient wasenderWebClient(WasenderProperties properties) {
        return WebClient.builder()
            .baseUrl(properties.getApi().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
            .build();
    }

    @Bean
    public WebClient responderWebClient(AutoReplyProperties properties) {
        return WebClient.builder()
            .baseUrl(properties.getResponder().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    }

    /**
     * All persisted timestamps are UTC wall-clock values.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
