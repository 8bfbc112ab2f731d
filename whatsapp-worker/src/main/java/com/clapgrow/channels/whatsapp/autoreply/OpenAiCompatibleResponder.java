package com.clapgrow.channels.whatsapp.autoreply;

import com.clapgrow.channels.whatsapp.config.AutoReplyProperties;
import com.clapgrow.channels.whatsapp.exception.ConfigurationException;
import com.clapgrow.channels.whatsapp.exception.ResponderException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Responder backed by an OpenAI-compatible {@code /chat/completions} endpoint.
 */
@Component
@Slf4j
public class OpenAiCompatibleResponder implements AutoReplyResponder {

    private final WebClient webClient;
    private final AutoReplyProperties properties;

    public OpenAiCompatibleResponder(@Qualifier("responderWebClient") WebClient webClient,
                                     AutoReplyProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public Optional<String> reply(ResponderRequest request) {
        AutoReplyProperties.Responder settings = properties.getResponder();
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new ConfigurationException("autoreply.responder.api-key is not configured");
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", settings.getModel());
        body.put("temperature", settings.getTemperature());
        body.put("max_tokens", settings.getMaxTokens());
        body.put("messages", toMessages(request));

        JsonNode response;
        try {
            response = webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(settings.getTimeout())
                .block();
        } catch (WebClientResponseException e) {
            log.warn("Responder call failed: channelId={}, status={}", request.channelId(), e.getStatusCode().value());
            throw new ResponderException("Responder returned HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            log.warn("Responder call failed: channelId={}, error={}", request.channelId(), e.getMessage());
            throw new ResponderException("Responder call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            return Optional.empty();
        }
        String content = response.path("choices").path(0).path("message").path("content").asText("");
        return content.isBlank() ? Optional.empty() : Optional.of(content.trim());
    }

    static List<Map<String, String>> toMessages(ResponderRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        for (HistoryEntry entry : request.history()) {
            if (entry.text() == null || entry.text().isBlank()) {
                continue;
            }
            messages.add(Map.of("role", entry.fromMe() ? "assistant" : "user", "content", entry.text()));
        }
        messages.add(Map.of("role", "user", "content", request.inboundText()));
        return messages;
    }
}
