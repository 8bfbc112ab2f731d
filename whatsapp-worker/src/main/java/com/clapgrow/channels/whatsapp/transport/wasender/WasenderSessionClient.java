package com.clapgrow.channels.whatsapp.transport.wasender;

import com.clapgrow.channels.common.provider.ProviderErrorCategory;
import com.clapgrow.channels.whatsapp.config.WasenderProperties;
import com.clapgrow.channels.whatsapp.exception.ConfigurationException;
import com.clapgrow.channels.whatsapp.exception.TransportException;
import com.clapgrow.channels.whatsapp.transport.CloseReason;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Blocking client for the WASender session API. Account-level calls use the personal access
 * token, session-level calls (status, send) use the session's own API key.
 */
@Component
@Slf4j
public class WasenderSessionClient {

    private final WebClient webClient;
    private final WasenderProperties properties;
    private final TransportFailureClassifier failureClassifier;

    public WasenderSessionClient(@Qualifier("wasenderWebClient") WebClient webClient,
                                 WasenderProperties properties,
                                 TransportFailureClassifier failureClassifier) {
        this.webClient = webClient;
        this.properties = properties;
        this.failureClassifier = failureClassifier;
    }

    public WasenderSessionInfo createSession(String name) {
        Map<String, Object> body = new HashMap<>();
        body.put("name", name);
        body.put("account_protection", properties.getApi().isAccountProtection());
        body.put("log_messages", properties.getApi().isLogMessages());
        String webhookUrl = properties.getWebhook().getUrl();
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            body.put("webhook_url", webhookUrl);
            body.put("webhook_enabled", true);
            body.put("webhook_events", properties.getWebhook().getEvents());
        }
        JsonNode response = call("create session", () -> webClient.post()
            .uri("/whatsapp-sessions")
            .header(HttpHeaders.AUTHORIZATION, bearer(accountToken()))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class));
        WasenderSessionInfo info = toSessionInfo(data(response));
        if (info.id() == null || info.apiKey() == null) {
            throw new TransportException("Gateway created a session without id or api key",
                CloseReason.SERVER_ERROR,
                ProviderErrorCategory.TEMPORARY);
        }
        log.info("Gateway session created: name={}, sessionId={}", name, info.id());
        return info;
    }

    public ConnectResult connect(String sessionId) {
        try {
            JsonNode response = webClient.post()
                .uri("/whatsapp-sessions/{id}/connect", sessionId)
                .header(HttpHeaders.AUTHORIZATION, bearer(accountToken()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout())
                .block();
            JsonNode data = data(response);
            return new ConnectResult(text(data, "status"), firstText(data, "qrCode", "qr"));
        } catch (WebClientResponseException e) {
            if (failureClassifier.isAlreadyConnected(e.getResponseBodyAsString())) {
                return new ConnectResult("connected", null);
            }
            throw failureClassifier.toException("connect session", e.getStatusCode().value(),
                e.getResponseBodyAsString(), e);
        } catch (ConfigurationException | TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failureClassifier.toException("connect session", null, null, e);
        }
    }

    public String getQrCode(String sessionId) {
        JsonNode response = call("get qr code", () -> webClient.get()
            .uri("/whatsapp-sessions/{id}/qrcode", sessionId)
            .header(HttpHeaders.AUTHORIZATION, bearer(accountToken()))
            .retrieve()
            .bodyToMono(JsonNode.class));
        return firstText(data(response), "qrCode", "qr");
    }

    public WasenderSessionInfo getSessionDetails(String sessionId) {
        JsonNode response = call("get session details", () -> webClient.get()
            .uri("/whatsapp-sessions/{id}", sessionId)
            .header(HttpHeaders.AUTHORIZATION, bearer(accountToken()))
            .retrieve()
            .bodyToMono(JsonNode.class));
        return toSessionInfo(data(response));
    }

    /**
     * Status of the session that owns {@code sessionApiKey}, lower-cased.
     */
    public String getStatus(String sessionApiKey) {
        JsonNode response = call("get session status", () -> webClient.get()
            .uri("/status")
            .header(HttpHeaders.AUTHORIZATION, bearer(sessionApiKey))
            .retrieve()
            .bodyToMono(JsonNode.class));
        String status = text(response, "status");
        if (status == null) {
            status = text(data(response), "status");
        }
        return status == null ? null : status.toLowerCase();
    }

    /**
     * @return the WhatsApp message id of the accepted message
     */
    public String sendText(String sessionApiKey, String to, String text) {
        Map<String, Object> body = Map.of("to", to, "text", text);
        JsonNode response = call("send message", () -> webClient.post()
            .uri("/send-message")
            .header(HttpHeaders.AUTHORIZATION, bearer(sessionApiKey))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class));
        JsonNode data = data(response);
        return firstText(data, "msgId", "messageId", "id");
    }

    public void disconnect(String sessionId) {
        call("disconnect session", () -> webClient.post()
            .uri("/whatsapp-sessions/{id}/disconnect", sessionId)
            .header(HttpHeaders.AUTHORIZATION, bearer(accountToken()))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .defaultIfEmpty(NullNode.getInstance()));
    }

    public void delete(String sessionId) {
        call("delete session", () -> webClient.delete()
            .uri("/whatsapp-sessions/{id}", sessionId)
            .header(HttpHeaders.AUTHORIZATION, bearer(accountToken()))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .defaultIfEmpty(NullNode.getInstance()));
        log.info("Gateway session deleted: sessionId={}", sessionId);
    }

    public boolean isConfigured() {
        String token = properties.getApi().getPersonalAccessToken();
        return token != null && !token.isBlank();
    }

    private JsonNode call(String operation, Supplier<Mono<JsonNode>> request) {
        try {
            return request.get().timeout(timeout()).block();
        } catch (WebClientResponseException e) {
            log.warn("Gateway call failed: operation={}, status={}", operation, e.getStatusCode().value());
            throw failureClassifier.toException(operation, e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (ConfigurationException | TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Gateway call failed: operation={}, error={}", operation, e.getMessage());
            throw failureClassifier.toException(operation, null, null, e);
        }
    }

    private String accountToken() {
        if (!isConfigured()) {
            throw new ConfigurationException("wasender.api.personal-access-token is not configured");
        }
        return properties.getApi().getPersonalAccessToken();
    }

    private Duration timeout() {
        return properties.getApi().getRequestTimeout();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private static JsonNode data(JsonNode response) {
        if (response == null) {
            return null;
        }
        JsonNode data = response.get("data");
        return data != null && !data.isNull() ? data : response;
    }

    private static WasenderSessionInfo toSessionInfo(JsonNode data) {
        return new WasenderSessionInfo(
            firstText(data, "id", "session_id"),
            firstText(data, "api_key", "apiKey"),
            text(data, "status"),
            firstText(data, "phone_number", "phoneNumber"));
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.has(field) || node.get(field).isNull()) {
            return null;
        }
        String value = node.get(field).asText();
        return value.isBlank() ? null : value;
    }
}
