package com.clapgrow.channels.whatsapp.transport.wasender;

import com.clapgrow.channels.whatsapp.config.WasenderProperties;
import com.clapgrow.channels.whatsapp.enums.MessageStatus;
import com.clapgrow.channels.whatsapp.exception.ConfigurationException;
import com.clapgrow.channels.whatsapp.transport.SessionCredentials;
import com.clapgrow.channels.whatsapp.transport.TransportListener;
import com.clapgrow.channels.whatsapp.transport.TransportSession;
import com.clapgrow.channels.whatsapp.transport.WhatsAppTransport;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link WhatsAppTransport} backed by WASender gateway sessions.
 *
 * <p>Session state reaches the worker two ways: periodic status polls and webhook events
 * (see {@link #handleWebhook(JsonNode)}). Both feed the same {@link WasenderSession}, which
 * reports each transition once.
 */
@Component
@Slf4j
public class WasenderTransport implements WhatsAppTransport {

    private final WasenderSessionClient client;
    private final WasenderProperties properties;
    private final Executor transportExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Map<String, WasenderSession> sessions = new ConcurrentHashMap<>();

    public WasenderTransport(WasenderSessionClient client,
                             WasenderProperties properties,
                             @Qualifier("transportExecutor") Executor transportExecutor,
                             @Qualifier("reconnectScheduler") TaskScheduler scheduler,
                             Clock clock) {
        this.client = client;
        this.properties = properties;
        this.transportExecutor = transportExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<TransportSession> open(String channelId,
                                                    Optional<SessionCredentials> credentials,
                                                    TransportListener listener) {
        CompletableFuture<TransportSession> result = new CompletableFuture<>();
        try {
            transportExecutor.execute(() -> {
                if (result.isDone()) {
                    return;
                }
                try {
                    WasenderSession session = doOpen(channelId, credentials, listener);
                    if (!result.complete(session)) {
                        abandon(session, credentials.isEmpty());
                    }
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (TaskRejectedException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * A gateway session created for a handshake nobody waits for anymore has no local record,
     * so it is deleted at the gateway rather than just disconnected.
     */
    private void abandon(WasenderSession session, boolean createdHere) {
        if (createdHere) {
            log.info("Handshake no longer awaited, deleting new gateway session: channelId={}, sessionId={}",
                session.channelId(), session.providerSessionId());
            session.logout();
        } else {
            log.debug("Handshake no longer awaited, closing session: channelId={}", session.channelId());
            session.close();
        }
    }

    private WasenderSession doOpen(String channelId,
                                   Optional<SessionCredentials> stored,
                                   TransportListener listener) {
        if (!client.isConfigured()) {
            throw new ConfigurationException("wasender.api.personal-access-token is not configured");
        }
        SessionCredentials credentials = stored.orElseGet(() -> {
            WasenderSessionInfo created = client.createSession(channelId);
            SessionCredentials fresh = new SessionCredentials(channelId, created.id(), created.apiKey(),
                clock.millis());
            listener.onCredentialsUpdated(fresh);
            return fresh;
        });

        WasenderSession session = new WasenderSession(channelId, credentials, listener, client, this,
            transportExecutor, properties.getMaxFailedPolls());
        WasenderSession previous = sessions.put(credentials.providerSessionId(), session);
        if (previous != null && previous != session) {
            log.debug("Replacing local handle of gateway session: channelId={}, sessionId={}",
                channelId, credentials.providerSessionId());
        }
        try {
            ConnectResult connect = client.connect(credentials.providerSessionId());
            log.info("Gateway session connecting: channelId={}, sessionId={}, status={}",
                channelId, credentials.providerSessionId(), connect.status());
            session.applyStatus(connect.status(), connect.qrCode());
            session.startPolling(properties.getStatusPollInterval());
        } catch (RuntimeException e) {
            sessions.remove(credentials.providerSessionId(), session);
            throw e;
        }
        return session;
    }

    @Override
    public void discard(SessionCredentials credentials) {
        WasenderSession live = sessions.get(credentials.providerSessionId());
        if (live != null) {
            live.logout();
            return;
        }
        transportExecutor.execute(() -> {
            try {
                client.delete(credentials.providerSessionId());
            } catch (RuntimeException e) {
                log.warn("Failed to delete gateway session: channelId={}, sessionId={}, error={}",
                    credentials.channelId(), credentials.providerSessionId(), e.getMessage());
            }
        });
    }

    /**
     * Routes one webhook event to the session it belongs to.
     *
     * @return false when the event names no session this worker holds
     */
    public boolean handleWebhook(JsonNode payload) {
        String event = text(payload, "event");
        String sessionId = firstNonNull(text(payload, "sessionId"), text(payload, "session_id"),
            text(payload.path("data"), "sessionId"), text(payload.path("data"), "session_id"));
        if (event == null || sessionId == null) {
            log.debug("Webhook without event or session: event={}, sessionId={}", event, sessionId);
            return false;
        }
        WasenderSession session = sessions.get(sessionId);
        if (session == null) {
            log.debug("Webhook for unknown session: event={}, sessionId={}", event, sessionId);
            return false;
        }
        JsonNode data = payload.path("data");
        switch (event) {
            case "messages.upsert", "messages.received" -> session.deliverMessages(messages(data));
            case "messages.update", "message.sent" -> {
                for (JsonNode update : asList(data.has("messages") ? data.get("messages") : data)) {
                    applyReceipt(session, update);
                }
            }
            case "session.status" -> session.applyStatus(firstNonNull(text(data, "status"),
                text(payload, "status")), text(data, "qrCode"));
            case "qrcode.updated" -> session.applyQr(firstNonNull(text(data, "qrCode"), text(data, "qr")));
            default -> log.debug("Ignoring webhook event: event={}, channelId={}", event, session.channelId());
        }
        return true;
    }

    ScheduledFuture<?> schedulePoll(Runnable task, Duration interval) {
        return scheduler.scheduleWithFixedDelay(task, interval);
    }

    void unregister(WasenderSession session) {
        sessions.remove(session.providerSessionId(), session);
    }

    int activeSessions() {
        return sessions.size();
    }

    private void applyReceipt(WasenderSession session, JsonNode update) {
        JsonNode key = update.path("key");
        String messageId = firstNonNull(text(key, "id"), text(update, "id"), text(update, "msgId"));
        String jid = firstNonNull(text(key, "remoteJid"), text(update, "remoteJid"), text(update, "to"));
        JsonNode statusNode = update.path("update").has("status") ? update.path("update").get("status")
            : update.get("status");
        MessageStatus status = toMessageStatus(statusNode);
        if (messageId != null && status != null) {
            session.deliverStatus(jid, messageId, status);
        }
    }

    /**
     * Maps a receipt value to a message status. WhatsApp acks are numeric
     * (0 error, 1 pending, 2 server, 3 delivered, 4 read, 5 played).
     */
    static MessageStatus toMessageStatus(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isNumber() || value.asText().matches("\\d+")) {
            return switch (value.asInt()) {
                case 0 -> MessageStatus.FAILED;
                case 1 -> MessageStatus.PENDING;
                case 2 -> MessageStatus.SENT;
                case 3 -> MessageStatus.DELIVERED;
                case 4, 5 -> MessageStatus.READ;
                default -> null;
            };
        }
        return switch (value.asText().trim().toLowerCase()) {
            case "error", "failed" -> MessageStatus.FAILED;
            case "pending" -> MessageStatus.PENDING;
            case "sent", "server_ack" -> MessageStatus.SENT;
            case "delivered", "delivery_ack" -> MessageStatus.DELIVERED;
            case "read", "played" -> MessageStatus.READ;
            default -> null;
        };
    }

    private static List<JsonNode> messages(JsonNode data) {
        if (data.has("messages")) {
            return asList(data.get("messages"));
        }
        return asList(data);
    }

    private static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> list = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return list;
        }
        if (node.isArray()) {
            node.forEach(list::add);
        } else if (node.isObject() && node.size() > 0) {
            list.add(node);
        }
        return list;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText();
        return value.isBlank() ? null : value;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
