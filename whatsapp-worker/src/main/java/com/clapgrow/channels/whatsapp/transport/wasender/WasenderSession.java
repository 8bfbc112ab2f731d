package com.clapgrow.channels.whatsapp.transport.wasender;

import com.clapgrow.channels.common.provider.ProviderErrorCategory;
import com.clapgrow.channels.whatsapp.enums.MessageStatus;
import com.clapgrow.channels.whatsapp.exception.TransportException;
import com.clapgrow.channels.whatsapp.ingress.Jids;
import com.clapgrow.channels.whatsapp.transport.CloseReason;
import com.clapgrow.channels.whatsapp.transport.SessionCredentials;
import com.clapgrow.channels.whatsapp.transport.TransportListener;
import com.clapgrow.channels.whatsapp.transport.TransportSession;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * One gateway session. Turns status values (from polls, connect responses and webhooks)
 * into listener events, reporting each transition once.
 */
@Slf4j
class WasenderSession implements TransportSession {

    private final String channelId;
    private final SessionCredentials credentials;
    private final TransportListener listener;
    private final WasenderSessionClient client;
    private final WasenderTransport owner;
    private final Executor executor;
    private final int maxFailedPolls;

    private boolean connected;
    private boolean closed;
    private String lastQr;
    private int failedPolls;
    private ScheduledFuture<?> poller;

    WasenderSession(String channelId,
                    SessionCredentials credentials,
                    TransportListener listener,
                    WasenderSessionClient client,
                    WasenderTransport owner,
                    Executor executor,
                    int maxFailedPolls) {
        this.channelId = channelId;
        this.credentials = credentials;
        this.listener = listener;
        this.client = client;
        this.owner = owner;
        this.executor = executor;
        this.maxFailedPolls = maxFailedPolls;
    }

    String providerSessionId() {
        return credentials.providerSessionId();
    }

    String channelId() {
        return channelId;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    synchronized void startPolling(Duration interval) {
        if (closed || poller != null) {
            return;
        }
        poller = owner.schedulePoll(() -> executor.execute(this::poll), interval);
    }

    void poll() {
        if (isClosed()) {
            return;
        }
        String status;
        try {
            status = client.getStatus(credentials.sessionApiKey());
        } catch (TransportException e) {
            onPollFailure(e);
            return;
        }
        synchronized (this) {
            failedPolls = 0;
        }
        applyStatus(status, null);
    }

    /**
     * Applies a gateway status such as {@code connected}, {@code need_scan} or {@code logged_out}.
     */
    void applyStatus(String status, String qrCode) {
        if (status == null) {
            return;
        }
        switch (status.trim().toLowerCase()) {
            case "connected", "open" -> markConnected();
            case "need_scan", "qr", "qrcode" -> {
                synchronized (this) {
                    connected = false;
                }
                applyQr(qrCode != null ? qrCode : fetchQr());
            }
            case "connecting", "initializing", "pending" -> log.debug("Session still connecting: channelId={}", channelId);
            case "logged_out", "loggedout", "logout" ->
                terminate(CloseReason.LOGGED_OUT, "Device was logged out from the phone");
            case "expired", "invalid" -> terminate(CloseReason.BAD_SESSION, "Session is no longer valid at the gateway");
            case "replaced", "conflict" -> terminate(CloseReason.REPLACED, "Session was opened by another client");
            case "disconnected", "closed" -> terminate(CloseReason.CONNECTION_CLOSED, "Gateway reported the session disconnected");
            default -> log.debug("Ignoring unknown session status: channelId={}, status={}", channelId, status);
        }
    }

    void applyQr(String qr) {
        if (qr == null || qr.isBlank()) {
            return;
        }
        synchronized (this) {
            if (closed || qr.equals(lastQr)) {
                return;
            }
            lastQr = qr;
        }
        listener.onQr(qr);
    }

    void deliverMessages(List<JsonNode> messages) {
        if (!isClosed() && !messages.isEmpty()) {
            listener.onMessages(messages);
        }
    }

    void deliverStatus(String jid, String messageId, MessageStatus status) {
        if (!isClosed()) {
            listener.onMessageStatus(jid, messageId, status);
        }
    }

    @Override
    public String sendText(String to, String text) {
        if (isClosed()) {
            throw new TransportException("Session is closed", CloseReason.CONNECTION_CLOSED,
                ProviderErrorCategory.TEMPORARY);
        }
        return client.sendText(credentials.sessionApiKey(), toGatewayRecipient(to), text);
    }

    /**
     * The gateway addresses users by phone number and groups by JID.
     */
    static String toGatewayRecipient(String to) {
        String jid = Jids.fromRecipient(to);
        if (jid == null || Jids.isGroup(jid)) {
            return jid != null ? jid : to;
        }
        String e164 = Jids.toE164(jid);
        return e164 != null ? e164 : jid;
    }

    @Override
    public void close() {
        if (!markClosed()) {
            return;
        }
        executor.execute(() -> {
            try {
                client.disconnect(credentials.providerSessionId());
            } catch (RuntimeException e) {
                log.warn("Gateway disconnect failed: channelId={}, error={}", channelId, e.getMessage());
            }
        });
    }

    @Override
    public void logout() {
        if (!markClosed()) {
            return;
        }
        executor.execute(() -> {
            try {
                client.delete(credentials.providerSessionId());
            } catch (RuntimeException e) {
                log.warn("Gateway logout failed: channelId={}, error={}", channelId, e.getMessage());
            }
        });
    }

    /**
     * Ends the session because the gateway reported it gone. Reported to the listener once.
     */
    void terminate(CloseReason reason, String detail) {
        if (markClosed()) {
            log.info("Session closed by gateway: channelId={}, reason={}", channelId, reason);
            listener.onClose(reason, detail);
        }
    }

    private void markConnected() {
        synchronized (this) {
            if (closed || connected) {
                return;
            }
            connected = true;
            lastQr = null;
        }
        listener.onOpen(resolveSelfJid());
    }

    private String resolveSelfJid() {
        try {
            WasenderSessionInfo details = client.getSessionDetails(credentials.providerSessionId());
            return Jids.fromRecipient(details.phoneNumber());
        } catch (RuntimeException e) {
            log.warn("Could not resolve own number: channelId={}, error={}", channelId, e.getMessage());
            return null;
        }
    }

    private String fetchQr() {
        try {
            return client.getQrCode(credentials.providerSessionId());
        } catch (RuntimeException e) {
            log.warn("Could not fetch QR code: channelId={}, error={}", channelId, e.getMessage());
            return null;
        }
    }

    private void onPollFailure(TransportException e) {
        if (e.getCategory() == ProviderErrorCategory.AUTH || e.getCloseReason() == CloseReason.LOGGED_OUT
                || e.getCloseReason() == CloseReason.BAD_SESSION) {
            terminate(e.getCloseReason() != null ? e.getCloseReason() : CloseReason.BAD_SESSION, e.getMessage());
            return;
        }
        int failures;
        synchronized (this) {
            failures = ++failedPolls;
        }
        log.warn("Status poll failed: channelId={}, consecutiveFailures={}, error={}",
            channelId, failures, e.getMessage());
        if (failures >= maxFailedPolls) {
            terminate(CloseReason.CONNECTION_LOST, "Gateway unreachable after " + failures + " status checks");
        }
    }

    private boolean markClosed() {
        synchronized (this) {
            if (closed) {
                return false;
            }
            closed = true;
            if (poller != null) {
                poller.cancel(false);
                poller = null;
            }
        }
        owner.unregister(this);
        return true;
    }
}
