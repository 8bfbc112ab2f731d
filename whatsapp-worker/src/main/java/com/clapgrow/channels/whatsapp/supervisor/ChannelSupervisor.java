package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.whatsapp.concurrent.ChannelMailbox;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import com.clapgrow.channels.whatsapp.enums.MessageStatus;
import com.clapgrow.channels.whatsapp.exception.ConfigurationException;
import com.clapgrow.channels.whatsapp.exception.PreconditionFailedException;
import com.clapgrow.channels.whatsapp.exception.TransportException;
import com.clapgrow.channels.whatsapp.ingress.Jids;
import com.clapgrow.channels.whatsapp.publisher.ChannelError;
import com.clapgrow.channels.whatsapp.publisher.ChannelUpdate;
import com.clapgrow.channels.whatsapp.transport.CloseReason;
import com.clapgrow.channels.whatsapp.transport.SessionCredentials;
import com.clapgrow.channels.whatsapp.transport.TransportListener;
import com.clapgrow.channels.whatsapp.transport.TransportSession;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the transport session of one channel.
 *
 * <p>Every state change runs in the channel's {@link ChannelMailbox}, so at most one session
 * attempt exists per channel. Each attempt carries an epoch; disconnect, reset and transport
 * closure bump it, and events or handshake results from an older epoch are discarded (a late
 * session is closed).
 *
 * <p>Channel records are written only through the state publisher. Publish failures are logged
 * by the publisher and never change the connection state.
 */
@Slf4j
public class ChannelSupervisor {

    private final String channelId;
    private final SupervisorDependencies deps;
    private final ChannelMailbox mailbox;

    // Confined to the mailbox
    private ConnectionState state = ConnectionState.IDLE;
    private long epoch;
    private CompletableFuture<TransportSession> pendingOpen;
    private ScheduledFuture<?> pendingReconnect;
    private boolean reconnectScheduled;
    private TransportSession session;
    private int reconnectAttempts;
    private String qr;
    private String qrDataUrl;
    private String phoneE164;
    private ChannelError lastError;

    private volatile ConnectionState observedState = ConnectionState.IDLE;
    private volatile String selfJid;

    public ChannelSupervisor(String channelId, SupervisorDependencies deps) {
        this.channelId = channelId;
        this.deps = deps;
        this.mailbox = new ChannelMailbox("supervisor:" + channelId, deps.getChannelExecutor());
    }

    public String getChannelId() {
        return channelId;
    }

    /**
     * Last state set by the mailbox; may lag behind operations still queued.
     */
    public ConnectionState getState() {
        return observedState;
    }

    /**
     * Starts a pairing or resumes the stored session. While an attempt is already pending
     * nothing new is started and the current QR is returned.
     */
    public CompletableFuture<ChannelSnapshot> requestQr() {
        return mailbox.call(() -> {
            switch (state) {
                case CONNECTED -> throw PreconditionFailedException.alreadyConnected(channelId);
                case CONNECTING, AWAITING_SCAN -> {
                    if (reconnectScheduled) {
                        log.info("QR requested while waiting to reconnect, connecting now: channelId={}", channelId);
                        startAttempt(true);
                    } else {
                        log.debug("Connection attempt already in progress: channelId={}, state={}", channelId, state);
                    }
                }
                default -> {
                    reconnectAttempts = 0;
                    startAttempt(true);
                }
            }
            return snapshot();
        });
    }

    /**
     * Reconnects a channel with stored credentials after a worker restart.
     */
    public CompletableFuture<ChannelSnapshot> resume() {
        return mailbox.call(() -> {
            if (state == ConnectionState.IDLE) {
                reconnectAttempts = 0;
                startAttempt(false);
            }
            return snapshot();
        });
    }

    /**
     * Tears the session down and keeps the credentials. A no-op when nothing is connected.
     */
    public CompletableFuture<ChannelSnapshot> disconnect() {
        return mailbox.call(() -> {
            if (state == ConnectionState.IDLE || state == ConnectionState.LOGGED_OUT) {
                log.debug("Disconnect ignored, channel not connected: channelId={}, state={}", channelId, state);
                return snapshot();
            }
            log.info("Disconnecting channel: channelId={}, state={}", channelId, state);
            teardown(false);
            transition(ConnectionState.IDLE);
            publish(offline(ChannelStatus.DISCONNECTED));
            return snapshot();
        });
    }

    /**
     * Logs out, deletes stored credentials and returns to IDLE. Every step is best effort,
     * so reset succeeds from any state.
     */
    public CompletableFuture<ChannelSnapshot> resetSession() {
        return mailbox.call(() -> {
            log.info("Resetting session: channelId={}, state={}", channelId, state);
            transition(ConnectionState.CLOSING);
            boolean hadSession = session != null;
            Optional<SessionCredentials> stored = loadCredentials();
            teardown(true);
            if (!hadSession) {
                stored.ifPresent(this::discardQuietly);
            }
            deleteCredentials();
            reconnectAttempts = 0;
            lastError = null;
            selfJid = null;
            transition(ConnectionState.IDLE);
            publish(offline(ChannelStatus.DISCONNECTED)
                .clearLastError()
                .lastQrAt(null)
                .connectedAt(null));
            return snapshot();
        });
    }

    /**
     * Starts a fresh attempt with the stored credentials after the channel ended in ERROR.
     */
    public CompletableFuture<ChannelSnapshot> repair() {
        return mailbox.call(() -> {
            if (state.isLive()) {
                throw PreconditionFailedException.notInError(channelId, state.toChannelStatus());
            }
            log.info("Repairing channel: channelId={}, state={}", channelId, state);
            reconnectAttempts = 0;
            startAttempt(true);
            return snapshot();
        });
    }

    /**
     * Sends a text message. The CONNECTED check runs in the mailbox; the network call runs
     * outside it so other operations on the channel are not held up by a slow send.
     *
     * @return the WhatsApp message id
     */
    public CompletableFuture<String> send(String to, String text) {
        long timeoutMs = deps.getSettings().getSendTimeout().toMillis();
        return mailbox.call(() -> {
            if (state != ConnectionState.CONNECTED || session == null) {
                throw PreconditionFailedException.notConnected(channelId);
            }
            return session;
        }).thenApplyAsync(live -> {
            String messageId = live.sendText(to, text);
            log.info("Message sent: channelId={}, to={}, messageId={}", channelId, to, messageId);
            deps.getIngress().recordOutbound(channelId, to, messageId, text, deps.getClock().millis());
            return messageId;
        }, deps.getTransportExecutor()).orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Closes the transport on worker shutdown. Credentials are kept so the channel is restored
     * on the next start.
     */
    public CompletableFuture<Void> shutdown() {
        return mailbox.call(() -> {
            boolean wasLive = state.isLive();
            teardown(false);
            if (wasLive) {
                transition(ConnectionState.IDLE);
                publish(offline(ChannelStatus.DISCONNECTED));
            }
            return null;
        });
    }

    public CompletableFuture<ChannelSnapshot> snapshotAsync() {
        return mailbox.call(this::snapshot);
    }

    private void startAttempt(boolean clearError) {
        cancelReconnectTimer();
        cancelPendingOpen();
        closeSessionQuietly(false);
        long attemptEpoch = ++epoch;
        qr = null;
        qrDataUrl = null;
        phoneE164 = null;
        if (clearError) {
            lastError = null;
        }
        transition(ConnectionState.CONNECTING);
        ChannelUpdate.Builder update = offline(ChannelStatus.CONNECTING);
        if (clearError) {
            update.clearLastError();
        }
        publish(update);

        Optional<SessionCredentials> credentials = loadCredentials();
        log.info("Starting connection attempt: channelId={}, epoch={}, resume={}, attempt={}",
            channelId, attemptEpoch, credentials.isPresent(), reconnectAttempts);

        CompletableFuture<TransportSession> open;
        try {
            open = deps.getTransport().open(channelId, credentials, new AttemptListener(attemptEpoch));
        } catch (RuntimeException e) {
            open = CompletableFuture.failedFuture(e);
        }
        pendingOpen = open;
        open.orTimeout(deps.getSettings().getHandshakeTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((opened, error) ->
                mailbox.execute(() -> onHandshakeCompleted(attemptEpoch, opened, error)));
    }

    private void onHandshakeCompleted(long attemptEpoch, TransportSession opened, Throwable error) {
        if (attemptEpoch != epoch) {
            if (opened != null) {
                log.debug("Closing session of superseded attempt: channelId={}, epoch={}", channelId, attemptEpoch);
                closeQuietly(opened, false);
            }
            return;
        }
        pendingOpen = null;
        if (error == null) {
            session = opened;
            log.info("Transport session open: channelId={}, state={}", channelId, state);
            return;
        }
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            return;
        }
        if (cause instanceof ConfigurationException) {
            log.error("Cannot connect, configuration missing: channelId={}, error={}", channelId, cause.getMessage());
            lastError = ChannelError.of("CONFIGURATION_ERROR", cause.getMessage());
            transition(ConnectionState.ERROR);
            publish(offline(ChannelStatus.ERROR).lastError(lastError));
            return;
        }
        if (cause instanceof TimeoutException) {
            onTransportClosed(CloseReason.TIMED_OUT, "Handshake timed out after "
                + deps.getSettings().getHandshakeTimeout().toSeconds() + "s");
        } else if (cause instanceof TransportException te) {
            CloseReason reason = te.getCloseReason() != null ? te.getCloseReason() : CloseReason.UNKNOWN;
            onTransportClosed(reason, te.getMessage());
        } else {
            log.error("Handshake failed unexpectedly: channelId={}", channelId, cause);
            onTransportClosed(CloseReason.UNKNOWN, cause.getMessage());
        }
    }

    private void onQr(long attemptEpoch, String payload) {
        if (attemptEpoch != epoch) {
            return;
        }
        if (state == ConnectionState.CONNECTED) {
            log.warn("QR received while connected, ignoring: channelId={}", channelId);
            return;
        }
        if (payload == null || payload.equals(qr)) {
            return;
        }
        qr = payload;
        try {
            qrDataUrl = deps.getQrRenderer().toDataUrl(payload);
        } catch (RuntimeException e) {
            log.error("QR rendering failed, publishing raw payload only: channelId={}, error={}",
                channelId, e.getMessage());
            qrDataUrl = null;
        }
        lastError = null;
        transition(ConnectionState.AWAITING_SCAN);
        log.info("QR issued, waiting for scan: channelId={}", channelId);
        publish(ChannelUpdate.builder()
            .status(ChannelStatus.QR)
            .qr(qr, qrDataUrl)
            .phoneE164(null)
            .linked(false)
            .lastQrAt(now())
            .clearLastError());
    }

    private void onOpen(long attemptEpoch, String jid) {
        if (attemptEpoch != epoch) {
            return;
        }
        selfJid = jid;
        phoneE164 = Jids.toE164(jid);
        qr = null;
        qrDataUrl = null;
        lastError = null;
        reconnectAttempts = 0;
        transition(ConnectionState.CONNECTED);
        log.info("Channel connected: channelId={}, phone={}", channelId, phoneE164);
        LocalDateTime now = now();
        publish(ChannelUpdate.builder()
            .status(ChannelStatus.CONNECTED)
            .clearQr()
            .phoneE164(phoneE164)
            .linked(true)
            .connectedAt(now)
            .lastSeenAt(now)
            .clearLastError());
    }

    private void onClose(long attemptEpoch, CloseReason reason, String detail) {
        if (attemptEpoch != epoch) {
            log.debug("Ignoring close of superseded session: channelId={}, reason={}", channelId, reason);
            return;
        }
        onTransportClosed(reason, detail);
    }

    private void onCredentialsUpdated(long attemptEpoch, SessionCredentials credentials) {
        if (attemptEpoch != epoch) {
            log.debug("Ignoring credentials of superseded attempt: channelId={}", channelId);
            return;
        }
        try {
            deps.getSessionStore().save(credentials);
        } catch (RuntimeException e) {
            log.error("Failed to persist credentials, next reconnect will need a new pairing: channelId={}, error={}",
                channelId, e.getMessage());
        }
    }

    private void onTransportClosed(CloseReason reason, String detail) {
        epoch++;
        cancelPendingOpen();
        closeSessionQuietly(false);
        qr = null;
        qrDataUrl = null;
        phoneE164 = null;

        ReconnectPolicy.Decision decision = deps.getReconnectPolicy().decide(reason);
        if (decision.discardCredentials()) {
            loadCredentials().ifPresent(this::discardQuietly);
            deleteCredentials();
        }
        String description = detail == null || detail.isBlank() ? reason.name() : detail;

        if (!decision.reconnect()) {
            log.warn("Connection closed, not reconnecting: channelId={}, reason={}, detail={}",
                channelId, reason, description);
            reconnectAttempts = 0;
            lastError = ChannelError.of(reason.name(), description);
            transition(ConnectionState.LOGGED_OUT);
            publish(offline(ChannelStatus.DISCONNECTED).lastError(lastError));
            return;
        }

        reconnectAttempts++;
        if (!deps.getReconnectPolicy().allowsAttempt(reconnectAttempts)) {
            log.error("Max reconnect attempts reached: channelId={}, attempts={}, lastReason={}",
                channelId, reconnectAttempts - 1, reason);
            lastError = ChannelError.of("MAX_RECONNECT_ATTEMPTS",
                "Max reconnect attempts reached, last close: " + description);
            transition(ConnectionState.ERROR);
            publish(offline(ChannelStatus.ERROR).lastError(lastError));
            return;
        }

        long delayMs = decision.immediate()
            ? 0
            : deps.getReconnectPolicy().delayMs(reconnectAttempts, ThreadLocalRandom.current().nextDouble());
        log.warn("Connection closed, reconnecting: channelId={}, reason={}, attempt={}, delayMs={}",
            channelId, reason, reconnectAttempts, delayMs);
        lastError = ChannelError.of(reason.name(),
            description + " (reconnect attempt " + reconnectAttempts + " in " + delayMs + "ms)");
        transition(ConnectionState.CONNECTING);
        publish(offline(ChannelStatus.CONNECTING).lastError(lastError));
        scheduleReconnect(delayMs);
    }

    private void scheduleReconnect(long delayMs) {
        long scheduledEpoch = epoch;
        reconnectScheduled = true;
        pendingReconnect = deps.getScheduler().schedule(
            () -> mailbox.execute(() -> {
                if (scheduledEpoch != epoch || !reconnectScheduled) {
                    return;
                }
                reconnectScheduled = false;
                pendingReconnect = null;
                startAttempt(false);
            }),
            deps.getClock().instant().plusMillis(delayMs));
    }

    private void teardown(boolean logout) {
        epoch++;
        cancelReconnectTimer();
        cancelPendingOpen();
        closeSessionQuietly(logout);
        qr = null;
        qrDataUrl = null;
        phoneE164 = null;
    }

    private void cancelReconnectTimer() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
        }
        pendingReconnect = null;
        reconnectScheduled = false;
    }

    private void cancelPendingOpen() {
        if (pendingOpen != null && !pendingOpen.isDone()) {
            pendingOpen.cancel(false);
        }
        pendingOpen = null;
    }

    private void closeSessionQuietly(boolean logout) {
        if (session != null) {
            TransportSession closing = session;
            session = null;
            closeQuietly(closing, logout);
        }
    }

    private void closeQuietly(TransportSession target, boolean logout) {
        try {
            if (logout) {
                target.logout();
            } else {
                target.close();
            }
        } catch (RuntimeException e) {
            log.warn("Transport teardown failed: channelId={}, logout={}, error={}", channelId, logout, e.getMessage());
        }
    }

    private Optional<SessionCredentials> loadCredentials() {
        try {
            return deps.getSessionStore().load(channelId);
        } catch (RuntimeException e) {
            log.error("Stored credentials unreadable, starting a new pairing: channelId={}, error={}",
                channelId, e.getMessage());
            return Optional.empty();
        }
    }

    private void deleteCredentials() {
        try {
            deps.getSessionStore().delete(channelId);
        } catch (RuntimeException e) {
            log.error("Failed to delete stored credentials: channelId={}, error={}", channelId, e.getMessage());
        }
    }

    private void discardQuietly(SessionCredentials credentials) {
        try {
            deps.getTransport().discard(credentials);
        } catch (RuntimeException e) {
            log.warn("Failed to discard remote session: channelId={}, error={}", channelId, e.getMessage());
        }
    }

    private void transition(ConnectionState next) {
        if (state != next) {
            log.debug("State change: channelId={}, {} -> {}", channelId, state, next);
        }
        state = next;
        observedState = next;
    }

    /**
     * Base update for every status without a QR or a connected phone.
     */
    private ChannelUpdate.Builder offline(ChannelStatus status) {
        return ChannelUpdate.builder()
            .status(status)
            .clearQr()
            .phoneE164(null)
            .linked(false);
    }

    private void publish(ChannelUpdate.Builder update) {
        deps.getPublisher().publish(channelId, update.build());
    }

    private ChannelSnapshot snapshot() {
        return new ChannelSnapshot(channelId, state, state.toChannelStatus(), qr, qrDataUrl, phoneE164, lastError);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(deps.getClock()).truncatedTo(ChronoUnit.MILLIS);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Listener handed to one connection attempt. State events are routed into the mailbox and
     * tagged with the attempt's epoch; message events go straight to ingress.
     */
    private final class AttemptListener implements TransportListener {

        private final long attemptEpoch;

        private AttemptListener(long attemptEpoch) {
            this.attemptEpoch = attemptEpoch;
        }

        @Override
        public void onQr(String payload) {
            mailbox.execute(() -> ChannelSupervisor.this.onQr(attemptEpoch, payload));
        }

        @Override
        public void onOpen(String jid) {
            mailbox.execute(() -> ChannelSupervisor.this.onOpen(attemptEpoch, jid));
        }

        @Override
        public void onClose(CloseReason reason, String detail) {
            mailbox.execute(() -> ChannelSupervisor.this.onClose(attemptEpoch, reason, detail));
        }

        @Override
        public void onCredentialsUpdated(SessionCredentials credentials) {
            mailbox.execute(() -> ChannelSupervisor.this.onCredentialsUpdated(attemptEpoch, credentials));
        }

        @Override
        public void onMessages(List<JsonNode> messages) {
            deps.getIngress().ingestAll(channelId, messages, selfJid);
        }

        @Override
        public void onMessageStatus(String jid, String messageId, MessageStatus status) {
            deps.getIngress().updateStatus(channelId, jid, messageId, status);
        }
    }
}
