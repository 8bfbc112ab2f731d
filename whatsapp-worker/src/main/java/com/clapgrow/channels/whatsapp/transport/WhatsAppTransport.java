package com.clapgrow.channels.whatsapp.transport;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reaches the WhatsApp multi-device network for a channel.
 */
public interface WhatsAppTransport {

    /**
     * Starts a handshake. Without credentials a fresh pairing is started and reported through
     * {@link TransportListener#onCredentialsUpdated} and {@link TransportListener#onQr}.
     *
     * <p>If the returned future is cancelled or completed by the caller before the handshake
     * finishes, the transport closes the session it produced.
     */
    CompletableFuture<TransportSession> open(String channelId,
                                             Optional<SessionCredentials> credentials,
                                             TransportListener listener);

    /**
     * Best-effort removal of a session known only by its stored credentials.
     */
    void discard(SessionCredentials credentials);
}
