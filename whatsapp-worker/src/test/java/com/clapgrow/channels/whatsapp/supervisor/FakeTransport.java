package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.whatsapp.transport.SessionCredentials;
import com.clapgrow.channels.whatsapp.transport.TransportListener;
import com.clapgrow.channels.whatsapp.transport.TransportSession;
import com.clapgrow.channels.whatsapp.transport.WhatsAppTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory transport. Every {@link #open} is recorded as an {@link Attempt} the test drives by hand.
 */
class FakeTransport implements WhatsAppTransport {

    final List<Attempt> attempts = new ArrayList<>();
    final List<SessionCredentials> discarded = new ArrayList<>();

    @Override
    public CompletableFuture<TransportSession> open(String channelId,
                                                    Optional<SessionCredentials> credentials,
                                                    TransportListener listener) {
        Attempt attempt = new Attempt(channelId, credentials, listener);
        attempts.add(attempt);
        return attempt.future;
    }

    @Override
    public void discard(SessionCredentials credentials) {
        discarded.add(credentials);
    }

    Attempt last() {
        return attempts.get(attempts.size() - 1);
    }

    static final class Attempt {
        final String channelId;
        final Optional<SessionCredentials> credentials;
        final TransportListener listener;
        final CompletableFuture<TransportSession> future = new CompletableFuture<>();
        final FakeSession session = new FakeSession();

        Attempt(String channelId, Optional<SessionCredentials> credentials, TransportListener listener) {
            this.channelId = channelId;
            this.credentials = credentials;
            this.listener = listener;
        }

        /**
         * Completes the handshake the way a real transport does: a session nobody waits for is closed.
         */
        void complete() {
            if (!future.complete(session)) {
                session.close();
            }
        }
    }

    static final class FakeSession implements TransportSession {
        final List<String> sent = new ArrayList<>();
        boolean closed;
        boolean loggedOut;

        @Override
        public String sendText(String to, String text) {
            sent.add(to + ":" + text);
            return "wamid-" + sent.size();
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public void logout() {
            closed = true;
            loggedOut = true;
        }
    }
}
