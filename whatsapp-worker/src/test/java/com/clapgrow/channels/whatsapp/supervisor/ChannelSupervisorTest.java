package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.common.provider.ProviderErrorCategory;
import com.clapgrow.channels.common.retry.RetryPolicy;
import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import com.clapgrow.channels.whatsapp.exception.PreconditionFailedException;
import com.clapgrow.channels.whatsapp.exception.SessionLoggedOutException;
import com.clapgrow.channels.whatsapp.exception.TransportException;
import com.clapgrow.channels.whatsapp.ingress.MessageIngressService;
import com.clapgrow.channels.whatsapp.publisher.ChannelStatePublisher;
import com.clapgrow.channels.whatsapp.publisher.ChannelStateWriter;
import com.clapgrow.channels.whatsapp.qr.QrCodeRenderer;
import com.clapgrow.channels.whatsapp.repository.ChannelRepository;
import com.clapgrow.channels.whatsapp.store.StoreFailureClassifier;
import com.clapgrow.channels.whatsapp.store.StoreRetryPolicyResolver;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import com.clapgrow.channels.whatsapp.transport.CloseReason;
import com.clapgrow.channels.whatsapp.transport.SessionCredentials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives the supervisor with a hand-operated transport. Every executor runs inline, so each
 * call returns after the mailbox has drained.
 */
class ChannelSupervisorTest {

    private static final String CHANNEL_ID = "channel-1";
    private static final String SELF_JID = "5511999999999@s.whatsapp.net";
    private static final SessionCredentials CREDENTIALS =
        new SessionCredentials(CHANNEL_ID, "41276", "session-key", 1_700_000_000_000L);

    private final Map<String, ChannelEntity> channels = new HashMap<>();

    private FakeTransport transport;
    private InMemorySessionStore sessionStore;
    private MessageIngressService ingress;
    private TaskScheduler scheduler;
    private ChannelSupervisor supervisor;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        sessionStore = new InMemorySessionStore();
        ingress = mock(MessageIngressService.class);
        scheduler = mock(TaskScheduler.class);
        supervisor = newSupervisor(RetryPolicy.reconnect());
    }

    private ChannelSupervisor newSupervisor(RetryPolicy reconnect) {
        ChannelRepository channelRepository = mock(ChannelRepository.class);
        when(channelRepository.findById(anyString()))
            .thenAnswer(inv -> Optional.ofNullable(channels.get(inv.<String>getArgument(0))));
        when(channelRepository.save(any(ChannelEntity.class))).thenAnswer(inv -> {
            ChannelEntity channel = inv.getArgument(0);
            channels.put(channel.getId(), channel);
            return channel;
        });

        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        StoreWriteRetrier retrier = new StoreWriteRetrier(new StoreFailureClassifier(),
            new StoreRetryPolicyResolver(new RetryPolicy(true, 0, 0, 1.0, 2, 0.0)));
        ChannelStatePublisher publisher =
            new ChannelStatePublisher(new ChannelStateWriter(channelRepository, clock), retrier, Runnable::run);

        SupervisorDependencies deps = new SupervisorDependencies(transport, sessionStore, publisher, ingress,
            new QrCodeRenderer(200), new ReconnectPolicy(reconnect), scheduler, Runnable::run, Runnable::run,
            new WorkerProperties.Supervisor(), clock);
        return new ChannelSupervisor(CHANNEL_ID, deps);
    }

    private ChannelEntity stored() {
        return channels.get(CHANNEL_ID);
    }

    private FakeTransport.Attempt connect() {
        supervisor.requestQr().join();
        FakeTransport.Attempt attempt = transport.last();
        attempt.listener.onCredentialsUpdated(CREDENTIALS);
        attempt.complete();
        attempt.listener.onOpen(SELF_JID);
        assertEquals(ConnectionState.CONNECTED, supervisor.getState());
        return attempt;
    }

    private Runnable capturedReconnect() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, atLeastOnce()).schedule(task.capture(), any(Instant.class));
        return task.getValue();
    }

    @Test
    void testRequestQr_WhileAttemptPending_StartsNoSecondAttempt() {
        // Act
        ChannelSnapshot first = supervisor.requestQr().join();
        ChannelSnapshot second = supervisor.requestQr().join();

        // Assert
        assertEquals(1, transport.attempts.size());
        assertEquals(ConnectionState.CONNECTING, first.state());
        assertEquals(ConnectionState.CONNECTING, second.state());
        assertTrue(transport.last().credentials.isEmpty());
        assertEquals(ChannelStatus.CONNECTING, stored().getStatus());
    }

    @Test
    void testPairing_QrThenOpen_PublishesQrAndThenConnected() {
        // Arrange
        supervisor.requestQr().join();
        FakeTransport.Attempt attempt = transport.last();

        // Act
        attempt.listener.onCredentialsUpdated(CREDENTIALS);
        attempt.listener.onQr("2@pairing-payload");

        // Assert
        assertEquals(Optional.of(CREDENTIALS), sessionStore.load(CHANNEL_ID));
        assertEquals(ConnectionState.AWAITING_SCAN, supervisor.getState());
        assertEquals(ChannelStatus.QR, stored().getStatus());
        assertEquals("2@pairing-payload", stored().getQr());
        assertTrue(stored().getQrDataUrl().startsWith("data:image/png;base64,"));
        assertNotNull(stored().getLastQrAt());

        // Act
        attempt.complete();
        attempt.listener.onOpen(SELF_JID);

        // Assert
        ChannelSnapshot snapshot = supervisor.snapshotAsync().join();
        assertEquals(ConnectionState.CONNECTED, snapshot.state());
        assertEquals("+5511999999999", snapshot.phoneE164());
        assertNull(snapshot.qr());
        ChannelEntity channel = stored();
        assertEquals(ChannelStatus.CONNECTED, channel.getStatus());
        assertEquals("+5511999999999", channel.getPhoneE164());
        assertTrue(channel.isLinked());
        assertNull(channel.getQr());
        assertNull(channel.getQrDataUrl());
        assertNotNull(channel.getConnectedAt());
        assertNull(channel.getLastErrorCode());
    }

    @Test
    void testRequestQr_WhenConnected_FailsAlreadyConnected() {
        // Arrange
        connect();

        // Act
        CompletableFuture<ChannelSnapshot> result = supervisor.requestQr();

        // Assert
        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        PreconditionFailedException cause = assertInstanceOf(PreconditionFailedException.class, e.getCause());
        assertEquals(PreconditionFailedException.Reason.ALREADY_CONNECTED, cause.getReason());
        assertEquals(1, transport.attempts.size());
    }

    @Test
    void testClose_Replaced_StopsWithoutReconnecting() {
        // Arrange
        FakeTransport.Attempt attempt = connect();

        // Act
        attempt.listener.onClose(CloseReason.REPLACED, "Session was opened by another client");

        // Assert
        assertEquals(ConnectionState.LOGGED_OUT, supervisor.getState());
        assertEquals(ChannelStatus.DISCONNECTED, stored().getStatus());
        assertEquals("REPLACED", stored().getLastErrorCode());
        assertFalse(stored().isLinked());
        assertTrue(attempt.session.closed);
        assertTrue(sessionStore.load(CHANNEL_ID).isEmpty());
        assertEquals(List.of(CREDENTIALS), transport.discarded);
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        assertEquals(1, transport.attempts.size());
    }

    @Test
    void testRequestQr_AfterReplaced_StartsNewPairing() {
        // Arrange
        FakeTransport.Attempt replaced = connect();
        replaced.listener.onClose(CloseReason.REPLACED, "Session was opened by another client");

        // Act
        ChannelSnapshot snapshot = supervisor.requestQr().join();

        // Assert
        assertEquals(ConnectionState.CONNECTING, snapshot.state());
        assertEquals(2, transport.attempts.size());
        assertTrue(transport.last().credentials.isEmpty());
    }

    @Test
    void testClose_ConnectionLost_ReconnectsWithStoredCredentials() {
        // Arrange
        FakeTransport.Attempt attempt = connect();

        // Act
        attempt.listener.onClose(CloseReason.CONNECTION_LOST, "socket closed");

        // Assert
        assertEquals(ConnectionState.CONNECTING, supervisor.getState());
        assertEquals(ChannelStatus.CONNECTING, stored().getStatus());
        assertEquals("CONNECTION_LOST", stored().getLastErrorCode());
        assertEquals(1, transport.attempts.size());

        // Act
        capturedReconnect().run();

        // Assert
        assertEquals(2, transport.attempts.size());
        assertEquals(Optional.of(CREDENTIALS), transport.last().credentials);

        // Act
        transport.last().complete();
        transport.last().listener.onOpen(SELF_JID);

        // Assert
        assertEquals(ConnectionState.CONNECTED, supervisor.getState());
        assertNull(stored().getLastErrorCode());
    }

    @Test
    void testClose_LoggedOut_DeletesCredentials() {
        // Arrange
        FakeTransport.Attempt attempt = connect();

        // Act
        attempt.listener.onClose(CloseReason.LOGGED_OUT, "Device was logged out from the phone");

        // Assert
        assertEquals(ConnectionState.LOGGED_OUT, supervisor.getState());
        assertTrue(sessionStore.load(CHANNEL_ID).isEmpty());
        assertEquals("LOGGED_OUT", stored().getLastErrorCode());
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void testClose_FromSupersededAttempt_IsIgnored() {
        // Arrange
        FakeTransport.Attempt first = connect();
        first.listener.onClose(CloseReason.CONNECTION_LOST, "socket closed");
        capturedReconnect().run();
        FakeTransport.Attempt second = transport.last();
        second.complete();
        second.listener.onOpen(SELF_JID);

        // Act
        first.listener.onClose(CloseReason.LOGGED_OUT, "stale");

        // Assert
        assertEquals(ConnectionState.CONNECTED, supervisor.getState());
        assertTrue(sessionStore.load(CHANNEL_ID).isPresent());
    }

    @Test
    void testResetSession_DuringPendingHandshake_CancelsAttemptAndIgnoresLateEvents() {
        // Arrange
        supervisor.requestQr().join();
        FakeTransport.Attempt attempt = transport.last();
        attempt.listener.onCredentialsUpdated(CREDENTIALS);
        attempt.listener.onQr("2@pairing-payload");

        // Act
        ChannelSnapshot snapshot = supervisor.resetSession().join();

        // Assert
        assertEquals(ConnectionState.IDLE, snapshot.state());
        assertNull(snapshot.qr());
        assertNull(snapshot.phoneE164());
        assertTrue(attempt.future.isCancelled());
        assertTrue(sessionStore.load(CHANNEL_ID).isEmpty());
        assertEquals(1, transport.discarded.size());
        assertEquals(ChannelStatus.DISCONNECTED, stored().getStatus());
        assertNull(stored().getQr());
        assertNull(stored().getLastQrAt());

        // Act
        attempt.complete();
        attempt.listener.onOpen(SELF_JID);

        // Assert
        assertTrue(attempt.session.closed);
        assertEquals(ConnectionState.IDLE, supervisor.getState());
        assertEquals(ChannelStatus.DISCONNECTED, stored().getStatus());
    }

    @Test
    void testResetSession_WhenConnected_LogsOutSession() {
        // Arrange
        FakeTransport.Attempt attempt = connect();

        // Act
        supervisor.resetSession().join();

        // Assert
        assertTrue(attempt.session.loggedOut);
        assertTrue(transport.discarded.isEmpty());
        assertTrue(sessionStore.load(CHANNEL_ID).isEmpty());
        assertEquals(ConnectionState.IDLE, supervisor.getState());
        assertNull(stored().getPhoneE164());
        assertNull(stored().getConnectedAt());
    }

    @Test
    void testDisconnect_ThenResumeWithRevokedCredentials_EndsLoggedOut() {
        // Arrange
        FakeTransport.Attempt first = connect();

        // Act
        supervisor.disconnect().join();

        // Assert
        assertTrue(first.session.closed);
        assertFalse(first.session.loggedOut);
        assertEquals(ConnectionState.IDLE, supervisor.getState());
        assertEquals(ChannelStatus.DISCONNECTED, stored().getStatus());
        assertTrue(sessionStore.load(CHANNEL_ID).isPresent());

        // Act
        supervisor.requestQr().join();
        FakeTransport.Attempt second = transport.last();
        second.future.completeExceptionally(new SessionLoggedOutException("Device was unlinked"));

        // Assert
        assertEquals(Optional.of(CREDENTIALS), second.credentials);
        assertEquals(ConnectionState.LOGGED_OUT, supervisor.getState());
        assertEquals(ChannelStatus.DISCONNECTED, stored().getStatus());
        assertEquals("LOGGED_OUT", stored().getLastErrorCode());
        assertTrue(sessionStore.load(CHANNEL_ID).isEmpty());
    }

    @Test
    void testDisconnect_WhenIdle_IsNoOp() {
        // Act
        ChannelSnapshot snapshot = supervisor.disconnect().join();

        // Assert
        assertEquals(ConnectionState.IDLE, snapshot.state());
        assertTrue(transport.attempts.isEmpty());
        assertTrue(channels.isEmpty());
    }

    @Test
    void testReconnect_AttemptsExhausted_EndsInErrorAndRepairStartsAgain() {
        // Arrange
        supervisor = newSupervisor(new RetryPolicy(true, 1_000, 60_000, 2.0, 1, 0.0));
        FakeTransport.Attempt attempt = connect();
        attempt.listener.onClose(CloseReason.CONNECTION_LOST, "socket closed");
        capturedReconnect().run();

        // Act
        transport.last().future.completeExceptionally(new TransportException("gateway down",
            CloseReason.CONNECTION_CLOSED, ProviderErrorCategory.TEMPORARY));

        // Assert
        assertEquals(ConnectionState.ERROR, supervisor.getState());
        assertEquals(ChannelStatus.ERROR, stored().getStatus());
        assertEquals("MAX_RECONNECT_ATTEMPTS", stored().getLastErrorCode());
        assertEquals(2, transport.attempts.size());

        // Act
        ChannelSnapshot repaired = supervisor.repair().join();

        // Assert
        assertEquals(ConnectionState.CONNECTING, repaired.state());
        assertNull(repaired.lastError());
        assertEquals(3, transport.attempts.size());
        assertNull(stored().getLastErrorCode());
    }

    @Test
    void testRepair_WhileConnected_FailsNotInError() {
        // Arrange
        connect();

        // Act
        ExecutionException e = assertThrows(ExecutionException.class, () -> supervisor.repair().get());

        // Assert
        PreconditionFailedException cause = assertInstanceOf(PreconditionFailedException.class, e.getCause());
        assertEquals(PreconditionFailedException.Reason.NOT_IN_ERROR, cause.getReason());
    }

    @Test
    void testSend_NotConnected_FailsNotConnected() {
        // Act
        ExecutionException e = assertThrows(ExecutionException.class,
            () -> supervisor.send(SELF_JID, "hello").get());

        // Assert
        PreconditionFailedException cause = assertInstanceOf(PreconditionFailedException.class, e.getCause());
        assertEquals(PreconditionFailedException.Reason.NOT_CONNECTED, cause.getReason());
        verifyNoInteractions(ingress);
    }

    @Test
    void testSend_Connected_ReturnsMessageIdAndRecordsOutbound() {
        // Arrange
        FakeTransport.Attempt attempt = connect();

        // Act
        String messageId = supervisor.send("5511888888888@s.whatsapp.net", "hello").join();

        // Assert
        assertEquals("wamid-1", messageId);
        assertEquals(1, attempt.session.sent.size());
        verify(ingress).recordOutbound(eq(CHANNEL_ID), eq("5511888888888@s.whatsapp.net"), eq("wamid-1"),
            eq("hello"), anyLong());
    }

    @Test
    void testShutdown_WhenConnected_ClosesSessionAndKeepsCredentials() {
        // Arrange
        FakeTransport.Attempt attempt = connect();

        // Act
        supervisor.shutdown().join();

        // Assert
        assertTrue(attempt.session.closed);
        assertFalse(attempt.session.loggedOut);
        assertTrue(sessionStore.load(CHANNEL_ID).isPresent());
        assertEquals(ChannelStatus.DISCONNECTED, stored().getStatus());
    }

    @Test
    void testMessages_FromTransport_GoToIngressWithSelfJid() {
        // Arrange
        FakeTransport.Attempt attempt = connect();

        // Act
        attempt.listener.onMessages(List.of());

        // Assert
        verify(ingress).ingestAll(CHANNEL_ID, List.of(), SELF_JID);
    }
}
