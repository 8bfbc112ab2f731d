package com.clapgrow.channels.whatsapp.autoreply;

import com.clapgrow.channels.common.retry.RetryPolicy;
import com.clapgrow.channels.whatsapp.config.AutoReplyProperties;
import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import com.clapgrow.channels.whatsapp.entity.BotConfigEntity;
import com.clapgrow.channels.whatsapp.entity.MessageEntity;
import com.clapgrow.channels.whatsapp.entity.ProcessedInboundMessage;
import com.clapgrow.channels.whatsapp.exception.ResponderException;
import com.clapgrow.channels.whatsapp.ingress.InboundMessageEvent;
import com.clapgrow.channels.whatsapp.repository.MessageRepository;
import com.clapgrow.channels.whatsapp.repository.ProcessedInboundMessageRepository;
import com.clapgrow.channels.whatsapp.service.BotConfigService;
import com.clapgrow.channels.whatsapp.store.StoreFailureClassifier;
import com.clapgrow.channels.whatsapp.store.StoreRetryPolicyResolver;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import com.clapgrow.channels.whatsapp.supervisor.ChannelSupervisor;
import com.clapgrow.channels.whatsapp.supervisor.SupervisorRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutoReplyDispatcherTest {

    private static final String CHANNEL_ID = "channel-1";
    private static final String JID = "5511999999999@s.whatsapp.net";

    @Mock
    private BotConfigService botConfigService;

    @Mock
    private ProcessedInboundMessageRepository processedRepository;

    @Mock
    private MessageRepository messageRepository;

    @Mock
    private AutoReplyResponder responder;

    @Mock
    private SupervisorRegistry registry;

    @Mock
    private ChannelSupervisor supervisor;

    @Mock
    private Acknowledgment acknowledgment;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AutoReplyDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        StoreWriteRetrier retrier = new StoreWriteRetrier(new StoreFailureClassifier(),
            new StoreRetryPolicyResolver(new RetryPolicy(true, 0, 0, 1.0, 2, 0.0)));
        dispatcher = new AutoReplyDispatcher(botConfigService, processedRepository, messageRepository,
            new PromptBuilder(), responder, registry, retrier, new AutoReplyProperties(), new WorkerProperties(),
            objectMapper, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private static InboundMessageEvent event(String text) {
        return new InboundMessageEvent(CHANNEL_ID, JID, "M3", text, 3_000L, "Maria");
    }

    private static BotConfigEntity config(boolean enabled) {
        BotConfigEntity config = new BotConfigEntity(CHANNEL_ID);
        config.setEnabled(enabled);
        config.setProductDetails("Blue mug, $12.");
        return config;
    }

    private static MessageEntity stored(String id, boolean fromMe, String text, long timestamp) {
        MessageEntity message = new MessageEntity(CHANNEL_ID, JID, id);
        message.setFromMe(fromMe);
        message.setText(text);
        message.setTimestamp(timestamp);
        return message;
    }

    private void enabledAndNew() {
        when(botConfigService.find(CHANNEL_ID)).thenReturn(Optional.of(config(true)));
        when(processedRepository.existsById(new ProcessedInboundMessage.Key(CHANNEL_ID, "M3"))).thenReturn(false);
        when(messageRepository.findTop50ByChannelIdAndJidOrderByTimestampDesc(CHANNEL_ID, JID)).thenReturn(List.of(
            stored("M3", false, "How much?", 3_000L),
            stored("M2", true, "Hi! How can I help?", 2_000L),
            stored("M1", false, "Hello", 1_000L)));
    }

    @Test
    void testDispatch_Disabled_ResponderNeverCalled() {
        // Arrange
        when(botConfigService.find(CHANNEL_ID)).thenReturn(Optional.of(config(false)));

        // Act
        AutoReplyDispatcher.Outcome outcome = dispatcher.dispatch(event("How much?"));

        // Assert
        assertEquals(AutoReplyDispatcher.Outcome.DISABLED, outcome);
        verifyNoInteractions(responder, processedRepository, registry);
    }

    @Test
    void testDispatch_NoConfig_TreatedAsDisabled() {
        when(botConfigService.find(CHANNEL_ID)).thenReturn(Optional.empty());

        assertEquals(AutoReplyDispatcher.Outcome.DISABLED, dispatcher.dispatch(event("How much?")));
        verifyNoInteractions(responder);
    }

    @Test
    void testDispatch_NoText_Skipped() {
        assertEquals(AutoReplyDispatcher.Outcome.SKIPPED_NO_TEXT, dispatcher.dispatch(event(null)));
        verifyNoInteractions(botConfigService, responder);
    }

    @Test
    void testDispatch_AlreadyProcessed_Duplicate() {
        // Arrange
        when(botConfigService.find(CHANNEL_ID)).thenReturn(Optional.of(config(true)));
        when(processedRepository.existsById(new ProcessedInboundMessage.Key(CHANNEL_ID, "M3"))).thenReturn(true);

        // Act
        AutoReplyDispatcher.Outcome outcome = dispatcher.dispatch(event("How much?"));

        // Assert
        assertEquals(AutoReplyDispatcher.Outcome.DUPLICATE, outcome);
        verify(processedRepository, never()).save(any());
        verifyNoInteractions(responder);
    }

    @Test
    void testDispatch_Success_SendsReplyWithHistoryAndRecordsIt() {
        // Arrange
        enabledAndNew();
        when(responder.reply(any())).thenReturn(Optional.of("It is $12."));
        when(registry.find(CHANNEL_ID)).thenReturn(Optional.of(supervisor));
        when(supervisor.send(JID, "It is $12.")).thenReturn(CompletableFuture.completedFuture("wamid-9"));

        // Act
        AutoReplyDispatcher.Outcome outcome = dispatcher.dispatch(event("How much?"));

        // Assert
        assertEquals(AutoReplyDispatcher.Outcome.REPLIED, outcome);
        verify(processedRepository).save(any(ProcessedInboundMessage.class));
        verify(botConfigService).recordAutoReply(CHANNEL_ID);

        ArgumentCaptor<ResponderRequest> request = ArgumentCaptor.forClass(ResponderRequest.class);
        verify(responder).reply(request.capture());
        assertEquals("How much?", request.getValue().inboundText());
        assertTrue(request.getValue().systemPrompt().contains("Blue mug, $12."));
        List<HistoryEntry> history = request.getValue().history();
        assertEquals(2, history.size());
        assertEquals("Hello", history.get(0).text());
        assertTrue(history.get(1).fromMe());
    }

    @Test
    void testDispatch_EmptyReply_NothingSentAndFailureRecorded() {
        // Arrange
        enabledAndNew();
        when(responder.reply(any())).thenReturn(Optional.of("  "));

        // Act
        AutoReplyDispatcher.Outcome outcome = dispatcher.dispatch(event("How much?"));

        // Assert
        assertEquals(AutoReplyDispatcher.Outcome.NO_REPLY, outcome);
        verifyNoInteractions(registry);
        verify(botConfigService, never()).recordAutoReply(anyString());
        verify(botConfigService).recordFailure(CHANNEL_ID, "Responder returned an empty reply");
    }

    @Test
    void testDispatch_ResponderFails_RecordsFailure() {
        // Arrange
        enabledAndNew();
        when(responder.reply(any())).thenThrow(new ResponderException("Responder returned HTTP 500", null));

        // Act
        AutoReplyDispatcher.Outcome outcome = dispatcher.dispatch(event("How much?"));

        // Assert
        assertEquals(AutoReplyDispatcher.Outcome.RESPONDER_FAILED, outcome);
        verify(botConfigService).recordFailure(eq(CHANNEL_ID), contains("HTTP 500"));
        verifyNoInteractions(registry);
    }

    @Test
    void testDispatch_ChannelNotConnected_RecordsFailure() {
        // Arrange
        enabledAndNew();
        when(responder.reply(any())).thenReturn(Optional.of("It is $12."));
        when(registry.find(CHANNEL_ID)).thenReturn(Optional.empty());

        // Act
        AutoReplyDispatcher.Outcome outcome = dispatcher.dispatch(event("How much?"));

        // Assert
        assertEquals(AutoReplyDispatcher.Outcome.SEND_FAILED, outcome);
        verify(botConfigService).recordFailure(eq(CHANNEL_ID), contains("not connected"));
        verify(botConfigService, never()).recordAutoReply(anyString());
    }

    @Test
    void testOnInboundMessage_UnreadablePayload_StillAcknowledged() {
        // Act
        dispatcher.onInboundMessage("{not json", CHANNEL_ID, acknowledgment);

        // Assert
        verify(acknowledgment).acknowledge();
        verifyNoInteractions(botConfigService);
    }

    @Test
    void testOnInboundMessage_Disabled_Acknowledged() throws Exception {
        // Arrange
        when(botConfigService.find(CHANNEL_ID)).thenReturn(Optional.of(config(false)));
        String payload = objectMapper.writeValueAsString(event("How much?"));

        // Act
        dispatcher.onInboundMessage(payload, CHANNEL_ID, acknowledgment);

        // Assert
        verify(acknowledgment).acknowledge();
    }
}
