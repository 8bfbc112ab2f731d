package com.clapgrow.channels.whatsapp.autoreply;

import com.clapgrow.channels.whatsapp.config.AutoReplyProperties;
import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import com.clapgrow.channels.whatsapp.entity.BotConfigEntity;
import com.clapgrow.channels.whatsapp.entity.MessageEntity;
import com.clapgrow.channels.whatsapp.entity.ProcessedInboundMessage;
import com.clapgrow.channels.whatsapp.exception.PreconditionFailedException;
import com.clapgrow.channels.whatsapp.ingress.InboundMessageEvent;
import com.clapgrow.channels.whatsapp.repository.MessageRepository;
import com.clapgrow.channels.whatsapp.repository.ProcessedInboundMessageRepository;
import com.clapgrow.channels.whatsapp.service.BotConfigService;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import com.clapgrow.channels.whatsapp.supervisor.ChannelSupervisor;
import com.clapgrow.channels.whatsapp.supervisor.SupervisorRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers inbound messages of channels with auto-reply enabled.
 *
 * <p>Every inbound event gets at most one reply attempt: a processed marker is stored before the
 * responder is called, and failures are recorded on the bot configuration without retrying.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoReplyDispatcher {

    public enum Outcome {
        SKIPPED_NO_TEXT,
        DISABLED,
        DUPLICATE,
        NO_REPLY,
        RESPONDER_FAILED,
        SEND_FAILED,
        REPLIED
    }

    private final BotConfigService botConfigService;
    private final ProcessedInboundMessageRepository processedRepository;
    private final MessageRepository messageRepository;
    private final PromptBuilder promptBuilder;
    private final AutoReplyResponder responder;
    private final SupervisorRegistry registry;
    private final StoreWriteRetrier retrier;
    private final AutoReplyProperties properties;
    private final WorkerProperties workerProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @KafkaListener(topics = "${autoreply.topic:whatsapp-inbound-messages}",
        containerFactory = "kafkaListenerContainerFactory")
    public void onInboundMessage(@Payload String payload,
                                 @Header(KafkaHeaders.RECEIVED_KEY) String channelId,
                                 Acknowledgment acknowledgment) {
        try {
            InboundMessageEvent event = objectMapper.readValue(payload, InboundMessageEvent.class);
            Outcome outcome = dispatch(event);
            log.debug("Inbound message handled: channelId={}, messageId={}, outcome={}",
                event.channelId(), event.messageId(), outcome);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable inbound message event: channelId={}, error={}", channelId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Auto-reply failed: channelId={}, error={}", channelId, e.getMessage(), e);
        } finally {
            // at-most-once: a failed attempt is never redelivered
            acknowledgment.acknowledge();
        }
    }

    public Outcome dispatch(InboundMessageEvent event) {
        String channelId = event.channelId();
        if (event.text() == null || event.text().isBlank()) {
            return Outcome.SKIPPED_NO_TEXT;
        }
        Optional<BotConfigEntity> config = botConfigService.find(channelId);
        if (config.isEmpty() || !config.get().isEnabled()) {
            return Outcome.DISABLED;
        }
        if (!markProcessed(event)) {
            log.info("Inbound message already answered, skipping: channelId={}, messageId={}",
                channelId, event.messageId());
            return Outcome.DUPLICATE;
        }

        ResponderRequest request = new ResponderRequest(channelId, event.jid(),
            promptBuilder.systemPrompt(config.get()), history(event), event.text());
        Optional<String> reply;
        try {
            reply = responder.reply(request);
        } catch (RuntimeException e) {
            log.warn("Responder failed, not replying: channelId={}, messageId={}, error={}",
                channelId, event.messageId(), e.getMessage());
            botConfigService.recordFailure(channelId, "Responder failed: " + e.getMessage());
            return Outcome.RESPONDER_FAILED;
        }
        if (reply.isEmpty() || reply.get().isBlank()) {
            log.info("Responder returned no reply: channelId={}, messageId={}", channelId, event.messageId());
            botConfigService.recordFailure(channelId, "Responder returned an empty reply");
            return Outcome.NO_REPLY;
        }

        try {
            String sentId = send(channelId, event.jid(), reply.get());
            log.info("Auto-reply sent: channelId={}, jid={}, inReplyTo={}, messageId={}",
                channelId, event.jid(), event.messageId(), sentId);
        } catch (PreconditionFailedException e) {
            log.warn("Auto-reply not sent, channel not connected: channelId={}, messageId={}",
                channelId, event.messageId());
            botConfigService.recordFailure(channelId, e.getMessage());
            return Outcome.SEND_FAILED;
        } catch (RuntimeException e) {
            log.warn("Auto-reply send failed: channelId={}, messageId={}, error={}",
                channelId, event.messageId(), e.getMessage());
            botConfigService.recordFailure(channelId, "Send failed: " + e.getMessage());
            return Outcome.SEND_FAILED;
        }
        botConfigService.recordAutoReply(channelId);
        return Outcome.REPLIED;
    }

    /**
     * Earlier messages of the conversation, oldest first, without the message being answered.
     */
    List<HistoryEntry> history(InboundMessageEvent event) {
        List<MessageEntity> recent = messageRepository
            .findTop50ByChannelIdAndJidOrderByTimestampDesc(event.channelId(), event.jid());
        List<MessageEntity> window = new ArrayList<>();
        for (MessageEntity message : recent) {
            if (message.getMessageId().equals(event.messageId())) {
                continue;
            }
            if (window.size() >= properties.getHistorySize()) {
                break;
            }
            window.add(message);
        }
        window.sort(Comparator.comparingLong(MessageEntity::getTimestamp));
        List<HistoryEntry> history = new ArrayList<>(window.size());
        for (MessageEntity message : window) {
            history.add(new HistoryEntry(message.isFromMe(), message.getText(), message.getTimestamp()));
        }
        return history;
    }

    private boolean markProcessed(InboundMessageEvent event) {
        ProcessedInboundMessage.Key key = new ProcessedInboundMessage.Key(event.channelId(), event.messageId());
        return retrier.execute("mark inbound processed", event.channelId(), () -> {
            if (processedRepository.existsById(key)) {
                return false;
            }
            processedRepository.save(new ProcessedInboundMessage(event.channelId(), event.messageId(),
                event.jid(), LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS)));
            return true;
        });
    }

    private String send(String channelId, String jid, String text) {
        ChannelSupervisor supervisor = registry.find(channelId)
            .orElseThrow(() -> PreconditionFailedException.notConnected(channelId));
        long timeoutMs = workerProperties.getSupervisor().getSendTimeout().toMillis();
        try {
            return supervisor.send(jid, text).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Send timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while sending", e);
        }
    }
}
