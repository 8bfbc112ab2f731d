package com.clapgrow.channels.whatsapp.ingress;

import com.clapgrow.channels.whatsapp.concurrent.KeyedSequencer;
import com.clapgrow.channels.whatsapp.entity.ConversationEntity;
import com.clapgrow.channels.whatsapp.entity.ConversationKey;
import com.clapgrow.channels.whatsapp.entity.MessageEntity;
import com.clapgrow.channels.whatsapp.entity.MessageKey;
import com.clapgrow.channels.whatsapp.enums.MessageDirection;
import com.clapgrow.channels.whatsapp.enums.MessageStatus;
import com.clapgrow.channels.whatsapp.exception.ConversationNotFoundException;
import com.clapgrow.channels.whatsapp.exception.StoreWriteException;
import com.clapgrow.channels.whatsapp.repository.ConversationRepository;
import com.clapgrow.channels.whatsapp.repository.MessageRepository;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores conversations and messages for inbound events, accepted sends and delivery receipts.
 *
 * <p>Writes for one channel are serialized so unread counters and last-message fields never
 * lose an update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageIngressService {

    static final String MEDIA_PLACEHOLDER = "[media]";
    static final String STATUS_BROADCAST_JID = "status@broadcast";

    public enum IngestResult {
        STORED,
        DUPLICATE,
        SKIPPED
    }

    private final MessageNormalizer normalizer;
    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final StoreWriteRetrier retrier;
    private final KeyedSequencer sequencer;
    private final InboundMessagePublisher inboundPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Ingests a batch of raw events. A failing event is logged and does not stop the batch.
     */
    public void ingestAll(String channelId, List<JsonNode> events, String selfJid) {
        if (events == null) {
            return;
        }
        for (JsonNode event : events) {
            try {
                ingest(channelId, event, selfJid);
            } catch (RuntimeException e) {
                log.error("Failed to ingest message: channelId={}, error={}", channelId, e.getMessage());
            }
        }
    }

    public IngestResult ingest(String channelId, JsonNode raw, String selfJid) {
        Optional<NormalizedMessage> normalized = normalizer.normalize(raw, null, clock.millis());
        if (normalized.isEmpty()) {
            log.debug("Skipping event without message id or remote party: channelId={}", channelId);
            return IngestResult.SKIPPED;
        }
        NormalizedMessage message = normalized.get();
        if (STATUS_BROADCAST_JID.equals(message.jid())) {
            return IngestResult.SKIPPED;
        }
        // Own messages written from another device of the account arrive with the own JID as sender
        boolean fromMe = message.fromMe()
            || message.jid().equals(Jids.normalize(selfJid));

        IngestResult result = sequencer.executeForKey(channelId, () -> store(channelId, message, raw, fromMe));
        if (result == IngestResult.STORED) {
            log.info("Message stored: channelId={}, jid={}, messageId={}, fromMe={}",
                channelId, message.jid(), message.messageId(), fromMe);
            if (!fromMe) {
                inboundPublisher.publish(new InboundMessageEvent(channelId, message.jid(), message.messageId(),
                    message.text(), message.timestamp(), message.pushName()));
            }
        } else {
            log.debug("Duplicate message skipped: channelId={}, messageId={}", channelId, message.messageId());
        }
        return result;
    }

    /**
     * Records a message this worker sent. A store failure is logged only; the message is already out.
     */
    public void recordOutbound(String channelId, String to, String messageId, String text, long timestampMs) {
        String jid = Jids.fromRecipient(to);
        String id = messageId != null ? messageId : "out-" + UUID.randomUUID();
        try {
            sequencer.runForKey(channelId, () -> {
                MessageEntity message = new MessageEntity(channelId, jid, id);
                message.setFromMe(true);
                message.setDirection(MessageDirection.OUT);
                message.setText(text);
                message.setStatus(MessageStatus.SENT);
                message.setTimestamp(timestampMs);
                message.setCreatedAt(now());
                retrier.execute("append outbound message", channelId, () -> messageRepository.save(message));
                retrier.execute("upsert conversation", channelId,
                    () -> upsertConversation(channelId, jid, id, text, timestampMs, null, false));
            });
        } catch (StoreWriteException e) {
            log.error("Sent message not recorded: channelId={}, jid={}, messageId={}, error={}",
                channelId, jid, id, e.getMessage());
        }
    }

    /**
     * Applies a delivery receipt. Statuses only move forward.
     */
    public void updateStatus(String channelId, String jid, String messageId, MessageStatus status) {
        if (messageId == null || status == null) {
            return;
        }
        try {
            sequencer.runForKey(channelId, () -> retrier.run("update message status", channelId, () -> {
                Optional<MessageEntity> found = Optional.empty();
                String normalizedJid = Jids.normalize(jid);
                if (normalizedJid != null) {
                    found = messageRepository.findById(new MessageKey(channelId, normalizedJid, messageId));
                }
                if (found.isEmpty()) {
                    found = messageRepository.findFirstByChannelIdAndMessageId(channelId, messageId);
                }
                if (found.isEmpty()) {
                    log.debug("Receipt for unknown message: channelId={}, messageId={}", channelId, messageId);
                    return;
                }
                MessageEntity message = found.get();
                MessageStatus current = message.getStatus();
                if (current == null || current.canAdvanceTo(status)) {
                    message.setStatus(status);
                    messageRepository.save(message);
                    log.debug("Message status updated: channelId={}, messageId={}, {} -> {}",
                        channelId, messageId, current, status);
                }
            }));
        } catch (StoreWriteException e) {
            log.error("Receipt not recorded: channelId={}, messageId={}, error={}", channelId, messageId, e.getMessage());
        }
    }

    /**
     * Resets the unread counter of a conversation. Idempotent.
     *
     * @throws ConversationNotFoundException when the conversation does not exist
     */
    public ConversationEntity markRead(String channelId, String jid) {
        String normalizedJid = Jids.normalize(jid);
        if (normalizedJid == null) {
            throw new ConversationNotFoundException(channelId, jid);
        }
        ConversationKey key = new ConversationKey(channelId, normalizedJid);
        return sequencer.executeForKey(channelId, () -> {
            ConversationEntity conversation = retrier
                .execute("load conversation", channelId, () -> conversationRepository.findById(key))
                .orElseThrow(() -> new ConversationNotFoundException(channelId, normalizedJid));
            if (conversation.getUnreadCount() == 0) {
                return conversation;
            }
            conversation.setUnreadCount(0);
            conversation.setUpdatedAt(now());
            return retrier.execute("mark conversation read", channelId, () -> conversationRepository.save(conversation));
        });
    }

    private IngestResult store(String channelId, NormalizedMessage normalized, JsonNode raw, boolean fromMe) {
        MessageKey key = new MessageKey(channelId, normalized.jid(), normalized.messageId());
        if (retrier.execute("check message", channelId, () -> messageRepository.existsById(key))) {
            return IngestResult.DUPLICATE;
        }
        MessageEntity message = new MessageEntity(channelId, normalized.jid(), normalized.messageId());
        message.setFromMe(fromMe);
        message.setDirection(fromMe ? MessageDirection.OUT : MessageDirection.IN);
        message.setText(normalized.text());
        message.setStatus(fromMe ? MessageStatus.SENT : MessageStatus.RECEIVED);
        message.setTimestamp(normalized.timestamp());
        message.setRaw(toJson(raw));
        message.setCreatedAt(now());
        retrier.execute("append message", channelId, () -> messageRepository.save(message));
        retrier.execute("upsert conversation", channelId, () -> upsertConversation(channelId, normalized.jid(),
            normalized.messageId(), normalized.text(), normalized.timestamp(),
            fromMe ? null : normalized.pushName(), !fromMe));
        return IngestResult.STORED;
    }

    private ConversationEntity upsertConversation(String channelId, String jid, String messageId, String text,
                                                  long timestampMs, String senderName, boolean incrementUnread) {
        LocalDateTime now = now();
        ConversationEntity conversation = conversationRepository.findById(new ConversationKey(channelId, jid))
            .orElseGet(() -> {
                ConversationEntity created = new ConversationEntity(channelId, jid);
                created.setCreatedAt(now);
                return created;
            });

        // In groups the push name belongs to the sender, not to the conversation
        if (senderName != null && !Jids.isGroup(jid)) {
            conversation.setName(senderName);
        } else if (conversation.getName() == null) {
            conversation.setName(Jids.userPart(jid));
        }

        LocalDateTime messageAt = LocalDateTime.ofInstant(Instant.ofEpochMilli(timestampMs), ZoneOffset.UTC);
        if (conversation.getLastMessageAt() == null || !messageAt.isBefore(conversation.getLastMessageAt())) {
            conversation.setLastMessageAt(messageAt);
            conversation.setLastMessageText(text != null ? text : MEDIA_PLACEHOLDER);
            conversation.setLastMessageId(messageId);
        }
        if (incrementUnread) {
            conversation.setUnreadCount(conversation.getUnreadCount() + 1);
        }
        conversation.setUpdatedAt(now);
        return conversationRepository.save(conversation);
    }

    private String toJson(JsonNode raw) {
        if (raw == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            log.warn("Raw payload not serializable: {}", e.getMessage());
            return null;
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
