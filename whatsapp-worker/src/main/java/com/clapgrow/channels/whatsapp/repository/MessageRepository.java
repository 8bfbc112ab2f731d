package com.clapgrow.channels.whatsapp.repository;

import com.clapgrow.channels.whatsapp.entity.MessageEntity;
import com.clapgrow.channels.whatsapp.entity.MessageKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MessageRepository extends JpaRepository<MessageEntity, MessageKey> {

    /**
     * Most recent messages of a conversation, newest first.
     */
    List<MessageEntity> findTop50ByChannelIdAndJidOrderByTimestampDesc(String channelId, String jid);

    /**
     * Receipts identify a message by id only; ids are unique per channel in practice.
     */
    Optional<MessageEntity> findFirstByChannelIdAndMessageId(String channelId, String messageId);
}
