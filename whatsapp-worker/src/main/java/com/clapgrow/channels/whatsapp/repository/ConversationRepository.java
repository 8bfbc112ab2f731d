package com.clapgrow.channels.whatsapp.repository;

import com.clapgrow.channels.whatsapp.entity.ConversationEntity;
import com.clapgrow.channels.whatsapp.entity.ConversationKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationRepository extends JpaRepository<ConversationEntity, ConversationKey> {
}
