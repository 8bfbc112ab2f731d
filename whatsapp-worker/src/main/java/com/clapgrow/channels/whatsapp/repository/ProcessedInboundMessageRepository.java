package com.clapgrow.channels.whatsapp.repository;

import com.clapgrow.channels.whatsapp.entity.ProcessedInboundMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProcessedInboundMessageRepository
        extends JpaRepository<ProcessedInboundMessage, ProcessedInboundMessage.Key> {
}
