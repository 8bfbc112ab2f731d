package com.clapgrow.channels.whatsapp.repository;

import com.clapgrow.channels.whatsapp.entity.BotConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BotConfigRepository extends JpaRepository<BotConfigEntity, String> {
}
