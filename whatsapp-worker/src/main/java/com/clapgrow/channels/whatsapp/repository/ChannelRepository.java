package com.clapgrow.channels.whatsapp.repository;

import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Writes go through {@code ChannelStateWriter} only; everything else reads.
 */
@Repository
public interface ChannelRepository extends JpaRepository<ChannelEntity, String> {

    List<ChannelEntity> findAllByOrderByCreatedAtAsc();

    List<ChannelEntity> findByStatusIn(Collection<ChannelStatus> statuses);
}
