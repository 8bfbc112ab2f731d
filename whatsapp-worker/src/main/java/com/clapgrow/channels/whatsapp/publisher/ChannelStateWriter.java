package com.clapgrow.channels.whatsapp.publisher;

import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import com.clapgrow.channels.whatsapp.repository.ChannelRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;

/**
 * Applies one {@link ChannelUpdate} in a transaction: read, seed if missing, merge, stamp, save.
 */
@Component
@RequiredArgsConstructor
public class ChannelStateWriter {

    private final ChannelRepository channelRepository;
    private final Clock clock;

    @Transactional
    public ChannelEntity apply(String channelId, ChannelUpdate update) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        ChannelEntity channel = channelRepository.findById(channelId)
            .orElseGet(() -> seed(channelId, now));
        update.applyTo(channel, now);
        channel.setUpdatedAt(nextUpdatedAt(channel.getUpdatedAt(), now));
        return channelRepository.save(channel);
    }

    /**
     * Channels whose record says a connection is live or being set up.
     */
    @Transactional(readOnly = true)
    public List<String> liveChannelIds() {
        return channelRepository.findByStatusIn(
                EnumSet.of(ChannelStatus.QR, ChannelStatus.CONNECTING, ChannelStatus.CONNECTED))
            .stream()
            .map(ChannelEntity::getId)
            .toList();
    }

    /**
     * Default record for a channel seen for the first time: disconnected, every optional field empty.
     */
    static ChannelEntity seed(String channelId, LocalDateTime now) {
        ChannelEntity channel = new ChannelEntity(channelId);
        channel.setStatus(ChannelStatus.DISCONNECTED);
        channel.setLinked(false);
        channel.setCreatedAt(now);
        return channel;
    }

    /**
     * updatedAt strictly increases even when the clock does not move between two writes.
     */
    static LocalDateTime nextUpdatedAt(LocalDateTime previous, LocalDateTime now) {
        if (previous == null || now.isAfter(previous)) {
            return now;
        }
        return previous.plus(1, ChronoUnit.MILLIS);
    }
}
