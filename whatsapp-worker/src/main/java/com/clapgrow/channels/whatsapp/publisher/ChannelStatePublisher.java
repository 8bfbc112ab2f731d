package com.clapgrow.channels.whatsapp.publisher;

import com.clapgrow.channels.whatsapp.concurrent.ChannelMailbox;
import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Sole writer of channel records.
 *
 * <p>Updates for one channel are written in the order they were published. A failed write is
 * retried and then reported through the returned future; it never propagates into the caller's
 * thread, so connection handling keeps going when the store is unavailable.
 */
@Service
@Slf4j
public class ChannelStatePublisher {

    private final ChannelStateWriter writer;
    private final StoreWriteRetrier retrier;
    private final Executor executor;
    private final ConcurrentHashMap<String, ChannelMailbox> queues = new ConcurrentHashMap<>();

    public ChannelStatePublisher(ChannelStateWriter writer,
                                 StoreWriteRetrier retrier,
                                 @Qualifier("publisherExecutor") Executor executor) {
        this.writer = writer;
        this.retrier = retrier;
        this.executor = executor;
    }

    public CompletableFuture<ChannelEntity> publish(String channelId, ChannelUpdate update) {
        ChannelMailbox queue = queues.computeIfAbsent(channelId,
            id -> new ChannelMailbox("publisher:" + id, executor));
        return queue.call(() -> write(channelId, update))
            .whenComplete((channel, error) -> {
                if (error != null) {
                    log.error("Channel state not persisted: channelId={}, update={}, error={}",
                        channelId, update, error.getMessage());
                }
            });
    }

    /**
     * Marks channels left live by a previous process as DISCONNECTED, except those in {@code supervised}.
     * No connection survives a restart, so their QR and phone are stale too.
     *
     * @return ids of the channels released
     */
    public List<String> releaseStaleChannels(Set<String> supervised) {
        List<String> stale = writer.liveChannelIds().stream()
            .filter(channelId -> !supervised.contains(channelId))
            .toList();
        for (String channelId : stale) {
            publish(channelId, ChannelUpdate.builder()
                .status(ChannelStatus.DISCONNECTED)
                .clearQr()
                .phoneE164(null)
                .linked(false)
                .build());
        }
        return stale;
    }

    private ChannelEntity write(String channelId, ChannelUpdate update) {
        ChannelEntity channel = retrier.execute("publish channel state", channelId,
            () -> writer.apply(channelId, update));
        log.debug("Channel state published: channelId={}, status={}, update={}",
            channelId, channel.getStatus(), update);
        return channel;
    }
}
