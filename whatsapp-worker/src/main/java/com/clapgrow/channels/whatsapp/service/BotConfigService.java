package com.clapgrow.channels.whatsapp.service;

import com.clapgrow.channels.whatsapp.concurrent.KeyedSequencer;
import com.clapgrow.channels.whatsapp.dto.BotConfigUpdateRequest;
import com.clapgrow.channels.whatsapp.entity.BotConfigEntity;
import com.clapgrow.channels.whatsapp.exception.ChannelNotFoundException;
import com.clapgrow.channels.whatsapp.repository.BotConfigRepository;
import com.clapgrow.channels.whatsapp.repository.ChannelRepository;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Reads and merges the per-channel bot configuration. A missing configuration is created
 * with auto-reply disabled on first read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotConfigService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final BotConfigRepository botConfigRepository;
    private final ChannelRepository channelRepository;
    private final StoreWriteRetrier retrier;
    private final KeyedSequencer sequencer;
    private final Clock clock;

    /**
     * @throws ChannelNotFoundException when the channel does not exist
     */
    public BotConfigEntity get(String channelId) {
        requireChannel(channelId);
        return sequencer.executeForKey(key(channelId), () -> loadOrCreate(channelId));
    }

    /**
     * Merges the non-null fields of the request and stamps who changed it.
     * Enabling a channel that has never connected is stored; it only takes effect once connected.
     */
    public BotConfigEntity update(String channelId, BotConfigUpdateRequest request) {
        requireChannel(channelId);
        return sequencer.executeForKey(key(channelId), () -> {
            BotConfigEntity config = loadOrCreate(channelId);
            if (request.getEnabled() != null) {
                config.setEnabled(request.getEnabled());
            }
            if (request.getProductDetails() != null) {
                config.setProductDetails(request.getProductDetails());
            }
            if (request.getSalesStrategy() != null) {
                config.setSalesStrategy(request.getSalesStrategy());
            }
            config.setUpdatedByUid(request.getUpdatedByUid());
            config.setUpdatedByEmail(request.getUpdatedByEmail());
            config.setUpdatedAt(now());
            BotConfigEntity saved = retrier.execute("update bot config", channelId,
                () -> botConfigRepository.save(config));
            log.info("Bot config updated: channelId={}, enabled={}, updatedBy={}",
                channelId, saved.isEnabled(), request.getUpdatedByUid());
            return saved;
        });
    }

    /**
     * Stored configuration without creating a default one.
     */
    public Optional<BotConfigEntity> find(String channelId) {
        return retrier.execute("load bot config", channelId, () -> botConfigRepository.findById(channelId));
    }

    public void recordAutoReply(String channelId) {
        sequencer.runForKey(key(channelId), () -> retrier.run("record auto-reply", channelId, () ->
            botConfigRepository.findById(channelId).ifPresent(config -> {
                LocalDateTime now = now();
                config.setLastAutoReplyAt(now);
                config.setLastError(null);
                config.setLastErrorAt(null);
                botConfigRepository.save(config);
            })));
    }

    public void recordFailure(String channelId, String error) {
        String message = error == null ? "unknown error"
            : error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
        sequencer.runForKey(key(channelId), () -> retrier.run("record auto-reply failure", channelId, () ->
            botConfigRepository.findById(channelId).ifPresent(config -> {
                config.setLastError(message);
                config.setLastErrorAt(now());
                botConfigRepository.save(config);
            })));
    }

    private BotConfigEntity loadOrCreate(String channelId) {
        return retrier.execute("load bot config", channelId, () -> botConfigRepository.findById(channelId)
            .orElseGet(() -> {
                BotConfigEntity created = new BotConfigEntity(channelId);
                created.setUpdatedAt(now());
                log.info("Bot config created with defaults: channelId={}", channelId);
                return botConfigRepository.save(created);
            }));
    }

    private void requireChannel(String channelId) {
        boolean exists = retrier.execute("check channel", channelId, () -> channelRepository.existsById(channelId));
        if (!exists) {
            throw new ChannelNotFoundException(channelId);
        }
    }

    private static String key(String channelId) {
        return "bot-config:" + channelId;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
