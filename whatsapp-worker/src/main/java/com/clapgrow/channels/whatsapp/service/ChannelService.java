package com.clapgrow.channels.whatsapp.service;

import com.clapgrow.channels.common.provider.ProviderErrorCategory;
import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import com.clapgrow.channels.whatsapp.dto.CreateChannelRequest;
import com.clapgrow.channels.whatsapp.entity.ChannelEntity;
import com.clapgrow.channels.whatsapp.entity.ConversationEntity;
import com.clapgrow.channels.whatsapp.enums.ChannelStatus;
import com.clapgrow.channels.whatsapp.exception.BadRequestException;
import com.clapgrow.channels.whatsapp.exception.ChannelNotFoundException;
import com.clapgrow.channels.whatsapp.exception.PreconditionFailedException;
import com.clapgrow.channels.whatsapp.exception.TransportException;
import com.clapgrow.channels.whatsapp.ingress.Jids;
import com.clapgrow.channels.whatsapp.ingress.MessageIngressService;
import com.clapgrow.channels.whatsapp.publisher.ChannelStatePublisher;
import com.clapgrow.channels.whatsapp.publisher.ChannelUpdate;
import com.clapgrow.channels.whatsapp.repository.ChannelRepository;
import com.clapgrow.channels.whatsapp.store.StoreWriteRetrier;
import com.clapgrow.channels.whatsapp.supervisor.ChannelSnapshot;
import com.clapgrow.channels.whatsapp.supervisor.ChannelSupervisor;
import com.clapgrow.channels.whatsapp.supervisor.ConnectionState;
import com.clapgrow.channels.whatsapp.supervisor.SupervisorRegistry;
import com.clapgrow.channels.whatsapp.transport.CloseReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Control operations on channels. Lifecycle commands are handed to the channel's supervisor and
 * awaited with a timeout; failures surface as the supervisor's own exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChannelService {

    private final ChannelRepository channelRepository;
    private final ChannelStatePublisher publisher;
    private final SupervisorRegistry registry;
    private final MessageIngressService ingress;
    private final StoreWriteRetrier retrier;
    private final WorkerProperties properties;

    public ChannelEntity create(CreateChannelRequest request) {
        String channelId = request.getId() != null && !request.getId().isBlank()
            ? request.getId()
            : UUID.randomUUID().toString();
        if (exists(channelId)) {
            throw new BadRequestException("Channel already exists: " + channelId);
        }
        ChannelEntity channel = await(publisher.publish(channelId, ChannelUpdate.builder()
            .displayName(request.getDisplayName().trim())
            .status(ChannelStatus.DISCONNECTED)
            .build()), commandTimeout());
        log.info("Channel created: channelId={}, displayName={}", channelId, channel.getDisplayName());
        return channel;
    }

    public List<ChannelEntity> list() {
        return retrier.execute("list channels", "*", channelRepository::findAllByOrderByCreatedAtAsc);
    }

    public ChannelEntity get(String channelId) {
        return retrier.execute("load channel", channelId, () -> channelRepository.findById(channelId))
            .orElseThrow(() -> new ChannelNotFoundException(channelId));
    }

    public ChannelEntity rename(String channelId, String displayName) {
        requireChannel(channelId);
        ChannelEntity channel = await(publisher.publish(channelId, ChannelUpdate.builder()
            .displayName(displayName.trim())
            .build()), commandTimeout());
        log.info("Channel renamed: channelId={}, displayName={}", channelId, channel.getDisplayName());
        return channel;
    }

    /**
     * Starts pairing or resumes the stored session. The channel record is created on the first
     * attempt when it does not exist yet.
     */
    public ChannelSnapshot requestQr(String channelId) {
        return await(registry.supervisor(channelId).requestQr(), commandTimeout());
    }

    public ChannelSnapshot disconnect(String channelId) {
        return await(registry.supervisor(channelId).disconnect(), commandTimeout());
    }

    public ChannelSnapshot resetSession(String channelId) {
        return await(registry.supervisor(channelId).resetSession(), commandTimeout());
    }

    /**
     * Retries a channel that ended in ERROR.
     */
    public ChannelSnapshot repair(String channelId) {
        ChannelEntity channel = get(channelId);
        ChannelSupervisor supervisor = registry.supervisor(channelId);
        if (channel.getStatus() != ChannelStatus.ERROR && supervisor.getState() != ConnectionState.ERROR) {
            throw PreconditionFailedException.notInError(channelId, channel.getStatus());
        }
        return await(supervisor.repair(), commandTimeout());
    }

    /**
     * @return the WhatsApp message id
     */
    public String send(String channelId, String to, String text) {
        String jid = Jids.fromRecipient(to);
        if (jid == null) {
            throw new BadRequestException("'to' must be a JID or a phone number");
        }
        if (text == null || text.isBlank()) {
            throw new BadRequestException("'text' must not be empty");
        }
        ChannelSupervisor supervisor = registry.find(channelId)
            .orElseThrow(() -> PreconditionFailedException.notConnected(channelId));
        Duration timeout = properties.getSupervisor().getSendTimeout().plus(commandTimeout());
        return await(supervisor.send(jid, text), timeout);
    }

    public ConversationEntity markRead(String channelId, String jid) {
        return ingress.markRead(channelId, jid);
    }

    private boolean exists(String channelId) {
        return retrier.execute("check channel", channelId, () -> channelRepository.existsById(channelId));
    }

    private void requireChannel(String channelId) {
        if (!exists(channelId)) {
            throw new ChannelNotFoundException(channelId);
        }
    }

    private Duration commandTimeout() {
        return properties.getSupervisor().getCommandTimeout();
    }

    private static <T> T await(CompletableFuture<T> future, Duration timeout) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                throw new TransportException("Operation timed out", CloseReason.TIMED_OUT,
                    ProviderErrorCategory.TEMPORARY, null, cause);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Channel operation failed", cause);
        } catch (TimeoutException e) {
            throw new TransportException("Operation did not complete within " + timeout.toSeconds() + "s",
                CloseReason.TIMED_OUT, ProviderErrorCategory.TEMPORARY, null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for channel operation", e);
        }
    }
}
