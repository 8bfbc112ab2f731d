package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps channel ids to their supervisors.
 *
 * <p>On start, channels with stored credentials are resumed and every other channel still recorded
 * as live is set to DISCONNECTED. On stop, every transport is closed (credentials kept) before the
 * executors shut down.
 */
@Component
@Slf4j
public class SupervisorRegistry implements SmartLifecycle {

    private final SupervisorDependencies deps;
    private final WorkerProperties properties;
    private final ConcurrentHashMap<String, ChannelSupervisor> supervisors = new ConcurrentHashMap<>();
    private volatile boolean running;

    public SupervisorRegistry(SupervisorDependencies deps, WorkerProperties properties) {
        this.deps = deps;
        this.properties = properties;
    }

    /**
     * Supervisor of the channel, created on first use.
     */
    public ChannelSupervisor supervisor(String channelId) {
        return supervisors.computeIfAbsent(channelId, id -> new ChannelSupervisor(id, deps));
    }

    public Optional<ChannelSupervisor> find(String channelId) {
        return Optional.ofNullable(supervisors.get(channelId));
    }

    public Collection<ChannelSupervisor> all() {
        return supervisors.values();
    }

    @Override
    public void start() {
        running = true;
        releaseStaleChannels(restoreSessions());
    }

    private Set<String> restoreSessions() {
        if (!properties.getSessions().isRestoreOnStartup()) {
            log.info("Session restore disabled");
            return Set.of();
        }
        List<String> channelIds;
        try {
            channelIds = deps.getSessionStore().channelIds();
        } catch (RuntimeException e) {
            log.error("Could not list stored sessions, no channel restored: error={}", e.getMessage());
            return Set.of();
        }
        log.info("Restoring {} stored session(s)", channelIds.size());
        for (String channelId : channelIds) {
            supervisor(channelId).resume().whenComplete((snapshot, error) -> {
                if (error != null) {
                    log.error("Failed to restore session: channelId={}, error={}", channelId, error.getMessage());
                }
            });
        }
        return Set.copyOf(channelIds);
    }

    private void releaseStaleChannels(Set<String> restored) {
        try {
            List<String> released = deps.getPublisher().releaseStaleChannels(restored);
            if (!released.isEmpty()) {
                log.info("Released {} channel(s) left live without a session: {}", released.size(), released);
            }
        } catch (RuntimeException e) {
            log.error("Could not release stale channel records: error={}", e.getMessage());
        }
    }

    @Override
    public void stop() {
        running = false;
        if (supervisors.isEmpty()) {
            return;
        }
        log.info("Closing {} channel supervisor(s)", supervisors.size());
        List<CompletableFuture<Void>> closing = new ArrayList<>();
        for (ChannelSupervisor supervisor : supervisors.values()) {
            closing.add(supervisor.shutdown());
        }
        long timeoutMs = properties.getSupervisor().getShutdownTimeout().toMillis();
        try {
            CompletableFuture.allOf(closing.toArray(new CompletableFuture[0])).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Channel shutdown did not finish within {}ms", timeoutMs);
        } catch (ExecutionException e) {
            log.warn("Channel shutdown failed: error={}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing channels");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Later than the web server, so channels are closed while webhooks are still accepted.
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }
}
