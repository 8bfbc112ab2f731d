package com.clapgrow.channels.whatsapp.concurrent;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs actions for the same key one at a time on the caller's thread; different keys run in parallel.
 *
 * <p>Ingress uses the channel id as key so that read-modify-write of conversation documents
 * (unread counters, last message) never loses an update.
 */
@Component
public class KeyedSequencer {

    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    public <T> T executeForKey(String key, Supplier<T> action) {
        Object lock = locks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            return action.get();
        }
    }

    public void runForKey(String key, Runnable action) {
        executeForKey(key, () -> {
            action.run();
            return null;
        });
    }
}
