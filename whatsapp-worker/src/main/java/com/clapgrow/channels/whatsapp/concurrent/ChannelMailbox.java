package com.clapgrow.channels.whatsapp.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs the tasks submitted for one channel strictly one after another, in submission order,
 * on a shared pool. Different mailboxes run in parallel; a slow channel only delays itself.
 *
 * <p>A task submitted from inside a running task is queued behind it, never run re-entrantly.
 */
@Slf4j
public class ChannelMailbox implements Executor {

    private final String name;
    private final Executor executor;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();

    public ChannelMailbox(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        tasks.add(task);
        scheduleDrain();
    }

    /**
     * Runs {@code action} in this mailbox. The future completes with its result or with the
     * exception it threw, unwrapped.
     */
    public <T> CompletableFuture<T> call(Supplier<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    public String getName() {
        return name;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("Mailbox {} rejected by executor, {} task(s) pending", name, tasks.size());
            throw e;
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Task failed in mailbox {}: {}", name, e.getMessage(), e);
                }
            }
        } finally {
            draining.set(false);
            if (!tasks.isEmpty()) {
                scheduleDrain();
            }
        }
    }
}
