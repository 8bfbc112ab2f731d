package com.clapgrow.channels.whatsapp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the worker.
 *
 * <ul>
 *   <li>channelExecutor runs the per-channel mailboxes of supervisors</li>
 *   <li>publisherExecutor runs channel record writes, which block on the store and its retries</li>
 *   <li>transportExecutor runs blocking gateway calls (handshakes, sends, teardown)</li>
 *   <li>reconnectScheduler fires backoff timers and status polls</li>
 * </ul>
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "channelExecutor")
    public ThreadPoolTaskExecutor channelExecutor(WorkerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getChannelPoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getChannelPoolSize());
        executor.setThreadNamePrefix("channel-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }

    @Bean(name = "publisherExecutor")
    public ThreadPoolTaskExecutor publisherExecutor(WorkerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getPublisherPoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getPublisherPoolSize());
        executor.setThreadNamePrefix("publisher-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }

    @Bean(name = "transportExecutor")
    public ThreadPoolTaskExecutor transportExecutor(WorkerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getTransportPoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getTransportPoolSize() * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("transport-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "reconnectScheduler")
    public TaskScheduler reconnectScheduler(WorkerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getExecutor().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("reconnect-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
