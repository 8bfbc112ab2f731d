package com.clapgrow.channels.whatsapp.config;

import com.clapgrow.channels.common.retry.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings for the connection supervisors, the session store and the state publisher.
 *
 * Maps to:
 * worker:
 *   sessions:
 *     dir: ./data/sessions
 *   supervisor:
 *     handshake-timeout: 60s
 *   reconnect:
 *     initial-delay: 1s
 *     max-delay: 60s
 */
@Configuration
@ConfigurationProperties(prefix = "worker")
@Data
public class WorkerProperties {

    private Sessions sessions = new Sessions();
    private Supervisor supervisor = new Supervisor();
    private Reconnect reconnect = new Reconnect();
    private Publisher publisher = new Publisher();
    private Executor executor = new Executor();

    @Data
    public static class Sessions {
        /**
         * Directory holding one credentials file per channel. Ephemeral unless the
         * deployment mounts persistent storage here.
         */
        private String dir = "./data/sessions";

        /**
         * Reconnect channels that still have stored credentials when the worker starts.
         */
        private boolean restoreOnStartup = true;
    }

    @Data
    public static class Supervisor {
        private Duration handshakeTimeout = Duration.ofSeconds(60);
        private Duration commandTimeout = Duration.ofSeconds(15);
        private Duration sendTimeout = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Reconnect {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private double jitter = 0.2;

        /**
         * 0 keeps retrying for as long as the channel should be connected.
         */
        private int maxAttempts = 0;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(true, initialDelay.toMillis(), maxDelay.toMillis(),
                multiplier, maxAttempts, jitter);
        }
    }

    @Data
    public static class Publisher {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(true, initialDelay.toMillis(), maxDelay.toMillis(),
                2.0, maxAttempts, 0.0);
        }
    }

    @Data
    public static class Executor {
        private int channelPoolSize = 16;
        private int publisherPoolSize = 8;
        private int transportPoolSize = 16;
        private int schedulerPoolSize = 4;
    }
}
