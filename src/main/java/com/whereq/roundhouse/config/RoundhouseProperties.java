package com.whereq.roundhouse.config;

import com.whereq.roundhouse.model.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Roundhouse.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "roundhouse")
@Data
public class RoundhouseProperties {

    private StoreConfig store = new StoreConfig();

    private QueueConfig queue = new QueueConfig();

    private LogsConfig logs = new LogsConfig();

    private CallbackConfig callback = new CallbackConfig();

    private WorkerConfig worker = new WorkerConfig();

    private MonitorConfig monitor = new MonitorConfig();

    @Data
    public static class StoreConfig {
        /**
         * Coordination store backend.
         * REDIS: shared Redis instance (default)
         * MEMORY: in-process store, single instance only
         */
        private StoreType type = StoreType.REDIS;

        /**
         * Prefix for every key the queue writes.
         */
        private String keyPrefix = "roundhouse";
    }

    @Data
    public static class QueueConfig {
        /**
         * How long job records stay queryable, whatever their status.
         */
        private Duration jobRetention = Duration.ofDays(7);

        /**
         * Milliseconds subtracted from a priority job's score per priority step.
         * Must exceed the job retention so a higher priority always sorts first.
         */
        private long priorityWeight = 1_000_000_000L;
    }

    @Data
    public static class LogsConfig {
        /**
         * Maximum lines fetched per stream read.
         */
        private int readBatchSize = 100;

        /**
         * How long one tail read blocks before it is reissued.
         */
        private Duration readBlock = Duration.ofSeconds(1);
    }

    @Data
    public static class CallbackConfig {
        /**
         * How long a failed callback is kept for redelivery.
         */
        private Duration retention = Duration.ofHours(24);

        /**
         * HTTP timeout for a single delivery.
         */
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Bearer token sent to the callback receiver, optional.
         */
        private String apiKey;

        private RetryPolicy retry = RetryPolicy.defaultPolicy();

        private DriverConfig driver = new DriverConfig();
    }

    @Data
    public static class DriverConfig {
        /**
         * Run the periodic redelivery loop in this instance.
         */
        private boolean enabled = true;

        /**
         * Delay between redelivery passes.
         */
        private Duration interval = Duration.ofSeconds(5);

        /**
         * Attempts claimed per pass.
         */
        private int batchSize = 50;
    }

    @Data
    public static class WorkerConfig {
        /**
         * Run a build worker in this instance. Requires a BuildExecutor bean.
         */
        private boolean enabled = false;

        /**
         * Worker identity; defaults to hostname plus a random suffix.
         */
        private String id;

        private int maxConcurrentBuilds = 3;

        /**
         * How long one claim waits for FIFO work.
         */
        private Duration pollInterval = Duration.ofSeconds(5);

        private Duration buildTimeout = Duration.ofMinutes(30);

        /**
         * How long shutdown waits for running builds.
         */
        private Duration shutdownGracePeriod = Duration.ofMinutes(5);
    }

    @Data
    public static class MonitorConfig {
        /**
         * How often queue depth gauges are refreshed.
         */
        private Duration refreshInterval = Duration.ofSeconds(15);
    }

    public enum StoreType {
        REDIS,
        MEMORY
    }
}
