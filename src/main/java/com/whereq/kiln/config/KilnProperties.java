package com.whereq.kiln.config;

import com.whereq.kiln.model.RetryPolicy;
import com.whereq.kiln.model.Tier;
import com.whereq.kiln.model.TierLimits;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ Kiln.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "kiln")
@Data
public class KilnProperties {

    private QueueConfig queue = new QueueConfig();

    private WorkerConfig workers = new WorkerConfig();

    private SchedulerConfig scheduler = new SchedulerConfig();

    private CacheConfig cache = new CacheConfig();

    private NotificationConfig notifications = new NotificationConfig();

    private ToolchainConfig toolchain = new ToolchainConfig();

    /**
     * Per-tier overrides of the built-in resource limits.
     */
    private Map<Tier, TierLimits> tiers = new EnumMap<>(Tier.class);

    /**
     * Resolve limits for a tier, falling back to the built-in defaults.
     */
    public TierLimits limitsFor(Tier tier) {
        TierLimits configured = tiers.get(tier);
        return configured != null ? configured : TierLimits.defaultsFor(tier);
    }

    @Data
    public static class QueueConfig {
        /**
         * Maximum queued-or-active jobs per tenant.
         */
        private int tenantQuota = 2;

        /**
         * Global backlog cap across all tenants.
         */
        private int maxSize = 1000;

        /**
         * Job dispatches allowed per minute, independent of priority.
         */
        private double dispatchRatePerMinute = 5;

        /**
         * How long finished jobs and build records stay queryable.
         */
        private Duration retention = Duration.ofHours(1);

        /**
         * Retry behaviour for failed builds.
         */
        private RetryConfig retry = new RetryConfig();

        /**
         * Backing store for jobs, quota counters and dead letters.
         */
        private QueueStore store = QueueStore.MEMORY;

        /**
         * How long an idle worker waits before polling the Redis queue again.
         */
        private Duration pollInterval = Duration.ofMillis(500);
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;

        private Duration initialInterval = Duration.ofSeconds(5);

        private int multiplier = 2;

        /**
         * Cap for a single backoff; unbounded when unset.
         */
        private Duration maxInterval;

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialInterval(initialInterval)
                .backoffMultiplier(multiplier)
                .maxInterval(maxInterval)
                .build();
        }
    }

    @Data
    public static class WorkerConfig {
        /**
         * Start the worker pool with the application.
         */
        private boolean enabled = true;

        /**
         * Number of builds processed concurrently.
         */
        private int poolSize = 2;
    }

    @Data
    public static class SchedulerConfig {
        /**
         * Maximum steps of one build running at the same time.
         */
        private int maxConcurrency = 4;

        /**
         * Threads shared by all running steps across builds.
         */
        private int stepPoolSize = 16;
    }

    @Data
    public static class CacheConfig {
        /**
         * Backing store for the artifact cache.
         */
        private CacheStore store = CacheStore.MEMORY;

        /**
         * Lifetime of a cached artifact reference.
         */
        private Duration artifactTtl = Duration.ofDays(7);
    }

    @Data
    public static class NotificationConfig {
        /**
         * HMAC key used to sign webhook bodies; unsigned when empty.
         */
        private String webhookSecret;

        private Duration webhookTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class ToolchainConfig {
        /**
         * Time each step of the simulated toolchain pretends to work.
         */
        private Duration simulatedStepDelay = Duration.ofMillis(500);
    }

    public enum QueueStore {
        /**
         * Process-local queue, lost on restart.
         */
        MEMORY,

        /**
         * Jobs kept in Redis, shared by every Kiln instance.
         */
        REDIS
    }

    public enum CacheStore {
        /**
         * Process-local map, entries expire lazily on read.
         */
        MEMORY,

        /**
         * Shared Redis keys with native expiry.
         */
        REDIS
    }
}
