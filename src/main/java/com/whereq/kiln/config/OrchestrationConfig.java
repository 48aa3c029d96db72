package com.whereq.kiln.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.whereq.kiln.cache.ArtifactCache;
import com.whereq.kiln.cache.InMemoryArtifactCache;
import com.whereq.kiln.lifecycle.BuildToolchain;
import com.whereq.kiln.lifecycle.SimulatedBuildToolchain;
import com.whereq.kiln.persistence.BuildPersistence;
import com.whereq.kiln.persistence.InMemoryBuildPersistence;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core beans of the build orchestration: clock, step threads and the
 * in-process defaults of the pluggable stores
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Threads shared by the steps of all running builds
     */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("stepExecutor")
    public ExecutorService stepExecutor(KilnProperties properties) {
        return Executors.newFixedThreadPool(properties.getScheduler().getStepPoolSize(),
            new ThreadFactoryBuilder()
                .setNameFormat("kiln-step-%d")
                .setDaemon(true)
                .build());
    }

    @Bean
    @ConditionalOnProperty(prefix = "kiln.cache", name = "store", havingValue = "memory", matchIfMissing = true)
    public ArtifactCache inMemoryArtifactCache(Clock clock, MeterRegistry meterRegistry) {
        return new InMemoryArtifactCache(clock, meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean(BuildPersistence.class)
    public BuildPersistence buildPersistence() {
        return new InMemoryBuildPersistence();
    }

    @Bean
    @ConditionalOnMissingBean(BuildToolchain.class)
    public BuildToolchain buildToolchain(Clock clock, KilnProperties properties) {
        return new SimulatedBuildToolchain(clock, properties.getToolchain().getSimulatedStepDelay());
    }
}
