package com.whereq.kiln.monitor;

import com.whereq.kiln.cache.ArtifactCache;
import com.whereq.kiln.cache.InMemoryArtifactCache;
import com.whereq.kiln.cancellation.CancellationRegistry;
import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.lifecycle.BuildLifecycleMachine;
import com.whereq.kiln.queue.JobQueue;
import com.whereq.kiln.queue.QueueStats;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Queue gauges, backlog alerting and the retention sweep
 */
@Slf4j
@Component
public class QueueMonitor {

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private BuildLifecycleMachine lifecycle;

    @Autowired
    private CancellationRegistry cancellationRegistry;

    @Autowired
    private ArtifactCache artifactCache;

    @Autowired
    private KilnProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private Clock clock;

    @Value("${kiln.monitor.backlog-alert-percent:80}")
    private double backlogAlertPercent = 80;

    @PostConstruct
    public void initialize() {
        gauge("kiln.queue.queued", "Jobs waiting for a worker", QueueStats::getQueued);
        gauge("kiln.queue.active", "Jobs being built", QueueStats::getActive);
        gauge("kiln.queue.retrying", "Failed jobs waiting out their backoff", QueueStats::getRetrying);
        gauge("kiln.queue.completed", "Completed jobs within retention", QueueStats::getCompleted);
        gauge("kiln.queue.failed", "Terminally failed jobs within retention", QueueStats::getFailed);
        gauge("kiln.queue.dead_lettered", "Jobs in the dead letter queue", QueueStats::getDeadLettered);

        log.info("QueueMonitor initialized: maxSize={}, retention={}, backlog alert at {}%",
            properties.getQueue().getMaxSize(), properties.getQueue().getRetention(), backlogAlertPercent);
    }

    private void gauge(String name, String description, ToIntFunction<QueueStats> value) {
        Gauge.builder(name, () -> value.applyAsInt(jobQueue.stats()))
            .description(description)
            .register(meterRegistry);
    }

    /**
     * Periodic backlog check
     */
    @Scheduled(fixedRateString = "${kiln.monitor.poll-interval:5000}")
    public void monitorQueue() {
        QueueStats stats = jobQueue.stats();
        int backlog = stats.getQueued() + stats.getRetrying();
        double percent = backlog * 100.0 / properties.getQueue().getMaxSize();

        if (percent > backlogAlertPercent) {
            log.warn("HIGH QUEUE BACKLOG: {} jobs ({}% of max {})",
                backlog, String.format("%.1f", percent), properties.getQueue().getMaxSize());
        }
        if (stats.getDeadLettered() > 0 && log.isDebugEnabled()) {
            log.debug("Dead letter queue holds {} jobs", stats.getDeadLettered());
        }
    }

    /**
     * Forget finished jobs, their build records and cancellation flags once
     * they fall out of the retention window
     */
    @Scheduled(fixedRateString = "${kiln.monitor.sweep-interval:60000}")
    public void sweep() {
        Instant cutoff = clock.instant().minus(properties.getQueue().getRetention());

        List<String> purgedJobs = jobQueue.purgeFinished(cutoff);
        purgedJobs.forEach(cancellationRegistry::forget);
        int purgedRecords = lifecycle.purgeRecords(cutoff);

        int evicted = 0;
        if (artifactCache instanceof InMemoryArtifactCache memoryCache) {
            evicted = memoryCache.evictExpired();
        }

        if (!purgedJobs.isEmpty() || purgedRecords > 0 || evicted > 0) {
            log.info("Retention sweep: {} jobs, {} build records, {} expired cache entries removed",
                purgedJobs.size(), purgedRecords, evicted);
        }
    }
}
