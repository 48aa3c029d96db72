package com.whereq.kiln.service;

import com.whereq.kiln.exception.QuotaExceededException;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.queue.JobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Admission control for build submissions.
 * The queue enforces the tenant quota and the global backlog cap; this class counts the decisions.
 */
@Slf4j
@Service
public class AdmissionController {

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter acceptedCounter;
    private Counter rejectedCounter;

    @PostConstruct
    public void initialize() {
        acceptedCounter = Counter.builder("kiln.admission.accepted")
            .description("Number of builds admitted to the queue")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("kiln.admission.rejected")
            .description("Number of builds rejected by quota or backlog cap")
            .register(meterRegistry);
    }

    /**
     * Admit a job into the queue
     *
     * @param job the job to admit
     * @return Mono with the admitted job, or a {@link QuotaExceededException} error
     */
    public Mono<BuildJob> admitJob(BuildJob job) {
        return Mono.fromCallable(() -> jobQueue.submit(job))
            .doOnNext(admitted -> {
                acceptedCounter.increment();
                log.info("Job {} admitted for tenant {} at priority {}",
                    admitted.getId(), admitted.getTenantKey(), admitted.getPriority());
            })
            .doOnError(QuotaExceededException.class, e -> {
                rejectedCounter.increment();
                log.warn("Job {} rejected: {}", job.getId(), e.getMessage());
            });
    }

    public double acceptedCount() {
        return acceptedCounter.count();
    }

    public double rejectedCount() {
        return rejectedCounter.count();
    }
}
