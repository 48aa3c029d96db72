package com.whereq.kiln.executor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.lifecycle.BuildLifecycleMachine;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildOutcome;
import com.whereq.kiln.queue.JobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed pool of workers that pull jobs from the queue and run each one
 * through the lifecycle machine before pulling the next.
 *
 * <p>Every dispatched job gets a terminal report, even when the lifecycle
 * machine throws, so no job stays ACTIVE forever.
 */
@Slf4j
@Service
public class BuildWorkerPool {

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private BuildLifecycleMachine lifecycle;

    @Autowired
    private KilnProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter successCounter;
    private Counter failureCounter;
    private Counter cancelledCounter;
    private Timer executionTimer;

    private ExecutorService workers;
    private volatile boolean running;

    @PostConstruct
    public void initialize() {
        successCounter = Counter.builder("kiln.builds.succeeded")
            .description("Number of successfully completed build attempts")
            .register(meterRegistry);

        failureCounter = Counter.builder("kiln.builds.failed")
            .description("Number of failed build attempts")
            .register(meterRegistry);

        cancelledCounter = Counter.builder("kiln.builds.cancelled")
            .description("Number of cancelled builds")
            .register(meterRegistry);

        executionTimer = Timer.builder("kiln.builds.execution.time")
            .description("Build attempt execution time")
            .register(meterRegistry);

        start();
    }

    public synchronized void start() {
        KilnProperties.WorkerConfig config = properties.getWorkers();
        if (!config.isEnabled()) {
            log.info("Build worker pool disabled");
            return;
        }
        if (running) {
            return;
        }
        running = true;
        workers = Executors.newFixedThreadPool(config.getPoolSize(), new ThreadFactoryBuilder()
            .setNameFormat("kiln-worker-%d")
            .setDaemon(true)
            .build());
        for (int i = 0; i < config.getPoolSize(); i++) {
            workers.execute(this::workLoop);
        }
        log.info("Build worker pool started with {} workers", config.getPoolSize());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Build workers did not stop within 30s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Build worker pool stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void workLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            BuildJob job;
            try {
                job = jobQueue.dequeue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                process(job);
            } catch (Throwable e) {
                log.error("Worker {} failed on job {}, continuing", Thread.currentThread().getName(), job.getId(), e);
            }
        }
        log.debug("Worker {} exiting", Thread.currentThread().getName());
    }

    /**
     * Run one dispatched job and report its outcome to the queue
     */
    public BuildOutcome process(BuildJob job) {
        log.info("Worker {} picked up job {}", Thread.currentThread().getName(), job.getId());

        Timer.Sample sample = Timer.start();
        BuildOutcome outcome;
        try {
            outcome = lifecycle.run(job);
        } catch (Throwable e) {
            log.error("Lifecycle machine crashed on job {}", job.getId(), e);
            outcome = BuildOutcome.failed(job.getId(), "Internal error: "
                + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
        sample.stop(executionTimer);

        if (outcome.isSuccess()) {
            successCounter.increment();
        } else if (outcome.isCancelled()) {
            cancelledCounter.increment();
        } else {
            failureCounter.increment();
        }

        try {
            jobQueue.reportResult(job.getId(), outcome);
        } catch (Throwable e) {
            log.error("Could not report result of job {} to the queue", job.getId(), e);
        }
        return outcome;
    }
}
