package com.whereq.kiln.queue;

import com.google.common.util.concurrent.RateLimiter;
import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.exception.QuotaExceededException;
import com.whereq.kiln.model.BuildEvent;
import com.whereq.kiln.model.BuildEventType;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildOutcome;
import com.whereq.kiln.model.DeadLetterRecord;
import com.whereq.kiln.model.JobState;
import com.whereq.kiln.model.RetryPolicy;
import com.whereq.kiln.persistence.PersistenceGuard;
import com.whereq.kiln.service.BuildNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Job queue held in process memory.
 *
 * <p>All job state lives behind one lock that is only held for bookkeeping,
 * never across a build, a rate-limit wait or a backoff. Quota checks count
 * the live job table at submission time, so two concurrent submissions from
 * one tenant cannot both slip under the quota.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "kiln.queue", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryJobQueue implements JobQueue {

    private static final Comparator<BuildJob> DISPATCH_ORDER = Comparator
        .comparingInt(BuildJob::getPriority)
        .thenComparingLong(BuildJob::getSequence);

    private final KilnProperties.QueueConfig config;
    private final RetryPolicy retryPolicy;
    private final PersistenceGuard persistence;
    private final BuildNotifier notifier;
    private final Clock clock;
    private final RateLimiter dispatchLimiter;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final PriorityQueue<BuildJob> ready = new PriorityQueue<>(DISPATCH_ORDER);
    private final Map<String, BuildJob> jobs = new LinkedHashMap<>();
    private final Map<String, DeadLetterRecord> deadLetters = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryJobQueue(KilnProperties properties, PersistenceGuard persistence,
                            BuildNotifier notifier, Clock clock) {
        this.config = properties.getQueue();
        this.retryPolicy = config.getRetry().toPolicy();
        this.persistence = persistence;
        this.notifier = notifier;
        this.clock = clock;
        this.dispatchLimiter = RateLimiter.create(config.getDispatchRatePerMinute() / 60.0);
        log.info("Job queue initialized: tenantQuota={}, maxSize={}, dispatchRate={}/min, maxAttempts={}",
            config.getTenantQuota(), config.getMaxSize(), config.getDispatchRatePerMinute(),
            retryPolicy.getMaxAttempts());
    }

    @Override
    public BuildJob submit(BuildJob job) {
        BuildJob admitted;
        lock.lock();
        try {
            if (jobs.containsKey(job.getId())) {
                throw new IllegalArgumentException("Job already exists: " + job.getId());
            }
            checkCapacity(job.getTenantKey());

            Instant now = clock.instant();
            admitted = job.snapshot().toBuilder()
                .priority(job.getTier().getPriority())
                .sequence(sequence.incrementAndGet())
                .attempts(0)
                .maxAttempts(job.getMaxAttempts() > 0 ? job.getMaxAttempts() : retryPolicy.getMaxAttempts())
                .state(JobState.QUEUED)
                .retryScheduled(false)
                .lastError(null)
                .submittedAt(now)
                .updatedAt(now)
                .build();

            jobs.put(admitted.getId(), admitted);
            ready.add(admitted);
            notEmpty.signal();
            admitted = admitted.snapshot();
        } finally {
            lock.unlock();
        }

        persistence.saveJobState(admitted);
        log.info("Job {} queued: tier={}, priority={}, tenant={}",
            admitted.getId(), admitted.getTier(), admitted.getPriority(), admitted.getTenantKey());
        return admitted;
    }

    /**
     * Caller holds the lock
     */
    private void checkCapacity(String tenantKey) {
        int backlog = 0;
        int tenantPending = 0;
        for (BuildJob existing : jobs.values()) {
            if (!existing.isPending()) {
                continue;
            }
            if (existing.getState() != JobState.ACTIVE) {
                backlog++;
            }
            if (tenantKey != null && tenantKey.equals(existing.getTenantKey())) {
                tenantPending++;
            }
        }
        if (backlog >= config.getMaxSize()) {
            log.warn("Job rejected: queue is full (size >= {})", config.getMaxSize());
            throw new QuotaExceededException("Queue is full, cannot accept more jobs");
        }
        if (tenantKey != null && tenantPending >= config.getTenantQuota()) {
            log.warn("Job rejected for tenant {}: {} pending builds (quota {})",
                tenantKey, tenantPending, config.getTenantQuota());
            throw new QuotaExceededException(
                "Maximum concurrent builds (" + config.getTenantQuota() + ") reached", tenantKey);
        }
    }

    @Override
    public BuildJob dequeue() throws InterruptedException {
        while (true) {
            awaitReady();
            dispatchLimiter.acquire();

            BuildJob dispatched = null;
            lock.lock();
            try {
                BuildJob next = ready.poll();
                if (next != null) {
                    next.setState(JobState.ACTIVE);
                    next.setUpdatedAt(clock.instant());
                    dispatched = next.snapshot();
                }
            } finally {
                lock.unlock();
            }

            if (dispatched != null) {
                persistence.saveJobState(dispatched);
                log.info("Dispatched job {} (priority {}, attempt {}/{})", dispatched.getId(),
                    dispatched.getPriority(), dispatched.getAttempts() + 1, dispatched.getMaxAttempts());
                return dispatched;
            }
            // another worker took it while we waited for a permit
        }
    }

    private void awaitReady() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (ready.isEmpty()) {
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reportResult(String jobId, BuildOutcome outcome) {
        BuildJob snapshot;
        Duration backoff = null;
        boolean deadLettered = false;

        lock.lock();
        try {
            BuildJob job = jobs.get(jobId);
            if (job == null) {
                throw new IllegalArgumentException("Job not found: " + jobId);
            }
            if (job.getState() != JobState.ACTIVE) {
                throw new IllegalStateException("Job " + jobId + " is not active: " + job.getState());
            }
            Instant now = clock.instant();
            job.setUpdatedAt(now);

            if (outcome.isSuccess()) {
                job.setState(JobState.COMPLETED);
                job.setLastError(null);
            } else if (outcome.isCancelled()) {
                job.setState(JobState.FAILED);
                job.setRetryScheduled(false);
                job.setLastError(outcome.getReason());
            } else {
                job.setAttempts(job.getAttempts() + 1);
                job.setLastError(outcome.getReason());
                if (job.getAttempts() < job.getMaxAttempts()) {
                    job.setState(JobState.FAILED);
                    job.setRetryScheduled(true);
                    backoff = retryPolicy.backoffFor(job.getAttempts());
                } else {
                    job.setState(JobState.DEAD_LETTERED);
                    job.setRetryScheduled(false);
                    deadLetters.put(jobId, DeadLetterRecord.builder()
                        .job(job.snapshot())
                        .reason(outcome.getReason())
                        .deadLetteredAt(now)
                        .build());
                    deadLettered = true;
                }
            }
            snapshot = job.snapshot();
        } finally {
            lock.unlock();
        }

        persistence.saveJobState(snapshot);

        if (outcome.isSuccess()) {
            log.info("Job {} completed", jobId);
        } else if (outcome.isCancelled()) {
            log.info("Job {} cancelled, not retrying", jobId);
        } else if (backoff != null) {
            log.info("Retrying job {} in {}ms (attempt {}/{}): {}", jobId, backoff.toMillis(),
                snapshot.getAttempts() + 1, snapshot.getMaxAttempts(), outcome.getReason());
            scheduleRetry(jobId, backoff);
        } else if (deadLettered) {
            log.warn("Job {} moved to dead letter queue after {} attempts: {}",
                jobId, snapshot.getAttempts(), outcome.getReason());
            notifier.publish(BuildEvent.builder()
                .buildId(jobId)
                .status(BuildEventType.DEAD_LETTERED)
                .reason(outcome.getReason())
                .attempt(snapshot.getAttempts())
                .timestamp(snapshot.getUpdatedAt())
                .build(), snapshot.getNotifications());
        }
    }

    /**
     * The backoff runs on a Reactor timer so a waiting job never holds a worker
     */
    private void scheduleRetry(String jobId, Duration backoff) {
        Mono.delay(backoff)
            .subscribe(
                tick -> requeue(jobId),
                error -> log.error("Retry timer failed for job {}", jobId, error));
    }

    private void requeue(String jobId) {
        BuildJob snapshot = null;
        lock.lock();
        try {
            BuildJob job = jobs.get(jobId);
            if (job != null && job.getState() == JobState.FAILED && job.isRetryScheduled()) {
                job.setState(JobState.QUEUED);
                job.setRetryScheduled(false);
                job.setUpdatedAt(clock.instant());
                ready.add(job);
                notEmpty.signal();
                snapshot = job.snapshot();
            }
        } finally {
            lock.unlock();
        }
        if (snapshot != null) {
            persistence.saveJobState(snapshot);
            log.info("Job {} re-queued after backoff", jobId);
        }
    }

    @Override
    public Optional<BuildJob> getStatus(String jobId) {
        lock.lock();
        try {
            BuildJob job = jobs.get(jobId);
            if (job != null) {
                return Optional.of(job.snapshot());
            }
        } finally {
            lock.unlock();
        }
        return persistence.loadJob(jobId);
    }

    @Override
    public List<DeadLetterRecord> deadLetters() {
        lock.lock();
        try {
            return new ArrayList<>(deadLetters.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BuildJob resubmit(String jobId) {
        BuildJob snapshot;
        lock.lock();
        try {
            BuildJob job = jobs.get(jobId);
            if (job == null || job.getState() != JobState.DEAD_LETTERED) {
                throw new IllegalArgumentException("Job is not dead-lettered: " + jobId);
            }
            checkCapacity(job.getTenantKey());

            deadLetters.remove(jobId);
            job.setAttempts(0);
            job.setLastError(null);
            job.setState(JobState.QUEUED);
            job.setSequence(sequence.incrementAndGet());
            job.setUpdatedAt(clock.instant());
            ready.add(job);
            notEmpty.signal();
            snapshot = job.snapshot();
        } finally {
            lock.unlock();
        }
        persistence.saveJobState(snapshot);
        log.info("Dead-lettered job {} resubmitted", jobId);
        return snapshot;
    }

    @Override
    public QueueStats stats() {
        QueueStats stats = new QueueStats();
        lock.lock();
        try {
            for (BuildJob job : jobs.values()) {
                switch (job.getState()) {
                    case QUEUED -> stats.setQueued(stats.getQueued() + 1);
                    case ACTIVE -> stats.setActive(stats.getActive() + 1);
                    case COMPLETED -> stats.setCompleted(stats.getCompleted() + 1);
                    case DEAD_LETTERED -> stats.setDeadLettered(stats.getDeadLettered() + 1);
                    case FAILED -> {
                        if (job.isRetryScheduled()) {
                            stats.setRetrying(stats.getRetrying() + 1);
                        } else {
                            stats.setFailed(stats.getFailed() + 1);
                        }
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        return stats;
    }

    @Override
    public List<String> purgeFinished(Instant cutoff) {
        List<String> purged = new ArrayList<>();
        lock.lock();
        try {
            jobs.values().removeIf(job -> {
                boolean expired = job.isFinished()
                    && job.getState() != JobState.DEAD_LETTERED
                    && job.getUpdatedAt().isBefore(cutoff);
                if (expired) {
                    purged.add(job.getId());
                }
                return expired;
            });
        } finally {
            lock.unlock();
        }
        if (!purged.isEmpty()) {
            log.info("Purged {} finished jobs last updated before {}", purged.size(), cutoff);
        }
        return purged;
    }
}
