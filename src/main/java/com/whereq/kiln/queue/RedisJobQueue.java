package com.whereq.kiln.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveZSetOperations;
import org.springframework.data.redis.core.ZSetOperations.TypedTuple;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed job queue shared by every Kiln instance.
 *
 * <p>Layout:
 * <ul>
 *   <li>{@code kiln:queue:jobs} hash of job id to job JSON</li>
 *   <li>{@code kiln:queue:ready} sorted set of dispatchable job ids, scored by priority then sequence</li>
 *   <li>{@code kiln:queue:retry} sorted set of failed job ids, scored by the epoch millis their backoff ends</li>
 *   <li>{@code kiln:queue:dead-letter} hash of job id to dead letter JSON</li>
 *   <li>{@code kiln:queue:pending} hash of pending counters: the global backlog and one field per tenant</li>
 * </ul>
 *
 * <p>Quota slots are reserved with HINCRBY and released again when the
 * reservation overshoots, so concurrent submissions from several instances
 * cannot both slip under the quota. A job is only written by the worker that
 * holds it ACTIVE, or by the instance that promotes it out of the retry set.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "kiln.queue", name = "store", havingValue = "redis")
public class RedisJobQueue implements JobQueue {

    static final String JOBS_KEY = "kiln:queue:jobs";
    static final String READY_KEY = "kiln:queue:ready";
    static final String RETRY_KEY = "kiln:queue:retry";
    static final String DEAD_LETTER_KEY = "kiln:queue:dead-letter";
    static final String PENDING_KEY = "kiln:queue:pending";
    static final String SEQUENCE_KEY = "kiln:queue:sequence";
    static final String BACKLOG_FIELD = "backlog";

    /**
     * Sequence numbers stay below this, so priority dominates the score
     */
    static final double SEQUENCE_SPAN = 1e12;

    private static final Duration REDIS_TIMEOUT = Duration.ofSeconds(5);

    @Autowired
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private KilnProperties properties;

    @Autowired
    private PersistenceGuard persistence;

    @Autowired
    private BuildNotifier notifier;

    @Autowired
    private Clock clock;

    private KilnProperties.QueueConfig config;
    private RetryPolicy retryPolicy;
    private RateLimiter dispatchLimiter;

    @PostConstruct
    public void initialize() {
        config = properties.getQueue();
        retryPolicy = config.getRetry().toPolicy();
        dispatchLimiter = RateLimiter.create(config.getDispatchRatePerMinute() / 60.0);
        log.info("Redis job queue initialized: tenantQuota={}, maxSize={}, dispatchRate={}/min, maxAttempts={}",
            config.getTenantQuota(), config.getMaxSize(), config.getDispatchRatePerMinute(),
            retryPolicy.getMaxAttempts());
    }

    @Override
    public BuildJob submit(BuildJob job) {
        reserve(job.getTenantKey());

        Instant now = clock.instant();
        BuildJob admitted = job.snapshot().toBuilder()
            .priority(job.getTier().getPriority())
            .sequence(nextSequence())
            .attempts(0)
            .maxAttempts(job.getMaxAttempts() > 0 ? job.getMaxAttempts() : retryPolicy.getMaxAttempts())
            .state(JobState.QUEUED)
            .retryScheduled(false)
            .lastError(null)
            .submittedAt(now)
            .updatedAt(now)
            .build();

        Boolean created = await(hashOps().putIfAbsent(JOBS_KEY, admitted.getId(), toJson(admitted)));
        if (!Boolean.TRUE.equals(created)) {
            release(admitted.getTenantKey(), true);
            throw new IllegalArgumentException("Job already exists: " + admitted.getId());
        }
        await(zSetOps().add(READY_KEY, admitted.getId(), score(admitted)));

        persistence.saveJobState(admitted);
        log.info("Job {} queued: tier={}, priority={}, tenant={}",
            admitted.getId(), admitted.getTier(), admitted.getPriority(), admitted.getTenantKey());
        return admitted;
    }

    /**
     * Take one backlog slot and, for tenant jobs, one tenant slot
     */
    private void reserve(String tenantKey) {
        Long backlog = await(hashOps().increment(PENDING_KEY, BACKLOG_FIELD, 1));
        if (backlog != null && backlog > config.getMaxSize()) {
            await(hashOps().increment(PENDING_KEY, BACKLOG_FIELD, -1));
            log.warn("Job rejected: queue is full (size >= {})", config.getMaxSize());
            throw new QuotaExceededException("Queue is full, cannot accept more jobs");
        }
        if (tenantKey == null) {
            return;
        }
        Long pending = await(hashOps().increment(PENDING_KEY, tenantField(tenantKey), 1));
        if (pending != null && pending > config.getTenantQuota()) {
            release(tenantKey, true);
            log.warn("Job rejected for tenant {}: {} pending builds (quota {})",
                tenantKey, pending - 1, config.getTenantQuota());
            throw new QuotaExceededException(
                "Maximum concurrent builds (" + config.getTenantQuota() + ") reached", tenantKey);
        }
    }

    private void release(String tenantKey, boolean backlogSlot) {
        if (backlogSlot) {
            await(hashOps().increment(PENDING_KEY, BACKLOG_FIELD, -1));
        }
        if (tenantKey != null) {
            await(hashOps().increment(PENDING_KEY, tenantField(tenantKey), -1));
        }
    }

    @Override
    public BuildJob dequeue() throws InterruptedException {
        long pollMillis = config.getPollInterval().toMillis();
        while (true) {
            try {
                promoteDueRetries();

                Long waiting = await(zSetOps().size(READY_KEY));
                if (waiting == null || waiting == 0) {
                    Thread.sleep(pollMillis);
                    continue;
                }
                dispatchLimiter.acquire();

                TypedTuple<String> next = await(zSetOps().popMin(READY_KEY));
                if (next == null || next.getValue() == null) {
                    // another worker took it while we waited for a permit
                    continue;
                }
                BuildJob job = load(next.getValue()).orElse(null);
                if (job == null) {
                    log.warn("Dropping dispatch entry {} without a job record", next.getValue());
                    continue;
                }

                job.setState(JobState.ACTIVE);
                job.setUpdatedAt(clock.instant());
                save(job);
                await(hashOps().increment(PENDING_KEY, BACKLOG_FIELD, -1));

                persistence.saveJobState(job);
                log.info("Dispatched job {} (priority {}, attempt {}/{})", job.getId(),
                    job.getPriority(), job.getAttempts() + 1, job.getMaxAttempts());
                return job;
            } catch (RuntimeException e) {
                log.error("Polling the Redis job queue failed: {}", e.getMessage());
                Thread.sleep(pollMillis);
            }
        }
    }

    /**
     * Move failed jobs whose backoff has elapsed back into the ready set
     *
     * @return number of jobs re-queued
     */
    int promoteDueRetries() {
        List<String> due = await(zSetOps()
            .rangeByScore(RETRY_KEY, Range.closed(0d, (double) clock.millis()))
            .collectList());
        int requeued = 0;
        if (due == null) {
            return requeued;
        }
        for (String jobId : due) {
            // only the instance that removes the entry re-queues the job
            Long removed = await(zSetOps().remove(RETRY_KEY, jobId));
            if (removed != null && removed > 0 && requeue(jobId)) {
                requeued++;
            }
        }
        return requeued;
    }

    private boolean requeue(String jobId) {
        BuildJob job = load(jobId).orElse(null);
        if (job == null || job.getState() != JobState.FAILED || !job.isRetryScheduled()) {
            return false;
        }
        job.setState(JobState.QUEUED);
        job.setRetryScheduled(false);
        job.setUpdatedAt(clock.instant());
        save(job);
        await(zSetOps().add(READY_KEY, jobId, score(job)));
        persistence.saveJobState(job);
        log.info("Job {} re-queued after backoff", jobId);
        return true;
    }

    @Override
    public void reportResult(String jobId, BuildOutcome outcome) {
        BuildJob job = load(jobId)
            .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
        if (job.getState() != JobState.ACTIVE) {
            throw new IllegalStateException("Job " + jobId + " is not active: " + job.getState());
        }
        Instant now = clock.instant();
        job.setUpdatedAt(now);

        if (outcome.isSuccess()) {
            job.setState(JobState.COMPLETED);
            job.setLastError(null);
            save(job);
            release(job.getTenantKey(), false);
            log.info("Job {} completed", jobId);
        } else if (outcome.isCancelled()) {
            job.setState(JobState.FAILED);
            job.setRetryScheduled(false);
            job.setLastError(outcome.getReason());
            save(job);
            release(job.getTenantKey(), false);
            log.info("Job {} cancelled, not retrying", jobId);
        } else {
            job.setAttempts(job.getAttempts() + 1);
            job.setLastError(outcome.getReason());
            if (job.getAttempts() < job.getMaxAttempts()) {
                job.setState(JobState.FAILED);
                job.setRetryScheduled(true);
                Duration backoff = retryPolicy.backoffFor(job.getAttempts());
                save(job);
                // the job waits in the backlog again, its tenant slot stays taken
                await(hashOps().increment(PENDING_KEY, BACKLOG_FIELD, 1));
                await(zSetOps().add(RETRY_KEY, jobId, (double) now.plus(backoff).toEpochMilli()));
                log.info("Retrying job {} in {}ms (attempt {}/{}): {}", jobId, backoff.toMillis(),
                    job.getAttempts() + 1, job.getMaxAttempts(), outcome.getReason());
            } else {
                job.setState(JobState.DEAD_LETTERED);
                job.setRetryScheduled(false);
                save(job);
                DeadLetterRecord record = DeadLetterRecord.builder()
                    .job(job.snapshot())
                    .reason(outcome.getReason())
                    .deadLetteredAt(now)
                    .build();
                await(hashOps().put(DEAD_LETTER_KEY, jobId, toJson(record)));
                release(job.getTenantKey(), false);
                log.warn("Job {} moved to dead letter queue after {} attempts: {}",
                    jobId, job.getAttempts(), outcome.getReason());
                notifier.publish(BuildEvent.builder()
                    .buildId(jobId)
                    .status(BuildEventType.DEAD_LETTERED)
                    .reason(outcome.getReason())
                    .attempt(job.getAttempts())
                    .timestamp(now)
                    .build(), job.getNotifications());
            }
        }
        persistence.saveJobState(job);
    }

    @Override
    public Optional<BuildJob> getStatus(String jobId) {
        Optional<BuildJob> job = load(jobId);
        return job.isPresent() ? job : persistence.loadJob(jobId);
    }

    @Override
    public List<DeadLetterRecord> deadLetters() {
        List<String> values = await(hashOps().values(DEAD_LETTER_KEY).collectList());
        List<DeadLetterRecord> records = new ArrayList<>();
        if (values != null) {
            for (String json : values) {
                records.add(fromJson(json, DeadLetterRecord.class));
            }
        }
        records.sort(Comparator.comparing(DeadLetterRecord::getDeadLetteredAt));
        return records;
    }

    @Override
    public BuildJob resubmit(String jobId) {
        BuildJob job = load(jobId)
            .filter(candidate -> candidate.getState() == JobState.DEAD_LETTERED)
            .orElseThrow(() -> new IllegalArgumentException("Job is not dead-lettered: " + jobId));
        reserve(job.getTenantKey());

        await(hashOps().remove(DEAD_LETTER_KEY, jobId));
        job.setAttempts(0);
        job.setLastError(null);
        job.setState(JobState.QUEUED);
        job.setSequence(nextSequence());
        job.setUpdatedAt(clock.instant());
        save(job);
        await(zSetOps().add(READY_KEY, jobId, score(job)));

        persistence.saveJobState(job);
        log.info("Dead-lettered job {} resubmitted", jobId);
        return job;
    }

    @Override
    public QueueStats stats() {
        QueueStats stats = new QueueStats();
        for (BuildJob job : allJobs()) {
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
        return stats;
    }

    @Override
    public List<String> purgeFinished(Instant cutoff) {
        List<String> purged = new ArrayList<>();
        for (BuildJob job : allJobs()) {
            if (job.isFinished()
                && job.getState() != JobState.DEAD_LETTERED
                && job.getUpdatedAt().isBefore(cutoff)) {
                await(hashOps().remove(JOBS_KEY, job.getId()));
                purged.add(job.getId());
            }
        }
        if (!purged.isEmpty()) {
            log.info("Purged {} finished jobs last updated before {}", purged.size(), cutoff);
        }
        return purged;
    }

    static double score(BuildJob job) {
        return job.getPriority() * SEQUENCE_SPAN + job.getSequence();
    }

    private static String tenantField(String tenantKey) {
        return "tenant:" + tenantKey;
    }

    private long nextSequence() {
        Long next = await(redisTemplate.opsForValue().increment(SEQUENCE_KEY));
        if (next == null) {
            throw new IllegalStateException("Redis returned no job sequence");
        }
        return next;
    }

    private List<BuildJob> allJobs() {
        List<String> values = await(hashOps().values(JOBS_KEY).collectList());
        List<BuildJob> jobs = new ArrayList<>();
        if (values != null) {
            for (String json : values) {
                jobs.add(fromJson(json, BuildJob.class));
            }
        }
        return jobs;
    }

    private Optional<BuildJob> load(String jobId) {
        String json = await(hashOps().get(JOBS_KEY, jobId));
        return json == null ? Optional.empty() : Optional.of(fromJson(json, BuildJob.class));
    }

    private void save(BuildJob job) {
        await(hashOps().put(JOBS_KEY, job.getId(), toJson(job)));
    }

    private ReactiveHashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }

    private ReactiveZSetOperations<String, String> zSetOps() {
        return redisTemplate.opsForZSet();
    }

    private static <T> T await(Mono<T> operation) {
        return operation.block(REDIS_TIMEOUT);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
