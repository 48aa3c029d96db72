package com.whereq.kiln.queue;

import com.whereq.kiln.exception.QuotaExceededException;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildOutcome;
import com.whereq.kiln.model.DeadLetterRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Priority job queue with per-tenant quota, dispatch rate limiting,
 * retry with exponential backoff and a dead-letter path
 */
public interface JobQueue {

    /**
     * Admit a job. Priority comes from its tier; equal priorities are served FIFO.
     *
     * @param job the job to admit, with id, spec, tier and tenant set
     * @return snapshot of the admitted job
     * @throws QuotaExceededException if the tenant already has its quota of pending jobs
     *                                or the global backlog is full
     */
    BuildJob submit(BuildJob job);

    /**
     * Take the most urgent queued job, blocking while the queue is empty
     * or the dispatch rate limit is exhausted. The job becomes ACTIVE.
     *
     * @return snapshot of the dispatched job
     * @throws InterruptedException if the calling worker is interrupted
     */
    BuildJob dequeue() throws InterruptedException;

    /**
     * Report the terminal result of an ACTIVE job. Failures are retried after a
     * backoff until the retry budget is spent, then dead-lettered.
     *
     * @param jobId job identifier
     * @param outcome result of the build
     */
    void reportResult(String jobId, BuildOutcome outcome);

    /**
     * @param jobId job identifier
     * @return snapshot of the job, empty if unknown or purged
     */
    Optional<BuildJob> getStatus(String jobId);

    /**
     * Jobs that exhausted their retry budget, oldest first
     */
    List<DeadLetterRecord> deadLetters();

    /**
     * Manually put a dead-lettered job back into the queue with a fresh retry budget
     *
     * @param jobId job identifier
     * @return snapshot of the re-admitted job
     * @throws IllegalArgumentException if the job is not dead-lettered
     * @throws QuotaExceededException if the tenant is at its quota
     */
    BuildJob resubmit(String jobId);

    QueueStats stats();

    /**
     * Forget finished jobs last updated before the cutoff. Dead-lettered jobs are kept.
     *
     * @param cutoff retention boundary
     * @return ids of the purged jobs
     */
    List<String> purgeFinished(Instant cutoff);
}
