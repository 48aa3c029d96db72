package com.whereq.kiln.service;

import com.whereq.kiln.cache.SpecHasher;
import com.whereq.kiln.cancellation.CancellationRegistry;
import com.whereq.kiln.dto.BuildCancellationResponse;
import com.whereq.kiln.dto.BuildSubmitRequest;
import com.whereq.kiln.dto.BuildSubmitResponse;
import com.whereq.kiln.dto.JobStatusResponse;
import com.whereq.kiln.lifecycle.BuildLifecycleMachine;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildPhase;
import com.whereq.kiln.model.DeadLetterRecord;
import com.whereq.kiln.model.JobState;
import com.whereq.kiln.model.Tier;
import com.whereq.kiln.queue.JobQueue;
import com.whereq.kiln.queue.QueueStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Submission, query and cancellation operations of the build service
 */
@Slf4j
@Service
public class BuildSubmissionService {

    @Autowired
    private SpecValidator specValidator;

    @Autowired
    private AdmissionController admissionController;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private BuildLifecycleMachine lifecycle;

    @Autowired
    private CancellationRegistry cancellationRegistry;

    @Autowired
    private SpecHasher specHasher;

    @Autowired
    private Clock clock;

    /**
     * Submit a build for async execution
     *
     * @param request build request
     * @param tenantKey tenant the build is accounted to, null for no quota
     * @return Mono with submission response; fails with InvalidSpecException or QuotaExceededException
     */
    public Mono<BuildSubmitResponse> submit(BuildSubmitRequest request, String tenantKey) {
        return Mono.fromCallable(() -> {
                specValidator.validate(request);
                return BuildJob.builder()
                    .id(generateBuildId())
                    .spec(request.getSpec().normalized())
                    .tenantKey(tenantKey)
                    .tier(request.getTier() != null ? request.getTier() : Tier.FREE)
                    // 0 lets the queue apply the configured retry budget
                    .maxAttempts(request.getMaxAttempts() != null ? request.getMaxAttempts() : 0)
                    .notifications(request.getNotifications())
                    .build();
            })
            .flatMap(admissionController::admitJob)
            .map(this::toSubmitResponse)
            .doOnSuccess(response -> log.info("Build {} submitted by tenant {}", response.getBuildId(), tenantKey))
            .doOnError(e -> log.warn("Build submission failed for tenant {}: {}", tenantKey, e.getMessage()));
    }

    /**
     * @return Mono with the job status, empty if the job is unknown or purged
     */
    public Mono<JobStatusResponse> getJobStatus(String jobId) {
        return Mono.defer(() -> Mono.justOrEmpty(jobQueue.getStatus(jobId)))
            .map(job -> JobStatusResponse.from(job, lifecycle.getBuildPhase(jobId).orElse(null)));
    }

    /**
     * @return Mono with the lifecycle phase, empty if the build never started or was purged
     */
    public Mono<BuildPhase> getBuildPhase(String buildId) {
        return Mono.defer(() -> Mono.justOrEmpty(lifecycle.getBuildPhase(buildId)));
    }

    /**
     * Request cooperative cancellation of a build. Queued builds fail when dispatched,
     * running builds stop before their next phase or step.
     *
     * @return Mono with the cancellation response; fails with IllegalArgumentException for
     * unknown builds and IllegalStateException for finished ones
     */
    public Mono<BuildCancellationResponse> requestCancellation(String buildId) {
        return Mono.fromCallable(() -> {
                BuildJob job = jobQueue.getStatus(buildId)
                    .orElseThrow(() -> new IllegalArgumentException("Build not found: " + buildId));
                if (job.isFinished()) {
                    throw new IllegalStateException("Cannot cancel build in terminal state: " + job.getState());
                }
                boolean newlyRequested = cancellationRegistry.request(buildId);
                return BuildCancellationResponse.builder()
                    .buildId(buildId)
                    .newlyRequested(newlyRequested)
                    .requestedAt(clock.instant())
                    .message(newlyRequested ? "Cancellation requested" : "Cancellation already requested")
                    .build();
            })
            .doOnSuccess(response -> log.info("Cancellation of build {} requested", buildId))
            .doOnError(e -> log.warn("Failed to cancel build {}: {}", buildId, e.getMessage()));
    }

    public Flux<DeadLetterRecord> deadLetters() {
        return Flux.defer(() -> Flux.fromIterable(jobQueue.deadLetters()));
    }

    /**
     * Put a dead-lettered build back into the queue with a fresh retry budget
     */
    public Mono<BuildSubmitResponse> resubmit(String jobId) {
        return Mono.fromCallable(() -> {
                jobQueue.getStatus(jobId)
                    .filter(job -> job.getState() == JobState.DEAD_LETTERED)
                    .orElseThrow(() -> new IllegalArgumentException("Build is not dead-lettered: " + jobId));
                // a stale flag would cancel the fresh attempt
                cancellationRegistry.forget(jobId);
                return jobQueue.resubmit(jobId);
            })
            .map(this::toSubmitResponse)
            .doOnSuccess(response -> log.info("Build {} resubmitted from dead letter queue", jobId))
            .doOnError(e -> log.warn("Resubmission of build {} failed: {}", jobId, e.getMessage()));
    }

    public Mono<QueueStats> queueStats() {
        return Mono.fromCallable(jobQueue::stats);
    }

    private BuildSubmitResponse toSubmitResponse(BuildJob job) {
        return BuildSubmitResponse.builder()
            .buildId(job.getId())
            .status(job.getState())
            .tier(job.getTier())
            .priority(job.getPriority())
            .specHash(specHasher.hash(job.getSpec()))
            .submittedAt(job.getSubmittedAt())
            .build();
    }

    /**
     * Generate unique build ID
     */
    private String generateBuildId() {
        return "build-" + UUID.randomUUID();
    }
}
