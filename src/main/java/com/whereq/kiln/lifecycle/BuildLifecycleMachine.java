package com.whereq.kiln.lifecycle;

import com.whereq.kiln.cache.ArtifactCache;
import com.whereq.kiln.cache.SpecHasher;
import com.whereq.kiln.cancellation.CancellationRegistry;
import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.exception.BuildCancelledException;
import com.whereq.kiln.exception.PhaseFailedException;
import com.whereq.kiln.model.BuildEvent;
import com.whereq.kiln.model.BuildEventType;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildOutcome;
import com.whereq.kiln.model.BuildPhase;
import com.whereq.kiln.model.BuildRecord;
import com.whereq.kiln.persistence.PersistenceGuard;
import com.whereq.kiln.scheduler.DagExecutionResult;
import com.whereq.kiln.scheduler.DagStepScheduler;
import com.whereq.kiln.scheduler.StepDefinition;
import com.whereq.kiln.scheduler.StepListener;
import com.whereq.kiln.service.BuildNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one build attempt through its phases.
 *
 * <p>Each working phase runs its step DAG on the {@link DagStepScheduler} and only
 * completes when every step completed. Before {@link BuildPhase#BUILDING} the
 * artifact cache is consulted; a hit jumps straight to {@link BuildPhase#UPLOADING}
 * with the cached reference. Cancellation is checked before every phase and inside
 * the scheduler. Any phase failure moves the build to {@link BuildPhase#FAILED};
 * earlier phases are not rolled back.
 *
 * <p>{@link #run(BuildJob)} never throws: the result is always a {@link BuildOutcome}.
 */
@Slf4j
@Service
public class BuildLifecycleMachine {

    private static final List<BuildPhase> WORK_PHASES = List.of(
        BuildPhase.PARSING,
        BuildPhase.VALIDATING,
        BuildPhase.RESOLVING,
        BuildPhase.GENERATING,
        BuildPhase.BUILDING,
        BuildPhase.ARTIFACT_GENERATING,
        BuildPhase.UPLOADING);

    private static final Duration CACHE_CALL_TIMEOUT = Duration.ofSeconds(5);

    private final DagStepScheduler scheduler;
    private final StepPlanner planner;
    private final BuildToolchain toolchain;
    private final ArtifactCache artifactCache;
    private final SpecHasher specHasher;
    private final CancellationRegistry cancellationRegistry;
    private final PersistenceGuard persistence;
    private final BuildNotifier notifier;
    private final KilnProperties properties;
    private final Clock clock;

    private final Map<String, BuildRecord> records = new ConcurrentHashMap<>();

    public BuildLifecycleMachine(DagStepScheduler scheduler, StepPlanner planner, BuildToolchain toolchain,
                                 ArtifactCache artifactCache, SpecHasher specHasher,
                                 CancellationRegistry cancellationRegistry, PersistenceGuard persistence,
                                 BuildNotifier notifier, KilnProperties properties, Clock clock) {
        this.scheduler = scheduler;
        this.planner = planner;
        this.toolchain = toolchain;
        this.artifactCache = artifactCache;
        this.specHasher = specHasher;
        this.cancellationRegistry = cancellationRegistry;
        this.persistence = persistence;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Run one attempt of a dispatched job to a terminal phase.
     *
     * @param job snapshot of the ACTIVE job
     * @return terminal outcome to report to the queue
     */
    public BuildOutcome run(BuildJob job) {
        String buildId = job.getId();
        int attempt = job.getAttempts() + 1;
        Instant startedAt = clock.instant();

        BuildRecord record = new BuildRecord(buildId, attempt, startedAt);
        records.put(buildId, record);
        persistence.saveBuildPhase(buildId, BuildPhase.PENDING);

        BuildContext context = new BuildContext(buildId, attempt, job.getSpec(), specHasher.hash(job.getSpec()),
            job.getTier(), properties.limitsFor(job.getTier()), startedAt);

        log.info("[{}] Starting build attempt {}/{} (tier={}, specHash={})",
            buildId, attempt, job.getMaxAttempts(), job.getTier(), context.getSpecHash());
        persistence.appendLog(buildId, "Build attempt " + attempt + " started");

        try {
            BuildOutcome outcome = runPhases(record, context);
            notifyTerminal(job, record, outcome);
            return outcome;
        } finally {
            cleanup(context);
        }
    }

    private BuildOutcome runPhases(BuildRecord record, BuildContext context) {
        String buildId = context.getBuildId();
        try {
            Map<BuildPhase, List<StepDefinition>> plan = planner.plan(context);

            for (BuildPhase phase : WORK_PHASES) {
                checkCancelled(buildId);

                if (phase == BuildPhase.BUILDING) {
                    lookupCachedArtifact(record, context);
                }
                if (context.isCacheHit()
                    && (phase == BuildPhase.BUILDING || phase == BuildPhase.ARTIFACT_GENERATING)) {
                    continue;
                }

                enter(record, phase);
                runPhase(context, phase, plan.getOrDefault(phase, List.of()));
            }

            List<String> artifacts = context.getUploadedArtifacts();
            record.addArtifacts(artifacts);
            enter(record, BuildPhase.COMPLETE);
            if (!context.isCacheHit()) {
                storeArtifact(context, artifacts);
            }

            Duration took = Duration.between(record.getCreatedAt(), clock.instant());
            log.info("[{}] Build complete in {}ms: artifacts={}, cacheHit={}",
                buildId, took.toMillis(), artifacts, context.isCacheHit());
            persistence.appendLog(buildId, "Build complete: " + String.join(", ", artifacts));
            return BuildOutcome.completed(buildId, artifacts, context.isCacheHit());

        } catch (BuildCancelledException e) {
            BuildPhase reached = record.getPhase();
            fail(record, "Cancelled", true);
            log.info("[{}] Build cancelled in phase {}", buildId, reached);
            return BuildOutcome.cancelled(buildId);

        } catch (PhaseFailedException e) {
            String reason = e.getMessage();
            fail(record, reason, false);
            log.error("[{}] Build failed: {}", buildId, reason);
            return BuildOutcome.failed(buildId, reason);

        } catch (RuntimeException e) {
            String reason = "Unexpected error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            fail(record, reason, false);
            log.error("[{}] Build failed unexpectedly", buildId, e);
            return BuildOutcome.failed(buildId, reason);
        }
    }

    private void runPhase(BuildContext context, BuildPhase phase, List<StepDefinition> steps) {
        if (steps.isEmpty()) {
            return;
        }
        DagExecutionResult result = scheduler.execute(context.getBuildId(), steps,
            properties.getScheduler().getMaxConcurrency(), new PersistingStepListener());
        if (!result.isSuccess()) {
            // a step can fail because it saw the cancellation before the scheduler did
            checkCancelled(context.getBuildId());
            throw new PhaseFailedException(phase, result.diagnostic());
        }
        log.debug("[{}] Phase {} finished in {}ms", context.getBuildId(), phase,
            result.getTotalDuration().toMillis());
    }

    private void enter(BuildRecord record, BuildPhase phase) {
        record.advanceTo(phase, clock.instant());
        log.info("[{}] Phase -> {}", record.getBuildId(), phase);
        persistence.saveBuildPhase(record.getBuildId(), phase);
        persistence.appendLog(record.getBuildId(), "Phase " + phase);
    }

    private void fail(BuildRecord record, String reason, boolean cancelled) {
        record.fail(reason, cancelled, clock.instant());
        persistence.saveBuildPhase(record.getBuildId(), BuildPhase.FAILED);
        persistence.appendLog(record.getBuildId(), (cancelled ? "Build cancelled: " : "Build failed: ") + reason);
    }

    private void checkCancelled(String buildId) {
        if (cancellationRegistry.isCancelled(buildId)) {
            throw new BuildCancelledException(buildId);
        }
    }

    /**
     * Cache errors are treated as a miss
     */
    private void lookupCachedArtifact(BuildRecord record, BuildContext context) {
        try {
            String cached = artifactCache.lookup(context.getSpecHash()).block(CACHE_CALL_TIMEOUT);
            if (cached != null) {
                context.useCachedArtifact(cached);
                record.markCacheHit();
                log.info("[{}] Artifact cache hit for spec {}: {}", context.getBuildId(), context.getSpecHash(), cached);
                persistence.appendLog(context.getBuildId(), "Reusing cached artifact " + cached);
            }
        } catch (RuntimeException e) {
            log.warn("[{}] Artifact cache lookup failed, building from scratch: {}",
                context.getBuildId(), e.getMessage());
        }
    }

    private void storeArtifact(BuildContext context, List<String> artifacts) {
        if (artifacts.isEmpty()) {
            return;
        }
        try {
            artifactCache.store(context.getSpecHash(), artifacts.get(0), properties.getCache().getArtifactTtl())
                .block(CACHE_CALL_TIMEOUT);
        } catch (RuntimeException e) {
            log.warn("[{}] Could not cache artifact for spec {}: {}",
                context.getBuildId(), context.getSpecHash(), e.getMessage());
        }
    }

    private void notifyTerminal(BuildJob job, BuildRecord record, BuildOutcome outcome) {
        notifier.publish(BuildEvent.builder()
            .buildId(record.getBuildId())
            .status(outcome.getStatus())
            .artifacts(outcome.getArtifacts())
            .reason(outcome.getReason())
            .attempt(record.getAttempt())
            .timestamp(record.getUpdatedAt())
            .build(), job.getNotifications());
    }

    private void cleanup(BuildContext context) {
        try {
            toolchain.cleanup(context);
        } catch (RuntimeException e) {
            log.warn("[{}] Workspace cleanup failed: {}", context.getBuildId(), e.getMessage());
        }
    }

    /**
     * Phase of the current or last attempt of a build
     */
    public Optional<BuildPhase> getBuildPhase(String buildId) {
        return getRecord(buildId).map(BuildRecord::getPhase);
    }

    public Optional<BuildRecord> getRecord(String buildId) {
        return Optional.ofNullable(records.get(buildId));
    }

    /**
     * Forget terminal build records last updated before the cutoff
     *
     * @return number of records removed
     */
    public int purgeRecords(Instant cutoff) {
        int before = records.size();
        records.values().removeIf(r -> r.getPhase().isTerminal() && r.getUpdatedAt().isBefore(cutoff));
        return before - records.size();
    }

    private class PersistingStepListener implements StepListener {

        @Override
        public void onStepStart(String buildId, StepDefinition step) {
            persistence.appendLog(buildId, "Step " + step.getName() + " started");
        }

        @Override
        public void onStepComplete(String buildId, StepDefinition step, long durationMs) {
            persistence.appendLog(buildId, "Step " + step.getName() + " completed in " + durationMs + "ms");
        }

        @Override
        public void onStepError(String buildId, StepDefinition step, Throwable error) {
            persistence.appendLog(buildId, "Step " + step.getName() + " failed: " + error.getMessage());
        }
    }
}
