package com.whereq.kiln.persistence;

import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Wraps {@link BuildPersistence} so that write failures are logged and counted
 * instead of escaping into the queue or the lifecycle machine.
 */
@Slf4j
@Component
public class PersistenceGuard {

    private final BuildPersistence persistence;
    private final Counter failureCounter;

    public PersistenceGuard(BuildPersistence persistence, MeterRegistry meterRegistry) {
        this.persistence = persistence;
        this.failureCounter = Counter.builder("kiln.persistence.failures")
            .description("Persistence calls that failed and were skipped")
            .register(meterRegistry);
    }

    public boolean saveBuildPhase(String buildId, BuildPhase phase) {
        return guard(buildId, "saveBuildPhase(" + phase + ")", () -> persistence.saveBuildPhase(buildId, phase));
    }

    public boolean appendLog(String buildId, String message) {
        return guard(buildId, "appendLog", () -> persistence.appendLog(buildId, message));
    }

    public boolean saveJobState(BuildJob job) {
        return guard(job.getId(), "saveJobState(" + job.getState() + ")", () -> persistence.saveJobState(job));
    }

    public Optional<BuildJob> loadJob(String jobId) {
        try {
            return persistence.loadJob(jobId);
        } catch (RuntimeException e) {
            failureCounter.increment();
            log.warn("[{}] Persistence error (non-fatal) in loadJob: {}", jobId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public double failureCount() {
        return failureCounter.count();
    }

    private boolean guard(String id, String operation, Runnable call) {
        try {
            call.run();
            return true;
        } catch (RuntimeException e) {
            failureCounter.increment();
            log.warn("[{}] Persistence error (non-fatal) in {}: {}", id, operation, e.getMessage(), e);
            return false;
        }
    }
}
