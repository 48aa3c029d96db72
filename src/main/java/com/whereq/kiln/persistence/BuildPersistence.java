package com.whereq.kiln.persistence;

import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildPhase;

import java.util.Optional;

/**
 * Durable store for build and job records, supplied by the surrounding system.
 * Calls are synchronous and may fail; callers go through {@link PersistenceGuard}.
 */
public interface BuildPersistence {

    void saveBuildPhase(String buildId, BuildPhase phase);

    void appendLog(String buildId, String message);

    Optional<BuildJob> loadJob(String jobId);

    void saveJobState(BuildJob job);
}
