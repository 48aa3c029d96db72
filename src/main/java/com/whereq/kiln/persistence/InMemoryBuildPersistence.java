package com.whereq.kiln.persistence;

import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildPhase;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local persistence used when no external store is configured
 */
@Slf4j
public class InMemoryBuildPersistence implements BuildPersistence {

    private final Map<String, BuildPhase> phases = new ConcurrentHashMap<>();
    private final Map<String, List<String>> logs = new ConcurrentHashMap<>();
    private final Map<String, BuildJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void saveBuildPhase(String buildId, BuildPhase phase) {
        phases.put(buildId, phase);
    }

    @Override
    public void appendLog(String buildId, String message) {
        logs.computeIfAbsent(buildId, id -> new CopyOnWriteArrayList<>()).add(message);
    }

    @Override
    public Optional<BuildJob> loadJob(String jobId) {
        BuildJob job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.snapshot());
    }

    @Override
    public void saveJobState(BuildJob job) {
        jobs.put(job.getId(), job.snapshot());
    }

    public Optional<BuildPhase> getBuildPhase(String buildId) {
        return Optional.ofNullable(phases.get(buildId));
    }

    public List<String> getLogs(String buildId) {
        List<String> lines = logs.get(buildId);
        return lines == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(lines));
    }
}
