package com.whereq.kiln.lifecycle;

import com.whereq.kiln.model.ArtifactFormat;
import com.whereq.kiln.model.BuildSpec;
import com.whereq.kiln.model.Tier;
import com.whereq.kiln.model.TierLimits;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Working state of one build attempt, shared by the steps of that attempt.
 * Steps of one phase may run in parallel, so the mutable parts are synchronized.
 */
@Getter
public class BuildContext {

    private final String buildId;

    private final int attempt;

    /**
     * Normalized spec
     */
    private final BuildSpec spec;

    /**
     * Artifact cache key of the spec
     */
    private final String specHash;

    private final Tier tier;

    private final TierLimits limits;

    /**
     * Wall-clock budget of the attempt, enforced by the toolchain
     */
    private final Instant deadline;

    private List<String> resolvedPackages = List.of();
    private final Map<ArtifactFormat, String> localArtifacts = new EnumMap<>(ArtifactFormat.class);
    private final List<String> uploadedArtifacts = new ArrayList<>();
    private String cachedArtifact;

    public BuildContext(String buildId, int attempt, BuildSpec spec, String specHash,
                        Tier tier, TierLimits limits, Instant startedAt) {
        this.buildId = buildId;
        this.attempt = attempt;
        this.spec = spec;
        this.specHash = specHash;
        this.tier = tier;
        this.limits = limits;
        this.deadline = startedAt.plus(limits.getTimeout());
    }

    public synchronized List<String> getResolvedPackages() {
        return resolvedPackages;
    }

    public synchronized void setResolvedPackages(List<String> packages) {
        this.resolvedPackages = List.copyOf(packages);
    }

    public synchronized Map<ArtifactFormat, String> getLocalArtifacts() {
        return Collections.unmodifiableMap(new EnumMap<>(localArtifacts));
    }

    public synchronized void addLocalArtifact(ArtifactFormat format, String path) {
        localArtifacts.put(format, path);
    }

    public synchronized List<String> getUploadedArtifacts() {
        return List.copyOf(uploadedArtifacts);
    }

    public synchronized void addUploadedArtifacts(List<String> refs) {
        uploadedArtifacts.addAll(refs);
    }

    public synchronized String getCachedArtifact() {
        return cachedArtifact;
    }

    /**
     * Building is skipped; the upload phase reuses this reference
     */
    public synchronized void useCachedArtifact(String artifactRef) {
        this.cachedArtifact = artifactRef;
    }

    public synchronized boolean isCacheHit() {
        return cachedArtifact != null;
    }

    public boolean isPastDeadline(Instant now) {
        return now.isAfter(deadline);
    }
}
