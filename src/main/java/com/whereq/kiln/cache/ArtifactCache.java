package com.whereq.kiln.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Content-addressed lookup from a normalized spec hash to a previously produced artifact
 */
public interface ArtifactCache {

    /**
     * Look up a live entry
     *
     * @param specHash hash of the normalized spec
     * @return Mono with the artifact reference, empty on miss or expiry
     */
    Mono<String> lookup(String specHash);

    /**
     * Store an artifact reference
     *
     * @param specHash hash of the normalized spec
     * @param artifactRef artifact reference
     * @param ttl lifetime of the entry
     * @return Mono that completes when stored
     */
    Mono<Void> store(String specHash, String artifactRef, Duration ttl);

    /**
     * Remove an entry
     *
     * @param specHash hash of the normalized spec
     * @return Mono with true if an entry was removed
     */
    Mono<Boolean> invalidate(String specHash);
}
