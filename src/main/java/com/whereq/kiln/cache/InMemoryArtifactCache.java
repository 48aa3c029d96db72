package com.whereq.kiln.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local artifact cache. Expired entries are evicted lazily on read
 * or by {@link #evictExpired()}.
 */
@Slf4j
public class InMemoryArtifactCache implements ArtifactCache {

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Counter hitCounter;
    private final Counter missCounter;

    public InMemoryArtifactCache(Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.hitCounter = Counter.builder("kiln.cache.hits")
            .description("Artifact cache hits")
            .register(meterRegistry);
        this.missCounter = Counter.builder("kiln.cache.misses")
            .description("Artifact cache misses")
            .register(meterRegistry);
    }

    @Override
    public Mono<String> lookup(String specHash) {
        return Mono.fromSupplier(() -> {
            CacheEntry entry = entries.get(specHash);
            if (entry == null) {
                missCounter.increment();
                return null;
            }
            if (!entry.isLiveAt(clock.instant())) {
                entries.remove(specHash, entry);
                missCounter.increment();
                log.debug("Cache entry {} expired", specHash);
                return null;
            }
            hitCounter.increment();
            log.debug("Cache hit for {}", specHash);
            return entry.getValue();
        });
    }

    @Override
    public Mono<Void> store(String specHash, String artifactRef, Duration ttl) {
        return Mono.fromRunnable(() -> {
            entries.put(specHash, new CacheEntry(specHash, artifactRef, clock.instant(), ttl));
            log.info("Cached artifact {} under {} for {}", artifactRef, specHash, ttl);
        });
    }

    @Override
    public Mono<Boolean> invalidate(String specHash) {
        return Mono.fromSupplier(() -> entries.remove(specHash) != null);
    }

    /**
     * Drop every expired entry
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isLiveAt(clock.instant()));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }
}
