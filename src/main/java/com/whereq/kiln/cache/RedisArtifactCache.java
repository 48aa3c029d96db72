package com.whereq.kiln.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Artifact cache shared through Redis; expiry is left to Redis key TTLs
 */
@Slf4j
public class RedisArtifactCache implements ArtifactCache {

    static final String KEY_PREFIX = "kiln:artifact:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final Counter hitCounter;
    private final Counter missCounter;

    public RedisArtifactCache(ReactiveRedisTemplate<String, String> redisTemplate, MeterRegistry meterRegistry) {
        this.redisTemplate = redisTemplate;
        this.hitCounter = Counter.builder("kiln.cache.hits")
            .description("Artifact cache hits")
            .register(meterRegistry);
        this.missCounter = Counter.builder("kiln.cache.misses")
            .description("Artifact cache misses")
            .register(meterRegistry);
    }

    @Override
    public Mono<String> lookup(String specHash) {
        return redisTemplate.opsForValue()
            .get(KEY_PREFIX + specHash)
            .doOnNext(ref -> {
                hitCounter.increment();
                log.debug("Cache hit for {}", specHash);
            })
            .switchIfEmpty(Mono.fromRunnable(missCounter::increment));
    }

    @Override
    public Mono<Void> store(String specHash, String artifactRef, Duration ttl) {
        return redisTemplate.opsForValue()
            .set(KEY_PREFIX + specHash, artifactRef, ttl)
            .doOnSuccess(stored -> log.info("Cached artifact {} under {} for {}", artifactRef, specHash, ttl))
            .then();
    }

    @Override
    public Mono<Boolean> invalidate(String specHash) {
        return redisTemplate.delete(KEY_PREFIX + specHash)
            .map(deleted -> deleted > 0);
    }
}
