package com.whereq.kiln.cache;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RedisArtifactCacheTest {

    private ReactiveRedisTemplate<String, String> template;
    private ReactiveValueOperations<String, String> values;
    private SimpleMeterRegistry meterRegistry;
    private RedisArtifactCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(ReactiveRedisTemplate.class);
        values = mock(ReactiveValueOperations.class);
        when(template.opsForValue()).thenReturn(values);
        meterRegistry = new SimpleMeterRegistry();
        cache = new RedisArtifactCache(template, meterRegistry);
    }

    @Test
    void store_setsKeyWithTtl() {
        when(values.set("kiln:artifact:abc", "ref", Duration.ofDays(7))).thenReturn(Mono.just(true));

        StepVerifier.create(cache.store("abc", "ref", Duration.ofDays(7))).verifyComplete();

        verify(values).set("kiln:artifact:abc", "ref", Duration.ofDays(7));
    }

    @Test
    void lookup_hit_countsHit() {
        when(values.get("kiln:artifact:abc")).thenReturn(Mono.just("ref"));

        StepVerifier.create(cache.lookup("abc")).expectNext("ref").verifyComplete();

        assertEquals(1.0, meterRegistry.counter("kiln.cache.hits").count());
        assertEquals(0.0, meterRegistry.counter("kiln.cache.misses").count());
    }

    @Test
    void lookup_missingKey_isEmptyAndCountsMiss() {
        when(values.get("kiln:artifact:abc")).thenReturn(Mono.empty());

        StepVerifier.create(cache.lookup("abc")).verifyComplete();

        assertEquals(1.0, meterRegistry.counter("kiln.cache.misses").count());
    }

    @Test
    void invalidate_deletesKey() {
        when(template.delete("kiln:artifact:abc")).thenReturn(Mono.just(1L));

        StepVerifier.create(cache.invalidate("abc")).expectNext(true).verifyComplete();
    }
}
