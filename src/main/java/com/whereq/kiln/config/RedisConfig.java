package com.whereq.kiln.config;

import com.whereq.kiln.cache.ArtifactCache;
import com.whereq.kiln.cache.RedisArtifactCache;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the shared job queue and artifact cache
 */
@Configuration
public class RedisConfig {

    @Bean
    public ReactiveRedisTemplate<String, String> reactiveRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {

        RedisSerializationContext<String, String> serializationContext =
            RedisSerializationContext.<String, String>newSerializationContext(new StringRedisSerializer())
                .hashKey(new StringRedisSerializer())
                .hashValue(new StringRedisSerializer())
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kiln.cache", name = "store", havingValue = "redis")
    public ArtifactCache redisArtifactCache(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                                            MeterRegistry meterRegistry) {
        return new RedisArtifactCache(reactiveRedisTemplate, meterRegistry);
    }
}
