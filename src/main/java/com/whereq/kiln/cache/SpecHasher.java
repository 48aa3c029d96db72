package com.whereq.kiln.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.hash.Hashing;
import com.whereq.kiln.model.BuildSpec;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Computes the cache key of a build spec over its canonical JSON form
 * (normalized values, properties and map keys in sorted order).
 */
@Component
public class SpecHasher {

    private static final int HASH_LENGTH = 16;

    private final ObjectMapper canonicalMapper;

    public SpecHasher() {
        this.canonicalMapper = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();
    }

    /**
     * @param spec build spec, normalized or not
     * @return hex digest prefix identifying the spec's canonical form
     */
    public String hash(BuildSpec spec) {
        return Hashing.sha256()
            .hashString(canonicalJson(spec), StandardCharsets.UTF_8)
            .toString()
            .substring(0, HASH_LENGTH);
    }

    String canonicalJson(BuildSpec spec) {
        try {
            return canonicalMapper.writeValueAsString(spec.normalized());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Build spec cannot be serialized", e);
        }
    }
}
