package com.whereq.kiln.cache;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached artifact reference with its lifetime
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private String key;

    private String value;

    private Instant createdAt;

    private Duration ttl;

    /**
     * A hit is honored only while {@code now < createdAt + ttl}
     */
    public boolean isLiveAt(Instant now) {
        return now.isBefore(createdAt.plus(ttl));
    }
}
