package com.whereq.kiln.cancellation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation flags held in a concurrent set
 */
@Slf4j
@Component
public class InMemoryCancellationRegistry implements CancellationRegistry {

    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    @Override
    public boolean request(String buildId) {
        boolean added = cancelled.add(buildId);
        if (added) {
            log.info("Cancellation requested for build {}", buildId);
        } else {
            log.debug("Cancellation already requested for build {}", buildId);
        }
        return added;
    }

    @Override
    public boolean isCancelled(String buildId) {
        return cancelled.contains(buildId);
    }

    @Override
    public void forget(String buildId) {
        cancelled.remove(buildId);
    }
}
