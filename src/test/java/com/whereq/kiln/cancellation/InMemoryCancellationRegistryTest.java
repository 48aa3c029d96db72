package com.whereq.kiln.cancellation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCancellationRegistryTest {

    private final InMemoryCancellationRegistry registry = new InMemoryCancellationRegistry();

    @Test
    void request_setsFlagOnce() {
        assertFalse(registry.isCancelled("b-1"));

        assertTrue(registry.request("b-1"));
        assertFalse(registry.request("b-1"));

        assertTrue(registry.isCancelled("b-1"));
        assertFalse(registry.isCancelled("b-2"));
    }

    @Test
    void forget_clearsFlag() {
        registry.request("b-1");

        registry.forget("b-1");

        assertFalse(registry.isCancelled("b-1"));
    }

    @Test
    void request_concurrentCallers_exactlyOneWins() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                calls.add(() -> registry.request("b-1"));
            }
            int winners = 0;
            for (Future<Boolean> result : pool.invokeAll(calls)) {
                if (result.get()) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }
}
