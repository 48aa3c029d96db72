package com.whereq.kiln.executor;

import com.whereq.kiln.TestFixtures;
import com.whereq.kiln.cache.InMemoryArtifactCache;
import com.whereq.kiln.cache.SpecHasher;
import com.whereq.kiln.cancellation.InMemoryCancellationRegistry;
import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.lifecycle.BuildLifecycleMachine;
import com.whereq.kiln.lifecycle.SimulatedBuildToolchain;
import com.whereq.kiln.lifecycle.StandardStepPlanner;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildOutcome;
import com.whereq.kiln.model.JobState;
import com.whereq.kiln.model.Tier;
import com.whereq.kiln.persistence.InMemoryBuildPersistence;
import com.whereq.kiln.persistence.PersistenceGuard;
import com.whereq.kiln.queue.InMemoryJobQueue;
import com.whereq.kiln.queue.JobQueue;
import com.whereq.kiln.scheduler.DagStepScheduler;
import com.whereq.kiln.service.BuildNotifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BuildWorkerPoolTest {

    private KilnProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private BuildWorkerPool pool;
    private ExecutorService stepExecutor;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        properties.getWorkers().setEnabled(false);
        meterRegistry = new SimpleMeterRegistry();
        stepExecutor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop();
        }
        stepExecutor.shutdownNow();
    }

    /**
     * Workers only start when enabled in the properties at initialization
     */
    private BuildWorkerPool pool(JobQueue queue, BuildLifecycleMachine lifecycle) {
        BuildWorkerPool workerPool = new BuildWorkerPool();
        ReflectionTestUtils.setField(workerPool, "jobQueue", queue);
        ReflectionTestUtils.setField(workerPool, "lifecycle", lifecycle);
        ReflectionTestUtils.setField(workerPool, "properties", properties);
        ReflectionTestUtils.setField(workerPool, "meterRegistry", meterRegistry);
        workerPool.initialize();
        return workerPool;
    }

    @Test
    void process_lifecycleThrows_stillReportsFailure() {
        JobQueue queue = mock(JobQueue.class);
        BuildLifecycleMachine lifecycle = mock(BuildLifecycleMachine.class);
        when(lifecycle.run(any())).thenThrow(new IllegalStateException("worker bug"));
        pool = pool(queue, lifecycle);

        BuildOutcome outcome = pool.process(TestFixtures.job("j1", Tier.FREE, null));

        assertFalse(outcome.isSuccess());
        assertEquals("Internal error: worker bug", outcome.getReason());
        verify(queue).reportResult(eq("j1"), argThat(reported -> !reported.isSuccess()));
        assertEquals(1.0, meterRegistry.counter("kiln.builds.failed").count());
    }

    @Test
    void process_queueRejectsReport_doesNotThrow() {
        JobQueue queue = mock(JobQueue.class);
        BuildLifecycleMachine lifecycle = mock(BuildLifecycleMachine.class);
        when(lifecycle.run(any())).thenReturn(BuildOutcome.completed("j1", List.of("ref"), false));
        doThrow(new IllegalStateException("not active")).when(queue).reportResult(any(), any());
        pool = pool(queue, lifecycle);

        assertTrue(pool.process(TestFixtures.job("j1", Tier.FREE, null)).isSuccess());
        assertEquals(1.0, meterRegistry.counter("kiln.builds.succeeded").count());
    }

    @Test
    void process_lifecycleThrowsError_stillReportsFailure() {
        JobQueue queue = mock(JobQueue.class);
        BuildLifecycleMachine lifecycle = mock(BuildLifecycleMachine.class);
        when(lifecycle.run(any())).thenThrow(new AssertionError("cleanup blew up"));
        pool = pool(queue, lifecycle);

        BuildOutcome outcome = pool.process(TestFixtures.job("j1", Tier.FREE, null));

        assertFalse(outcome.isSuccess());
        assertEquals("Internal error: cleanup blew up", outcome.getReason());
        verify(queue).reportResult(eq("j1"), argThat(reported -> !reported.isSuccess()));
    }

    @Test
    void worker_survivesErrorAndTakesNextJob() throws Exception {
        JobQueue queue = mock(JobQueue.class);
        BuildJob first = TestFixtures.job("j1", Tier.FREE, null);
        BuildJob second = TestFixtures.job("j2", Tier.FREE, null);
        when(queue.dequeue()).thenReturn(first, second).thenAnswer(invocation -> {
            Thread.sleep(Long.MAX_VALUE);
            return null;
        });
        doThrow(new AssertionError("queue bug")).when(queue).reportResult(eq("j1"), any());

        BuildLifecycleMachine lifecycle = mock(BuildLifecycleMachine.class);
        when(lifecycle.run(first)).thenThrow(new StackOverflowError());
        when(lifecycle.run(second)).thenReturn(BuildOutcome.completed("j2", List.of("ref"), false));

        properties.getWorkers().setEnabled(true);
        properties.getWorkers().setPoolSize(1);
        pool = pool(queue, lifecycle);

        verify(queue, timeout(5000)).reportResult(eq("j2"), argThat(BuildOutcome::isSuccess));
        verify(queue).reportResult(eq("j1"), argThat(reported -> !reported.isSuccess()));
    }

    @Test
    void start_disabled_doesNothing() {
        pool = pool(mock(JobQueue.class), mock(BuildLifecycleMachine.class));

        pool.start();

        assertFalse(pool.isRunning());
    }

    @Test
    void workers_runQueuedJobsToCompletion() throws Exception {
        Clock clock = Clock.systemUTC();
        InMemoryCancellationRegistry cancellationRegistry = new InMemoryCancellationRegistry();
        PersistenceGuard persistence = new PersistenceGuard(new InMemoryBuildPersistence(), meterRegistry);
        BuildNotifier notifier = mock(BuildNotifier.class);
        SimulatedBuildToolchain toolchain = new SimulatedBuildToolchain(clock, Duration.ZERO);

        InMemoryJobQueue queue = new InMemoryJobQueue(properties, persistence, notifier, clock);
        BuildLifecycleMachine lifecycle = new BuildLifecycleMachine(
            new DagStepScheduler(stepExecutor, cancellationRegistry, clock),
            new StandardStepPlanner(toolchain), toolchain, new InMemoryArtifactCache(clock, meterRegistry),
            new SpecHasher(), cancellationRegistry, persistence, notifier, properties, clock);
        properties.getWorkers().setEnabled(true);
        pool = pool(queue, lifecycle);

        queue.submit(TestFixtures.job("j1", Tier.FREE, "t1"));
        queue.submit(TestFixtures.job("j2", Tier.PREMIUM, "t2"));
        BuildJob cancelled = TestFixtures.job("j3", Tier.STANDARD, "t3");
        cancellationRegistry.request("j3");
        queue.submit(cancelled);

        awaitFinished(queue, "j1", "j2", "j3");

        assertEquals(JobState.COMPLETED, queue.getStatus("j1").orElseThrow().getState());
        assertEquals(JobState.COMPLETED, queue.getStatus("j2").orElseThrow().getState());
        BuildJob j3 = queue.getStatus("j3").orElseThrow();
        assertEquals(JobState.FAILED, j3.getState());
        assertEquals("Cancelled", j3.getLastError());
        assertEquals(1.0, meterRegistry.counter("kiln.builds.cancelled").count());
    }

    private void awaitFinished(JobQueue queue, String... jobIds) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        for (String jobId : jobIds) {
            while (!queue.getStatus(jobId).orElseThrow().isFinished()) {
                if (System.currentTimeMillis() > deadline) {
                    fail("Job " + jobId + " did not finish: " + queue.getStatus(jobId).orElseThrow());
                }
                Thread.sleep(20);
            }
        }
    }
}
