package com.whereq.kiln.scheduler;

import com.whereq.kiln.cancellation.InMemoryCancellationRegistry;
import com.whereq.kiln.exception.BuildCancelledException;
import com.whereq.kiln.exception.StepExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DagStepSchedulerTest {

    private static final String BUILD = "build-1";

    private ExecutorService stepExecutor;
    private InMemoryCancellationRegistry cancellationRegistry;
    private DagStepScheduler scheduler;

    @BeforeEach
    void setUp() {
        stepExecutor = Executors.newFixedThreadPool(8);
        cancellationRegistry = new InMemoryCancellationRegistry();
        scheduler = new DagStepScheduler(stepExecutor, cancellationRegistry, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        stepExecutor.shutdownNow();
    }

    @Test
    @DisplayName("validate -> resolve -> build runs in dependency order")
    void execute_linearChain_runsInOrder() {
        List<String> order = new CopyOnWriteArrayList<>();

        DagExecutionResult result = scheduler.execute(BUILD, List.of(
            StepDefinition.of("build", ctx -> order.add("build"), "resolve"),
            StepDefinition.of("validate", ctx -> order.add("validate")),
            StepDefinition.of("resolve", ctx -> order.add("resolve"), "validate")), 4, StepListener.NONE);

        assertTrue(result.isSuccess());
        assertEquals(List.of("validate", "resolve", "build"), order);
        assertThat(result.getStepResults().values())
            .allMatch(state -> state.getStatus() == StepStatus.COMPLETED);
    }

    @Test
    void execute_neverStartsStepBeforeItsDependenciesComplete() {
        Set<String> completed = ConcurrentHashMap.newKeySet();
        List<String> violations = new CopyOnWriteArrayList<>();

        List<StepDefinition> steps = new ArrayList<>();
        steps.add(step("a", completed, violations, 30));
        steps.add(step("b", completed, violations, 10, "a"));
        steps.add(step("c", completed, violations, 20, "a"));
        steps.add(step("d", completed, violations, 5, "b", "c"));
        steps.add(step("e", completed, violations, 5));
        steps.add(step("f", completed, violations, 5, "d", "e"));

        DagExecutionResult result = scheduler.execute(BUILD, steps, 2, StepListener.NONE);

        assertTrue(result.isSuccess());
        assertTrue(violations.isEmpty(), violations::toString);
        assertEquals(Set.of("a", "b", "c", "d", "e", "f"), completed);
    }

    @Test
    void execute_runningStepsNeverExceedMaxConcurrency() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<StepDefinition> steps = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            steps.add(StepDefinition.of("s" + i, ctx -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(15);
                running.decrementAndGet();
            }));
        }

        DagExecutionResult result = scheduler.execute(BUILD, steps, 3, StepListener.NONE);

        assertTrue(result.isSuccess());
        assertThat(peak.get()).isBetween(1, 3);
    }

    @Test
    void execute_cyclicDependency_reportsDeadlock() {
        DagExecutionResult result = scheduler.execute(BUILD, List.of(
            StepDefinition.of("a", ctx -> { }, "b"),
            StepDefinition.of("b", ctx -> { }, "a")), 4, StepListener.NONE);

        assertFalse(result.isSuccess());
        assertTrue(result.isDeadlocked());
        assertEquals(Set.of("a", "b"), result.getBlockedSteps().keySet());
        assertThat(result.diagnostic()).contains("deadlock").contains("a waits on b[PENDING]");
    }

    @Test
    void execute_failedStep_leavesDependentPendingAndReportsIt() {
        DagExecutionResult result = scheduler.execute(BUILD, List.of(
            StepDefinition.of("resolve", ctx -> {
                throw new StepExecutionException("mirror unreachable");
            }),
            StepDefinition.of("build", ctx -> fail("must not run"), "resolve")), 4, StepListener.NONE);

        assertFalse(result.isSuccess());
        assertTrue(result.isDeadlocked());
        assertEquals(StepStatus.FAILED, result.getStepResults().get("resolve").getStatus());
        assertEquals("mirror unreachable", result.getStepResults().get("resolve").getError());
        assertEquals(StepStatus.PENDING, result.getStepResults().get("build").getStatus());
        assertThat(result.diagnostic())
            .contains("resolve (mirror unreachable)")
            .contains("build waits on resolve[FAILED]");
    }

    @Test
    void execute_failedStep_doesNotAbortRunningSibling() {
        DagExecutionResult result = scheduler.execute(BUILD, List.of(
            StepDefinition.of("fast-fail", ctx -> {
                throw new IllegalStateException("boom");
            }),
            StepDefinition.of("slow", ctx -> Thread.sleep(50))), 4, StepListener.NONE);

        assertEquals(DagExecutionResult.Outcome.FAILED, result.getOutcome());
        assertEquals(StepStatus.COMPLETED, result.getStepResults().get("slow").getStatus());
        assertTrue(result.getBlockedSteps().isEmpty());
    }

    @Test
    void execute_stepThrowsError_failsStepInsteadOfDeadlocking() {
        List<Throwable> reported = new CopyOnWriteArrayList<>();
        StepListener listener = new StepListener() {
            @Override
            public void onStepError(String buildId, StepDefinition step, Throwable error) {
                reported.add(error);
            }
        };

        DagExecutionResult result = scheduler.execute(BUILD, List.of(
            StepDefinition.of("a", ctx -> {
                throw new AssertionError("boom");
            })), 4, listener);

        assertEquals(DagExecutionResult.Outcome.FAILED, result.getOutcome());
        assertEquals(StepStatus.FAILED, result.getStepResults().get("a").getStatus());
        assertEquals("boom", result.getStepResults().get("a").getError());
        assertEquals(1, reported.size());
        assertInstanceOf(AssertionError.class, reported.get(0));
    }

    @Test
    void execute_missingDependency_reportsDeadlock() {
        DagExecutionResult result = scheduler.execute(BUILD, List.of(
            StepDefinition.of("build", ctx -> { }, "ghost")), 4, StepListener.NONE);

        assertTrue(result.isDeadlocked());
        assertThat(result.diagnostic()).contains("build waits on ghost[MISSING]");
    }

    @Test
    void execute_emptyStepSet_succeeds() {
        DagExecutionResult result = scheduler.execute(BUILD, List.of());

        assertTrue(result.isSuccess());
        assertTrue(result.getStepResults().isEmpty());
    }

    @Test
    void execute_launchesHeavierStepsFirst() {
        List<String> order = Collections.synchronizedList(new ArrayList<>());

        scheduler.execute(BUILD, List.of(
            StepDefinition.of("light", ctx -> order.add("light")),
            StepDefinition.of("heavy", ctx -> order.add("heavy")).withWeight(5),
            StepDefinition.of("medium", ctx -> order.add("medium")).withWeight(3),
            StepDefinition.of("light-2", ctx -> order.add("light-2"))), 1, StepListener.NONE);

        assertEquals(List.of("heavy", "medium", "light", "light-2"), order);
    }

    @Test
    void execute_invalidArguments_rejected() {
        List<StepDefinition> steps = List.of(StepDefinition.of("a", ctx -> { }));

        assertThrows(IllegalArgumentException.class,
            () -> scheduler.execute(BUILD, steps, 0, StepListener.NONE));
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.execute(BUILD, List.of(
                StepDefinition.of("a", ctx -> { }),
                StepDefinition.of("a", ctx -> { })), 4, StepListener.NONE));
        assertThrows(IllegalArgumentException.class,
            () -> StepDefinition.of("a", ctx -> { }).withWeight(0));
    }

    @Test
    void execute_cancellation_startsNoFurtherSteps() {
        List<String> started = new CopyOnWriteArrayList<>();

        List<StepDefinition> steps = List.of(
            StepDefinition.of("first", ctx -> {
                started.add("first");
                cancellationRegistry.request(ctx.getBuildId());
            }).withWeight(9),
            StepDefinition.of("second", ctx -> started.add("second")),
            StepDefinition.of("third", ctx -> started.add("third"), "second"));

        assertThrows(BuildCancelledException.class,
            () -> scheduler.execute(BUILD, steps, 1, StepListener.NONE));
        assertEquals(List.of("first"), started);
    }

    @Test
    void execute_alreadyCancelled_runsNothing() {
        cancellationRegistry.request(BUILD);
        List<String> started = new CopyOnWriteArrayList<>();

        assertThrows(BuildCancelledException.class, () -> scheduler.execute(BUILD,
            List.of(StepDefinition.of("a", ctx -> started.add("a")))));
        assertTrue(started.isEmpty());
    }

    @Test
    void execute_stepSeesCancellationThroughContext() {
        List<Boolean> seen = new CopyOnWriteArrayList<>();

        assertThrows(BuildCancelledException.class, () -> scheduler.execute(BUILD, List.of(
            StepDefinition.of("a", ctx -> {
                seen.add(ctx.isCancelled());
                cancellationRegistry.request(BUILD);
                seen.add(ctx.isCancelled());
            })), 1, StepListener.NONE));

        assertEquals(List.of(false, true), seen);
    }

    @Test
    void execute_failingListener_doesNotBreakExecution() {
        StepListener listener = new StepListener() {
            @Override
            public void onStepStart(String buildId, StepDefinition step) {
                throw new IllegalStateException("listener down");
            }
        };
        List<Long> durations = new CopyOnWriteArrayList<>();

        DagExecutionResult result = scheduler.execute(BUILD, List.of(
            StepDefinition.of("a", ctx -> durations.add(1L))), 1, listener);

        assertTrue(result.isSuccess());
        assertEquals(1, durations.size());
    }

    private StepDefinition step(String id, Set<String> completed, List<String> violations,
                                long sleepMs, String... dependencies) {
        return StepDefinition.of(id, ctx -> {
            for (String dep : dependencies) {
                if (!completed.contains(dep)) {
                    violations.add(id + " started before " + dep);
                }
            }
            Thread.sleep(sleepMs);
            completed.add(id);
        }, dependencies);
    }
}
