package com.whereq.kiln.service;

import com.whereq.kiln.TestFixtures;
import com.whereq.kiln.cache.SpecHasher;
import com.whereq.kiln.cancellation.InMemoryCancellationRegistry;
import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.dto.BuildSubmitRequest;
import com.whereq.kiln.exception.InvalidSpecException;
import com.whereq.kiln.exception.QuotaExceededException;
import com.whereq.kiln.lifecycle.BuildLifecycleMachine;
import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildOutcome;
import com.whereq.kiln.model.BuildPhase;
import com.whereq.kiln.model.BuildSpec;
import com.whereq.kiln.model.JobState;
import com.whereq.kiln.model.Tier;
import com.whereq.kiln.persistence.InMemoryBuildPersistence;
import com.whereq.kiln.persistence.PersistenceGuard;
import com.whereq.kiln.queue.InMemoryJobQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BuildSubmissionServiceTest {

    private InMemoryJobQueue queue;
    private BuildLifecycleMachine lifecycle;
    private InMemoryCancellationRegistry cancellationRegistry;
    private AdmissionController admissionController;
    private BuildSubmissionService service;

    @BeforeEach
    void setUp() {
        KilnProperties properties = TestFixtures.properties();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.systemUTC();

        queue = new InMemoryJobQueue(properties,
            new PersistenceGuard(new InMemoryBuildPersistence(), meterRegistry), mock(BuildNotifier.class), clock);
        lifecycle = mock(BuildLifecycleMachine.class);
        when(lifecycle.getBuildPhase(anyString())).thenReturn(Optional.empty());
        cancellationRegistry = new InMemoryCancellationRegistry();
        admissionController = new AdmissionController();
        ReflectionTestUtils.setField(admissionController, "jobQueue", queue);
        ReflectionTestUtils.setField(admissionController, "meterRegistry", meterRegistry);
        admissionController.initialize();

        service = new BuildSubmissionService();
        ReflectionTestUtils.setField(service, "specValidator",
            new SpecValidator(Validation.buildDefaultValidatorFactory().getValidator()));
        ReflectionTestUtils.setField(service, "admissionController", admissionController);
        ReflectionTestUtils.setField(service, "jobQueue", queue);
        ReflectionTestUtils.setField(service, "lifecycle", lifecycle);
        ReflectionTestUtils.setField(service, "cancellationRegistry", cancellationRegistry);
        ReflectionTestUtils.setField(service, "specHasher", new SpecHasher());
        ReflectionTestUtils.setField(service, "clock", clock);
    }

    private BuildSubmitRequest request(Tier tier) {
        return BuildSubmitRequest.builder().spec(TestFixtures.spec()).tier(tier).build();
    }

    private String submit(BuildSubmitRequest request, String tenant) {
        return service.submit(request, tenant).block().getBuildId();
    }

    @Test
    void submit_validRequest_queuesNormalizedJob() {
        StepVerifier.create(service.submit(request(Tier.PREMIUM), "tenant"))
            .assertNext(response -> {
                assertThat(response.getBuildId()).startsWith("build-");
                assertEquals(JobState.QUEUED, response.getStatus());
                assertEquals(Tier.PREMIUM, response.getTier());
                assertEquals(1, response.getPriority());
                assertEquals(16, response.getSpecHash().length());

                BuildJob job = queue.getStatus(response.getBuildId()).orElseThrow();
                assertEquals(List.of("docker", "git", "python"), job.getSpec().getPackages());
                assertEquals(3, job.getMaxAttempts());
                assertEquals("tenant", job.getTenantKey());
            })
            .verifyComplete();
        assertEquals(1.0, admissionController.acceptedCount());
    }

    @Test
    void submit_missingTier_defaultsToFree() {
        BuildSubmitRequest request = request(null);

        StepVerifier.create(service.submit(request, null))
            .assertNext(response -> assertEquals(Tier.FREE, response.getTier()))
            .verifyComplete();
    }

    @Test
    void submit_invalidSpec_rejectedBeforeQueueing() {
        BuildSpec spec = TestFixtures.spec().toBuilder()
            .base(null)
            .packages(List.of("git", "rm -rf /"))
            .build();
        BuildSubmitRequest request = BuildSubmitRequest.builder().spec(spec).build();

        StepVerifier.create(service.submit(request, "tenant"))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(InvalidSpecException.class, e);
                List<String> violations = ((InvalidSpecException) e).getViolations();
                assertEquals(2, violations.size());
                assertThat(violations.get(0)).startsWith("spec.base");
                assertThat(violations.get(1)).startsWith("spec.packages[1]");
            })
            .verify();
        assertEquals(0, queue.stats().getQueued());
    }

    @Test
    void submit_missingSpec_rejected() {
        StepVerifier.create(service.submit(new BuildSubmitRequest(), "tenant"))
            .expectError(InvalidSpecException.class)
            .verify();
        StepVerifier.create(service.submit(null, "tenant"))
            .expectError(InvalidSpecException.class)
            .verify();
    }

    @Test
    void submit_overTenantQuota_rejected() {
        submit(request(Tier.FREE), "tenant");
        submit(request(Tier.FREE), "tenant");

        StepVerifier.create(service.submit(request(Tier.FREE), "tenant"))
            .expectError(QuotaExceededException.class)
            .verify();
        assertEquals(2.0, admissionController.acceptedCount());
        assertEquals(1.0, admissionController.rejectedCount());
    }

    @Test
    void getJobStatus_includesLifecyclePhase() {
        String id = submit(request(Tier.STANDARD), "tenant");
        when(lifecycle.getBuildPhase(id)).thenReturn(Optional.of(BuildPhase.RESOLVING));

        StepVerifier.create(service.getJobStatus(id))
            .assertNext(status -> {
                assertEquals(id, status.getBuildId());
                assertEquals(JobState.QUEUED, status.getStatus());
                assertEquals(BuildPhase.RESOLVING, status.getPhase());
            })
            .verifyComplete();
        StepVerifier.create(service.getJobStatus("unknown")).verifyComplete();
    }

    @Test
    void getBuildPhase_emptyBeforeDispatch() {
        StepVerifier.create(service.getBuildPhase("build-x")).verifyComplete();
    }

    @Test
    void requestCancellation_setsFlagOnce() {
        String id = submit(request(Tier.FREE), "tenant");

        StepVerifier.create(service.requestCancellation(id))
            .assertNext(response -> assertTrue(response.isNewlyRequested()))
            .verifyComplete();
        StepVerifier.create(service.requestCancellation(id))
            .assertNext(response -> assertFalse(response.isNewlyRequested()))
            .verifyComplete();
        assertTrue(cancellationRegistry.isCancelled(id));
    }

    @Test
    void requestCancellation_unknownOrFinishedBuild_rejected() throws Exception {
        StepVerifier.create(service.requestCancellation("unknown"))
            .expectError(IllegalArgumentException.class)
            .verify();

        String id = submit(request(Tier.FREE), "tenant");
        queue.dequeue();
        queue.reportResult(id, BuildOutcome.completed(id, List.of("ref"), false));

        StepVerifier.create(service.requestCancellation(id))
            .expectError(IllegalStateException.class)
            .verify();
        assertFalse(cancellationRegistry.isCancelled(id));
    }

    @Test
    void resubmit_deadLetteredBuild_clearsCancellationAndQueues() throws Exception {
        BuildSubmitRequest request = request(Tier.FREE);
        request.setMaxAttempts(1);
        String id = submit(request, "tenant");
        cancellationRegistry.request(id);
        queue.dequeue();
        queue.reportResult(id, BuildOutcome.failed(id, "broken"));

        StepVerifier.create(service.deadLetters())
            .assertNext(record -> assertEquals("broken", record.getReason()))
            .verifyComplete();

        StepVerifier.create(service.resubmit(id))
            .assertNext(response -> assertEquals(JobState.QUEUED, response.getStatus()))
            .verifyComplete();
        assertFalse(cancellationRegistry.isCancelled(id));
        StepVerifier.create(service.deadLetters()).verifyComplete();
    }

    @Test
    void resubmit_notDeadLettered_rejected() {
        String id = submit(request(Tier.FREE), "tenant");
        cancellationRegistry.request(id);

        StepVerifier.create(service.resubmit(id))
            .expectError(IllegalArgumentException.class)
            .verify();
        assertTrue(cancellationRegistry.isCancelled(id));
    }

    @Test
    void queueStats_reflectsQueue() {
        submit(request(Tier.FREE), "a");
        submit(request(Tier.FREE), "b");

        StepVerifier.create(service.queueStats())
            .assertNext(stats -> assertEquals(2, stats.getQueued()))
            .verifyComplete();
    }
}
