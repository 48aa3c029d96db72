package com.whereq.kiln.service;

import com.whereq.kiln.model.BuildEvent;
import com.whereq.kiln.model.BuildEventType;
import com.whereq.kiln.model.Notifications;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BuildNotifierTest {

    private ApplicationEventPublisher eventPublisher;
    private WebhookNotifier webhookNotifier;
    private BuildNotifier notifier;

    private final BuildEvent event = BuildEvent.builder()
        .buildId("b1")
        .status(BuildEventType.COMPLETED)
        .artifacts(List.of("ref"))
        .attempt(1)
        .build();

    @BeforeEach
    void setUp() {
        eventPublisher = mock(ApplicationEventPublisher.class);
        webhookNotifier = mock(WebhookNotifier.class);
        when(webhookNotifier.notify(any(), any())).thenReturn(Mono.empty());
        notifier = new BuildNotifier();
        ReflectionTestUtils.setField(notifier, "eventPublisher", eventPublisher);
        ReflectionTestUtils.setField(notifier, "webhookNotifier", webhookNotifier);
    }

    @Test
    void publish_alwaysEmitsApplicationEvent() {
        notifier.publish(event, null);

        verify(eventPublisher).publishEvent(event);
        verifyNoInteractions(webhookNotifier);
    }

    @Test
    void publish_callsWebhookForSubscribedEvents() {
        Notifications notifications = new Notifications("https://hooks.example/kiln",
            List.of(BuildEventType.COMPLETED, BuildEventType.FAILED));

        notifier.publish(event, notifications);

        verify(webhookNotifier).notify("https://hooks.example/kiln", event);
    }

    @Test
    void publish_skipsWebhookForOtherEvents() {
        notifier.publish(event, new Notifications("https://hooks.example/kiln", List.of(BuildEventType.FAILED)));

        verify(webhookNotifier, never()).notify(any(), any());
    }

    @Test
    void publish_failingListener_doesNotThrow() {
        doThrow(new IllegalStateException("listener down")).when(eventPublisher).publishEvent(any(Object.class));

        assertDoesNotThrow(() -> notifier.publish(event, null));
    }
}
