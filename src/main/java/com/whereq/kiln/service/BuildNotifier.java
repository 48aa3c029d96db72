package com.whereq.kiln.service;

import com.whereq.kiln.model.BuildEvent;
import com.whereq.kiln.model.Notifications;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Emits terminal build events: in-process as Spring application events
 * (log streaming, chat-ops listeners) and to the request's webhook when configured.
 */
@Slf4j
@Service
public class BuildNotifier {

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    @Autowired
    private WebhookNotifier webhookNotifier;

    /**
     * Publish a terminal event. Never throws: notification problems must not
     * affect the build or the queue.
     *
     * @param event the event
     * @param notifications webhook configuration of the request, may be null
     */
    public void publish(BuildEvent event, Notifications notifications) {
        log.info("Build {} event {} (attempt {})", event.getBuildId(), event.getStatus(), event.getAttempt());
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Build event listener failed for build {}: {}", event.getBuildId(), e.getMessage(), e);
        }

        if (notifications != null && notifications.shouldNotify(event.getStatus())) {
            webhookNotifier.notify(notifications.getWebhook(), event).subscribe();
        }
    }
}
