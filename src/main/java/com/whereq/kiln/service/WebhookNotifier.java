package com.whereq.kiln.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.whereq.kiln.config.KilnProperties;
import com.whereq.kiln.model.BuildEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Service for sending webhook notifications
 */
@Slf4j
@Service
public class WebhookNotifier {

    static final String SIGNATURE_HEADER = "X-Kiln-Signature";

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private KilnProperties properties;

    /**
     * Notify webhook about a terminal build event
     *
     * @param webhookUrl webhook URL
     * @param event build event
     * @return Mono that completes when notification sent; delivery errors are logged, never propagated
     */
    public Mono<Void> notify(String webhookUrl, BuildEvent event) {
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            return Mono.empty();
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize webhook payload for build {}", event.getBuildId(), e);
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> {
                String signature = sign(body);
                if (signature != null) {
                    headers.set(SIGNATURE_HEADER, "sha256=" + signature);
                }
            })
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .timeout(properties.getNotifications().getWebhookTimeout())
            .doOnSuccess(response -> log.info("Webhook notification sent for build {}: {} - {}",
                event.getBuildId(), event.getStatus(), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for build {}: {}",
                event.getBuildId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // Don't fail the build if the webhook fails
            .then();
    }

    /**
     * HMAC-SHA256 of the body with the configured secret, null when unsigned
     */
    String sign(String body) {
        String secret = properties.getNotifications().getWebhookSecret();
        if (secret == null || secret.isEmpty()) {
            return null;
        }
        return Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8))
            .hashString(body, StandardCharsets.UTF_8)
            .toString();
    }
}
