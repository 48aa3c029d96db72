package com.whereq.kiln.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Resource limits for a tier, enforced by step implementations
 * (container flags, subprocess timeout).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierLimits {

    /**
     * Memory limit, docker notation (e.g. "2g")
     */
    @Builder.Default
    private String memory = "2g";

    @Builder.Default
    private int cpus = 2;

    @Builder.Default
    private int pidsLimit = 100;

    /**
     * Wall-clock budget for a full build
     */
    @Builder.Default
    private Duration timeout = Duration.ofSeconds(1800);

    /**
     * Built-in limits for a tier
     */
    public static TierLimits defaultsFor(Tier tier) {
        return switch (tier) {
            case PREMIUM -> new TierLimits("8g", 8, 500, Duration.ofSeconds(7200));
            case STANDARD -> new TierLimits("4g", 4, 200, Duration.ofSeconds(3600));
            case FREE -> TierLimits.builder().build();
        };
    }
}
