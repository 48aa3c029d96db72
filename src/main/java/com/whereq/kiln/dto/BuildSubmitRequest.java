package com.whereq.kiln.dto;

import com.whereq.kiln.model.BuildSpec;
import com.whereq.kiln.model.Notifications;
import com.whereq.kiln.model.Tier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to build an operating system image
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildSubmitRequest {
    /**
     * What to build
     */
    @Valid
    @NotNull(message = "spec is required")
    private BuildSpec spec;

    /**
     * Service tier, decides priority and resource limits
     */
    @Builder.Default
    private Tier tier = Tier.FREE;

    /**
     * Webhook configuration (optional)
     */
    private Notifications notifications;

    /**
     * Override of the configured retry budget (optional)
     */
    @Min(1)
    @Max(10)
    private Integer maxAttempts;
}
