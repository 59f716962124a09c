package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FeatureAvailabilityDto", description = "Whether a feature can be used now, with an upgrade hint")
public record FeatureAvailabilityDto(
        @Schema(description = "Human-readable feature name", example = "products")
        String displayName,

        @Schema(example = "true")
        boolean available,

        @Schema(example = "true")
        boolean enabled,

        @Schema(nullable = true, example = "50")
        Integer limit,

        @Schema(example = "12")
        int currentUsage,

        @Schema(nullable = true, example = "38")
        Integer remaining,

        @Schema(description = "Upgrade prompt for free users, null otherwise", nullable = true)
        String upgradeMessage
) {}
