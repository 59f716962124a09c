package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "UsageThresholdDto", description = "Whether usage of a feature crossed a warning threshold")
public record UsageThresholdDto(
        @Schema(description = "Feature key", example = "product_slot")
        String feature,

        @Schema(description = "True when usage/limit >= threshold", example = "true")
        boolean thresholdExceeded,

        @Schema(description = "Usage as a fraction of the limit", example = "0.8")
        double usagePercentage,

        @Schema(description = "Current usage", example = "40")
        int currentUsage,

        @Schema(description = "Limit snapshot, null for unlimited", example = "50", nullable = true)
        Integer limit,

        @Schema(description = "Warning shown to the user, null when not exceeded", nullable = true,
                example = "You are approaching your products limit (80% used)")
        String warningMessage
) {}
