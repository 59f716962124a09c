package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FeatureUsageDto", description = "Current counter value and limit snapshot for one feature")
public record FeatureUsageDto(
        @Schema(description = "Current usage", example = "12")
        int current,

        @Schema(description = "Limit snapshot, null for unlimited", example = "50", nullable = true)
        Integer limit
) {}
