package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(name = "IncrementResultDto", description = "Counter value after an increment")
public record IncrementResultDto(
        @Schema(description = "Feature key", example = "product_slot")
        String feature,

        @Schema(description = "Usage after the increment", example = "13")
        int currentUsage,

        @Schema(description = "Limit snapshot, null for unlimited", nullable = true)
        Integer limit,

        @Schema(description = "Time of the increment")
        LocalDateTime updatedAt
) {}
