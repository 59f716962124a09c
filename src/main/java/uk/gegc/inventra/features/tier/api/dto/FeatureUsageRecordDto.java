package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "FeatureUsageRecordDto", description = "Stored usage counter")
public record FeatureUsageRecordDto(
        UUID id,
        UUID userId,
        String featureName,
        int currentUsage,
        Integer usageLimit,
        LocalDateTime lastResetAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
