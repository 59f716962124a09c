package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "TierHistoryDto", description = "One recorded plan transition")
public record TierHistoryDto(
        @Schema(description = "History entry UUID")
        UUID id,

        @Schema(description = "User UUID")
        UUID userId,

        @Schema(description = "Plan before the change", example = "free", nullable = true)
        SubscriptionPlan previousPlan,

        @Schema(description = "Plan after the change", example = "premium")
        SubscriptionPlan newPlan,

        @Schema(description = "Why the plan changed", example = "upgrade")
        TierChangeReason changeReason,

        @Schema(description = "Actor that made the change, null for system changes", nullable = true)
        UUID changedBy,

        LocalDateTime effectiveDate,

        @Schema(nullable = true)
        String notes,

        LocalDateTime createdAt
) {}
