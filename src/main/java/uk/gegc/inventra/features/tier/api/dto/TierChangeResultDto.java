package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "TierChangeResultDto", description = "Outcome of a plan transition")
public record TierChangeResultDto(
        UUID userId,

        @Schema(description = "False when the transition was a no-op", example = "true")
        boolean performed,

        @Schema(example = "free", nullable = true)
        SubscriptionPlan previousPlan,

        @Schema(example = "premium")
        SubscriptionPlan currentPlan,

        @Schema(nullable = true)
        LocalDateTime subscriptionExpiresAt
) {}
