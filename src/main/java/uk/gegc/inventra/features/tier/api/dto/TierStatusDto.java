package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionState;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Schema(name = "TierStatusDto", description = "Derived subscription status of a user")
public record TierStatusDto(
        @Schema(description = "User UUID")
        UUID userId,

        @Schema(description = "Current subscription plan", example = "premium")
        SubscriptionPlan subscriptionPlan,

        @Schema(description = "Subscription expiry, null when not set", nullable = true)
        LocalDateTime subscriptionExpiresAt,

        @Schema(description = "Whether the account is active", example = "true")
        boolean isActive,

        @Schema(description = "Whole days until expiry, rounded up; negative once expired", example = "12", nullable = true)
        Long daysUntilExpiration,

        @Schema(description = "True when expired and still inside the grace period", example = "false")
        boolean gracePeriodActive,

        @Schema(description = "End of the grace period, set only once expired", nullable = true)
        LocalDateTime gracePeriodExpiresAt,

        @Schema(description = "Lifecycle state", example = "ACTIVE")
        SubscriptionState subscriptionState,

        @Schema(description = "Entitlements of the plan keyed by feature")
        Map<String, TierFeatureValue> tierFeatures,

        @Schema(description = "Usage counters keyed by feature")
        Map<String, FeatureUsageDto> currentUsage
) {}
