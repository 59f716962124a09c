package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.inventra.features.tier.domain.model.AccessDenialReason;

@Schema(name = "FeatureAccessResultDto", description = "Outcome of an entitlement check")
public record FeatureAccessResultDto(
        @Schema(description = "Feature key", example = "product_slot")
        String feature,

        @Schema(description = "Whether the action may proceed", example = "true")
        boolean accessGranted,

        @Schema(description = "Whether the feature is enabled on the plan", example = "true")
        boolean featureEnabled,

        @Schema(description = "Whether current usage is below the limit", example = "true")
        boolean usageWithinLimits,

        @Schema(description = "Current usage (0 when no record exists)", example = "12")
        int currentUsage,

        @Schema(description = "Limit, null for unlimited", example = "50", nullable = true)
        Integer limit,

        @Schema(description = "Remaining quota, null for unlimited", example = "38", nullable = true)
        Integer remaining,

        @Schema(description = "Denial reason, null when granted", example = "usage_limit_exceeded", nullable = true)
        AccessDenialReason reason
) {
    public static FeatureAccessResultDto denied(String feature, boolean featureEnabled, AccessDenialReason reason) {
        return new FeatureAccessResultDto(feature, false, featureEnabled, false, 0, null, null, reason);
    }
}
