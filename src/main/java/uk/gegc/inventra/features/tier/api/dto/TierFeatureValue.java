package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "TierFeatureValue", description = "Entitlement of one feature on a tier: disabled, unlimited, or capped at a limit")
public record TierFeatureValue(
        @Schema(description = "Whether the feature is available on the tier", example = "true")
        boolean enabled,

        @Schema(description = "True when enabled without a limit", example = "false")
        boolean unlimited,

        @Schema(description = "Limit when capped, null otherwise", example = "50", nullable = true)
        Integer limit
) {
    public static TierFeatureValue disabled() {
        return new TierFeatureValue(false, false, null);
    }

    public static TierFeatureValue unlimitedValue() {
        return new TierFeatureValue(true, true, null);
    }

    public static TierFeatureValue limitedTo(int limit) {
        return new TierFeatureValue(true, false, limit);
    }
}
