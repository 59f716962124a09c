package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;

@Schema(name = "TierFeatureDefinitionDto", description = "Catalog entry")
public record TierFeatureDefinitionDto(
        Long id,
        SubscriptionPlan tier,
        String featureName,
        @Schema(nullable = true) Integer featureLimit,
        boolean featureEnabled,
        String description
) {}
