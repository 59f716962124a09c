package uk.gegc.inventra.features.tier.application;

import uk.gegc.inventra.features.tier.api.dto.TierFeatureDefinitionDto;
import uk.gegc.inventra.features.tier.api.dto.TierFeatureValue;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierFeatureDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the per-tier feature catalog.
 */
public interface FeatureCatalogService {

    List<TierFeatureDefinition> getDefinitions(SubscriptionPlan tier);

    /**
     * An empty result is a normal outcome: the feature is simply not defined for the tier.
     */
    Optional<TierFeatureDefinition> findDefinition(SubscriptionPlan tier, String featureName);

    /**
     * Entitlements of a tier keyed by feature name, in feature name order.
     */
    Map<String, TierFeatureValue> getTierFeatures(SubscriptionPlan tier);

    List<TierFeatureDefinitionDto> listAll();
}
