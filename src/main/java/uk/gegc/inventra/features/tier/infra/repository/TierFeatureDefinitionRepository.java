package uk.gegc.inventra.features.tier.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierFeatureDefinition;

import java.util.List;
import java.util.Optional;

public interface TierFeatureDefinitionRepository extends JpaRepository<TierFeatureDefinition, Long> {

    List<TierFeatureDefinition> findByTierOrderByFeatureNameAsc(SubscriptionPlan tier);

    Optional<TierFeatureDefinition> findByTierAndFeatureName(SubscriptionPlan tier, String featureName);

    List<TierFeatureDefinition> findAllByOrderByTierAscFeatureNameAsc();
}
