package uk.gegc.inventra.features.tier.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.inventra.features.tier.api.dto.TierFeatureDefinitionDto;
import uk.gegc.inventra.features.tier.api.dto.TierFeatureValue;
import uk.gegc.inventra.features.tier.application.FeatureCatalogService;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierFeatureDefinition;
import uk.gegc.inventra.features.tier.infra.mapping.TierFeatureDefinitionMapper;
import uk.gegc.inventra.features.tier.infra.repository.TierFeatureDefinitionRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class FeatureCatalogServiceImpl implements FeatureCatalogService {

    private final TierFeatureDefinitionRepository definitionRepository;
    private final TierFeatureDefinitionMapper definitionMapper;

    @Override
    public List<TierFeatureDefinition> getDefinitions(SubscriptionPlan tier) {
        return definitionRepository.findByTierOrderByFeatureNameAsc(tier);
    }

    @Override
    public Optional<TierFeatureDefinition> findDefinition(SubscriptionPlan tier, String featureName) {
        return definitionRepository.findByTierAndFeatureName(tier, featureName);
    }

    @Override
    public Map<String, TierFeatureValue> getTierFeatures(SubscriptionPlan tier) {
        Map<String, TierFeatureValue> features = new LinkedHashMap<>();
        for (TierFeatureDefinition definition : getDefinitions(tier)) {
            features.put(definition.getFeatureName(), toValue(definition));
        }
        return features;
    }

    @Override
    public List<TierFeatureDefinitionDto> listAll() {
        return definitionMapper.toDtos(definitionRepository.findAllByOrderByTierAscFeatureNameAsc());
    }

    private TierFeatureValue toValue(TierFeatureDefinition definition) {
        if (!definition.isFeatureEnabled()) {
            return TierFeatureValue.disabled();
        }
        if (definition.isUnlimited()) {
            return TierFeatureValue.unlimitedValue();
        }
        return TierFeatureValue.limitedTo(definition.getFeatureLimit());
    }
}
