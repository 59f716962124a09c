package uk.gegc.inventra.features.tier.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.inventra.features.tier.api.dto.FeatureUsageDto;
import uk.gegc.inventra.features.tier.api.dto.FeatureUsageRecordDto;
import uk.gegc.inventra.features.tier.api.dto.IncrementResultDto;
import uk.gegc.inventra.features.tier.application.SubscriptionPeriodCalculator;
import uk.gegc.inventra.features.tier.application.TierMetricsService;
import uk.gegc.inventra.features.tier.application.TierProperties;
import uk.gegc.inventra.features.tier.application.UsageCounterService;
import uk.gegc.inventra.features.tier.domain.exception.FeatureLimitExceededException;
import uk.gegc.inventra.features.tier.domain.exception.UsageRecordAlreadyExistsException;
import uk.gegc.inventra.features.tier.domain.exception.UsageRecordNotFoundException;
import uk.gegc.inventra.features.tier.domain.model.AccessDenialReason;
import uk.gegc.inventra.features.tier.domain.model.FeatureNames;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierFeatureDefinition;
import uk.gegc.inventra.features.tier.domain.model.UsageResetType;
import uk.gegc.inventra.features.tier.domain.model.UserTierFeature;
import uk.gegc.inventra.features.tier.infra.mapping.UserTierFeatureMapper;
import uk.gegc.inventra.features.tier.infra.repository.TierFeatureDefinitionRepository;
import uk.gegc.inventra.features.tier.infra.repository.UserTierFeatureRepository;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UsageCounterServiceImpl implements UsageCounterService {

    private final UserTierFeatureRepository usageRepository;
    private final TierFeatureDefinitionRepository definitionRepository;
    private final UserTierFeatureMapper usageMapper;
    private final SubscriptionPeriodCalculator periodCalculator;
    private final TierMetricsService metricsService;
    private final TierProperties tierProperties;

    @Override
    @Transactional(readOnly = true)
    public Map<String, FeatureUsageDto> getUsage(UUID userId) {
        Map<String, FeatureUsageDto> usage = new LinkedHashMap<>();
        for (UserTierFeature record : usageRepository.findByUserIdOrderByFeatureNameAsc(userId)) {
            usage.put(record.getFeatureName(), usageMapper.toUsageDto(record));
        }
        return usage;
    }

    @Override
    @Transactional
    public IncrementResultDto increment(UUID userId, String featureName, int delta, boolean atomic) {
        IncrementResultDto result = atomic
                ? lockedIncrement(userId, featureName, delta)
                : relativeIncrement(userId, featureName, delta);
        metricsService.incrementUsage(userId, featureName, delta, atomic);
        return result;
    }

    @Override
    @Transactional
    public IncrementResultDto incrementWithinLimit(UUID userId, String featureName, int delta, Integer limit) {
        UserTierFeature record = usageRepository.findForUpdate(userId, featureName)
                .orElseThrow(() -> new UsageRecordNotFoundException(userId, featureName));

        int current = record.getCurrentUsage();
        if (delta > 0 && limit != null && (long) current + delta > limit) {
            log.warn("Usage limit reached for user {} feature {}: {} + {} > {}", userId, featureName, current, delta, limit);
            metricsService.incrementAccessDenied(userId, featureName, AccessDenialReason.USAGE_LIMIT_EXCEEDED);
            throw new FeatureLimitExceededException(
                    "You have reached your " + FeatureNames.displayName(featureName) + " limit (" + limit + ")",
                    featureName, AccessDenialReason.USAGE_LIMIT_EXCEEDED, limit, current);
        }

        IncrementResultDto result = apply(record, delta);
        metricsService.incrementUsage(userId, featureName, delta, true);
        return result;
    }

    @Override
    @Transactional
    public FeatureUsageRecordDto create(UUID userId, String featureName, Integer usageLimit, int initialUsage) {
        if (usageRepository.existsByUserIdAndFeatureName(userId, featureName)) {
            throw new UsageRecordAlreadyExistsException(userId, featureName);
        }
        try {
            UserTierFeature saved = usageRepository.saveAndFlush(newRecord(userId, featureName, usageLimit, initialUsage));
            log.info("Created usage record for user {} feature {} (limit={}, usage={})",
                    userId, featureName, usageLimit, initialUsage);
            return usageMapper.toRecordDto(saved);
        } catch (DataIntegrityViolationException e) {
            // Lost an insert race against another creator of the same pair
            throw new UsageRecordAlreadyExistsException(userId, featureName);
        }
    }

    @Override
    @Transactional
    public int provisionForPlan(UUID userId, SubscriptionPlan plan) {
        int created = 0;
        for (TierFeatureDefinition definition : definitionRepository.findByTierOrderByFeatureNameAsc(plan)) {
            if (!definition.isFeatureEnabled()
                    || usageRepository.existsByUserIdAndFeatureName(userId, definition.getFeatureName())) {
                continue;
            }
            usageRepository.save(newRecord(userId, definition.getFeatureName(), definition.getFeatureLimit(), 0));
            created++;
        }
        if (created > 0) {
            usageRepository.flush();
            log.info("Provisioned {} usage records for user {} on plan {}", created, userId, plan.getValue());
        }
        return created;
    }

    @Override
    @Transactional
    public int resetCounters(UsageResetType resetType, LocalDateTime asOf) {
        List<String> features = tierProperties.getUsageReset().featuresFor(resetType);
        if (features.isEmpty()) {
            log.debug("No features configured for {} usage reset", resetType);
            return 0;
        }
        int reset = usageRepository.resetUsage(features, asOf);
        log.info("{} usage reset as of {}: {} records reset for features {}", resetType, asOf, reset, features);
        return reset;
    }

    private IncrementResultDto lockedIncrement(UUID userId, String featureName, int delta) {
        UserTierFeature record = usageRepository.findForUpdate(userId, featureName)
                .orElseThrow(() -> new UsageRecordNotFoundException(userId, featureName));
        return apply(record, delta);
    }

    private IncrementResultDto relativeIncrement(UUID userId, String featureName, int delta) {
        int updated = usageRepository.incrementUsage(userId, featureName, delta, periodCalculator.now());
        if (updated == 0) {
            throw new UsageRecordNotFoundException(userId, featureName);
        }
        UserTierFeature record = usageRepository.findCurrent(userId, featureName)
                .orElseThrow(() -> new UsageRecordNotFoundException(userId, featureName));
        return new IncrementResultDto(featureName, record.getCurrentUsage(), record.getUsageLimit(), record.getUpdatedAt());
    }

    private IncrementResultDto apply(UserTierFeature record, int delta) {
        record.setCurrentUsage(record.getCurrentUsage() + delta);
        record.setUpdatedAt(periodCalculator.now());
        UserTierFeature saved = usageRepository.saveAndFlush(record);
        return new IncrementResultDto(saved.getFeatureName(), saved.getCurrentUsage(), saved.getUsageLimit(), saved.getUpdatedAt());
    }

    private UserTierFeature newRecord(UUID userId, String featureName, Integer usageLimit, int initialUsage) {
        LocalDateTime now = periodCalculator.now();
        UserTierFeature record = new UserTierFeature();
        record.setUserId(userId);
        record.setFeatureName(featureName);
        record.setUsageLimit(usageLimit);
        record.setCurrentUsage(initialUsage);
        record.setLastResetAt(now);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        return record;
    }
}
