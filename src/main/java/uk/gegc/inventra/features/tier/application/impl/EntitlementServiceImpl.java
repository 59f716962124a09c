package uk.gegc.inventra.features.tier.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.inventra.features.tier.api.dto.FeatureAccessResultDto;
import uk.gegc.inventra.features.tier.api.dto.FeatureAvailabilityDto;
import uk.gegc.inventra.features.tier.api.dto.FeatureUsageDto;
import uk.gegc.inventra.features.tier.api.dto.IncrementResultDto;
import uk.gegc.inventra.features.tier.api.dto.TierStatusDto;
import uk.gegc.inventra.features.tier.api.dto.UsageThresholdDto;
import uk.gegc.inventra.features.tier.application.EntitlementService;
import uk.gegc.inventra.features.tier.application.FeatureCatalogService;
import uk.gegc.inventra.features.tier.application.SubscriptionPeriodCalculator;
import uk.gegc.inventra.features.tier.application.TierMetricsService;
import uk.gegc.inventra.features.tier.application.UsageCounterService;
import uk.gegc.inventra.features.tier.domain.exception.FeatureLimitExceededException;
import uk.gegc.inventra.features.tier.domain.model.AccessDenialReason;
import uk.gegc.inventra.features.tier.domain.model.FeatureNames;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierFeatureDefinition;
import uk.gegc.inventra.features.user.domain.model.User;
import uk.gegc.inventra.features.user.domain.repository.UserRepository;
import uk.gegc.inventra.shared.exception.ResourceNotFoundException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EntitlementServiceImpl implements EntitlementService {

    private final UserRepository userRepository;
    private final FeatureCatalogService featureCatalogService;
    private final UsageCounterService usageCounterService;
    private final SubscriptionPeriodCalculator periodCalculator;
    private final TierMetricsService metricsService;

    @Override
    @Transactional(readOnly = true)
    public TierStatusDto getTierStatus(UUID userId) {
        User user = loadUser(userId);
        LocalDateTime expiresAt = user.getSubscriptionExpiresAt();

        boolean expired = periodCalculator.isExpired(expiresAt);
        LocalDateTime graceEnd = expired ? periodCalculator.gracePeriodEnd(expiresAt) : null;

        return new TierStatusDto(
                user.getId(),
                user.getSubscriptionPlan(),
                expiresAt,
                user.isActive(),
                periodCalculator.daysUntilExpiration(expiresAt),
                periodCalculator.isGracePeriodActive(graceEnd),
                graceEnd,
                periodCalculator.resolveState(user.getSubscriptionPlan(), expiresAt),
                featureCatalogService.getTierFeatures(user.getSubscriptionPlan()),
                usageCounterService.getUsage(userId)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public FeatureAccessResultDto validateFeatureAccess(UUID userId, String featureName, SubscriptionPlan tier) {
        Optional<TierFeatureDefinition> definition = featureCatalogService.findDefinition(tier, featureName);
        if (definition.isEmpty()) {
            return deny(userId, FeatureAccessResultDto.denied(featureName, false, AccessDenialReason.FEATURE_NOT_DEFINED));
        }
        if (!definition.get().isFeatureEnabled()) {
            return deny(userId, FeatureAccessResultDto.denied(featureName, false, AccessDenialReason.FEATURE_NOT_AVAILABLE));
        }

        Integer limit = definition.get().getFeatureLimit();
        FeatureUsageDto usage = usageCounterService.getUsage(userId).get(featureName);
        int current = usage != null ? usage.current() : 0;
        boolean withinLimits = limit == null || current < limit;
        Integer remaining = limit == null ? null : Math.max(0, limit - current);

        FeatureAccessResultDto result = new FeatureAccessResultDto(
                featureName,
                withinLimits,
                true,
                withinLimits,
                current,
                limit,
                remaining,
                withinLimits ? null : AccessDenialReason.USAGE_LIMIT_EXCEEDED
        );
        return withinLimits ? result : deny(userId, result);
    }

    @Override
    @Transactional(readOnly = true)
    public FeatureAccessResultDto validateFeatureAccess(UUID userId, String featureName) {
        return validateFeatureAccess(userId, featureName, loadUser(userId).getSubscriptionPlan());
    }

    @Override
    @Transactional(readOnly = true)
    public UsageThresholdDto checkUsageThreshold(UUID userId, String featureName, double threshold) {
        FeatureUsageDto usage = usageCounterService.getUsage(userId).get(featureName);
        if (usage == null) {
            return new UsageThresholdDto(featureName, false, 0d, 0, null, null);
        }

        Integer limit = usage.limit();
        // A zero limit counts as no limit here
        double percentage = limit != null && limit != 0 ? (double) usage.current() / limit : 0d;
        boolean exceeded = percentage >= threshold;
        String warning = exceeded
                ? "You are approaching your " + FeatureNames.displayName(featureName)
                + " limit (" + Math.round(percentage * 100) + "% used)"
                : null;
        return new UsageThresholdDto(featureName, exceeded, percentage, usage.current(), limit, warning);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, FeatureAvailabilityDto> getFeatureAvailability(UUID userId, String featureName) {
        User user = loadUser(userId);
        SubscriptionPlan plan = user.getSubscriptionPlan();
        Map<String, FeatureUsageDto> usage = usageCounterService.getUsage(userId);

        List<TierFeatureDefinition> definitions = featureName == null
                ? featureCatalogService.getDefinitions(plan)
                : featureCatalogService.findDefinition(plan, featureName).map(List::of).orElse(List.of());

        Map<String, FeatureAvailabilityDto> availability = new LinkedHashMap<>();
        for (TierFeatureDefinition definition : definitions) {
            String name = definition.getFeatureName();
            FeatureUsageDto featureUsage = usage.get(name);
            int current = featureUsage != null ? featureUsage.current() : 0;
            Integer limit = definition.getFeatureLimit();
            boolean enabled = definition.isFeatureEnabled();
            boolean available = enabled && (limit == null || current < limit);
            Integer remaining = !enabled ? Integer.valueOf(0) : limit == null ? null : Math.max(0, limit - current);

            availability.put(name, new FeatureAvailabilityDto(
                    FeatureNames.displayName(name),
                    available,
                    enabled,
                    limit,
                    current,
                    remaining,
                    upgradeMessage(plan, name, enabled, limit)
            ));
        }
        return availability;
    }

    @Override
    @Transactional
    public IncrementResultDto trackUsage(UUID userId, String featureName, int delta, boolean atomic) {
        return usageCounterService.increment(userId, featureName, delta, atomic);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public IncrementResultDto consumeQuota(UUID userId, String featureName, int delta) {
        if (delta <= 0) {
            return usageCounterService.increment(userId, featureName, delta, true);
        }

        SubscriptionPlan plan = loadUser(userId).getSubscriptionPlan();
        TierFeatureDefinition definition = featureCatalogService.findDefinition(plan, featureName)
                .orElseThrow(() -> denyQuota(userId, featureName, AccessDenialReason.FEATURE_NOT_DEFINED,
                        "Feature " + featureName + " is not defined for the " + plan.getValue() + " tier"));
        if (!definition.isFeatureEnabled()) {
            throw denyQuota(userId, featureName, AccessDenialReason.FEATURE_NOT_AVAILABLE,
                    "Upgrade to Premium to access " + FeatureNames.displayName(featureName));
        }
        return usageCounterService.incrementWithinLimit(userId, featureName, delta, definition.getFeatureLimit());
    }

    private String upgradeMessage(SubscriptionPlan plan, String featureName, boolean enabled, Integer limit) {
        if (plan != SubscriptionPlan.FREE) {
            return null;
        }
        String displayName = FeatureNames.displayName(featureName);
        if (!enabled) {
            return "Upgrade to Premium to access " + displayName;
        }
        return limit != null ? "Upgrade to Premium for unlimited " + displayName : null;
    }

    private FeatureAccessResultDto deny(UUID userId, FeatureAccessResultDto result) {
        log.warn("Feature access denied for user {}: feature={} reason={}", userId, result.feature(), result.reason().getValue());
        metricsService.incrementAccessDenied(userId, result.feature(), result.reason());
        return result;
    }

    private FeatureLimitExceededException denyQuota(UUID userId, String featureName, AccessDenialReason reason, String message) {
        log.warn("Quota denied for user {}: feature={} reason={}", userId, featureName, reason.getValue());
        metricsService.incrementAccessDenied(userId, featureName, reason);
        return new FeatureLimitExceededException(message, featureName, reason, null, 0);
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));
    }
}
