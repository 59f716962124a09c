package uk.gegc.inventra.features.tier.application;

import uk.gegc.inventra.features.tier.api.dto.FeatureAccessResultDto;
import uk.gegc.inventra.features.tier.api.dto.FeatureAvailabilityDto;
import uk.gegc.inventra.features.tier.api.dto.IncrementResultDto;
import uk.gegc.inventra.features.tier.api.dto.TierStatusDto;
import uk.gegc.inventra.features.tier.api.dto.UsageThresholdDto;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;

import java.util.Map;
import java.util.UUID;

/**
 * Entry point for request handlers: status, entitlement checks and metering.
 *
 * <p>Soft checks ({@link #validateFeatureAccess}) report denials as values. A handler enforcing a
 * hard cap calls {@link #consumeQuota} from inside the transaction of the protected write.</p>
 */
public interface EntitlementService {

    /**
     * @throws uk.gegc.inventra.shared.exception.ResourceNotFoundException for an unknown user
     */
    TierStatusDto getTierStatus(UUID userId);

    FeatureAccessResultDto validateFeatureAccess(UUID userId, String featureName, SubscriptionPlan tier);

    /**
     * Same as {@link #validateFeatureAccess(UUID, String, SubscriptionPlan)} with the user's stored plan.
     */
    FeatureAccessResultDto validateFeatureAccess(UUID userId, String featureName);

    UsageThresholdDto checkUsageThreshold(UUID userId, String featureName, double threshold);

    /**
     * Availability of every feature of the user's plan, or only {@code featureName} when given.
     */
    Map<String, FeatureAvailabilityDto> getFeatureAvailability(UUID userId, String featureName);

    IncrementResultDto trackUsage(UUID userId, String featureName, int delta, boolean atomic);

    /**
     * Checks the entitlement and increments under a row lock. Requires an active transaction so the
     * counter commits or rolls back together with the caller's write.
     *
     * @throws uk.gegc.inventra.features.tier.domain.exception.FeatureLimitExceededException when denied
     */
    IncrementResultDto consumeQuota(UUID userId, String featureName, int delta);
}
