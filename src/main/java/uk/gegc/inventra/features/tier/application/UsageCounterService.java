package uk.gegc.inventra.features.tier.application;

import uk.gegc.inventra.features.tier.api.dto.FeatureUsageDto;
import uk.gegc.inventra.features.tier.api.dto.FeatureUsageRecordDto;
import uk.gegc.inventra.features.tier.api.dto.IncrementResultDto;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.UsageResetType;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Owner of the per-user usage counters. All mutating methods join the caller's transaction
 * when one is active.
 */
public interface UsageCounterService {

    Map<String, FeatureUsageDto> getUsage(UUID userId);

    /**
     * Adds {@code delta} (possibly negative) to the counter.
     *
     * @param atomic {@code true} to lock the row for the rest of the transaction;
     *               {@code false} for a single relative UPDATE statement
     * @throws uk.gegc.inventra.features.tier.domain.exception.UsageRecordNotFoundException
     *         when the record was never provisioned
     */
    IncrementResultDto increment(UUID userId, String featureName, int delta, boolean atomic);

    /**
     * Locked increment that refuses to take the counter above {@code limit}.
     * A {@code null} limit means unlimited. Negative deltas are always applied.
     *
     * @throws uk.gegc.inventra.features.tier.domain.exception.FeatureLimitExceededException
     *         when {@code current + delta > limit}; the counter is left unchanged
     */
    IncrementResultDto incrementWithinLimit(UUID userId, String featureName, int delta, Integer limit);

    /**
     * @throws uk.gegc.inventra.features.tier.domain.exception.UsageRecordAlreadyExistsException
     *         when a record for the pair already exists
     */
    FeatureUsageRecordDto create(UUID userId, String featureName, Integer usageLimit, int initialUsage);

    /**
     * Creates missing records for every enabled feature of {@code plan}. Existing records are untouched.
     *
     * @return number of records created
     */
    int provisionForPlan(UUID userId, SubscriptionPlan plan);

    /**
     * Zeroes the counters of the features configured for {@code resetType}.
     * Records already reset at or after {@code asOf} are skipped.
     *
     * @return number of records reset
     */
    int resetCounters(UsageResetType resetType, LocalDateTime asOf);
}
