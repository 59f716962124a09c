package uk.gegc.inventra.features.tier.application;

import uk.gegc.inventra.features.tier.domain.model.AccessDenialReason;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;

import java.util.UUID;

/**
 * Counters for tier transitions, entitlement denials, metering and the downgrade sweep.
 */
public interface TierMetricsService {

    void incrementTransition(UUID userId, TierChangeReason reason);

    void incrementAccessDenied(UUID userId, String feature, AccessDenialReason reason);

    void incrementUsage(UUID userId, String feature, int delta, boolean atomic);

    void recordSweepDowngrades(int downgraded, int failed);
}
