package uk.gegc.inventra.features.tier.domain.exception;

import java.util.UUID;

/**
 * An increment targeted a (user, feature) pair that was never provisioned.
 * Callers must provision usage records before metering.
 */
public class UsageRecordNotFoundException extends RuntimeException {

    private final UUID userId;
    private final String featureName;

    public UsageRecordNotFoundException(UUID userId, String featureName) {
        super("Feature usage record not found for user " + userId + " and feature " + featureName);
        this.userId = userId;
        this.featureName = featureName;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getFeatureName() {
        return featureName;
    }
}
