package uk.gegc.inventra.features.tier.domain.exception;

import uk.gegc.inventra.features.tier.domain.model.AccessDenialReason;

/**
 * Thrown on the hard-cap path when a metered action would take a counter past its limit,
 * or when the feature is not available on the user's plan.
 */
public class FeatureLimitExceededException extends RuntimeException {

    private final String featureName;
    private final AccessDenialReason reason;
    private final Integer limit;
    private final int currentUsage;

    public FeatureLimitExceededException(String message, String featureName, AccessDenialReason reason,
                                         Integer limit, int currentUsage) {
        super(message);
        this.featureName = featureName;
        this.reason = reason;
        this.limit = limit;
        this.currentUsage = currentUsage;
    }

    public String getFeatureName() {
        return featureName;
    }

    public AccessDenialReason getReason() {
        return reason;
    }

    public Integer getLimit() {
        return limit;
    }

    public int getCurrentUsage() {
        return currentUsage;
    }
}
