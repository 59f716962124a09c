package uk.gegc.inventra.features.tier.domain.exception;

import java.util.UUID;

public class UsageRecordAlreadyExistsException extends RuntimeException {

    private final UUID userId;
    private final String featureName;

    public UsageRecordAlreadyExistsException(UUID userId, String featureName) {
        super("Feature usage record already exists for user " + userId + " and feature " + featureName);
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
