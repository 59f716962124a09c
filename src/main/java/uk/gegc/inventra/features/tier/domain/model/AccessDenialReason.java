package uk.gegc.inventra.features.tier.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccessDenialReason {
    FEATURE_NOT_DEFINED("feature_not_defined"),
    FEATURE_NOT_AVAILABLE("feature_not_available"),
    USAGE_LIMIT_EXCEEDED("usage_limit_exceeded");

    private final String value;

    AccessDenialReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
