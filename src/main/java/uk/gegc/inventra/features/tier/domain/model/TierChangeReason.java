package uk.gegc.inventra.features.tier.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TierChangeReason {
    UPGRADE("upgrade"),
    DOWNGRADE("downgrade"),
    EXPIRATION("expiration");

    private final String value;

    TierChangeReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
