package uk.gegc.inventra.features.tier.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubscriptionPlan {
    FREE("free"),
    PREMIUM("premium");

    private final String value;

    SubscriptionPlan(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SubscriptionPlan fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Subscription plan must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SubscriptionPlan plan : values()) {
            if (plan.value.equals(normalized)) {
                return plan;
            }
        }
        throw new IllegalArgumentException("Unknown subscription plan: " + value);
    }
}
