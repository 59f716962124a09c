package uk.gegc.inventra.features.tier.domain.model;

/**
 * Where a user sits in the subscription lifecycle at a given instant.
 * Free users without an expiry are always {@link #ACTIVE}.
 */
public enum SubscriptionState {
    ACTIVE,
    EXPIRED_IN_GRACE,
    EXPIRED_OUT_OF_GRACE
}
