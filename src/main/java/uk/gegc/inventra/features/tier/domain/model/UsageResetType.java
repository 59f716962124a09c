package uk.gegc.inventra.features.tier.domain.model;

public enum UsageResetType {
    DAILY,
    WEEKLY,
    MONTHLY
}
