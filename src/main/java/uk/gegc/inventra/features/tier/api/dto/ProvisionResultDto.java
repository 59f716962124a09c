package uk.gegc.inventra.features.tier.api.dto;

import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;

import java.util.UUID;

public record ProvisionResultDto(
        UUID userId,
        SubscriptionPlan plan,
        int recordsCreated
) {}
