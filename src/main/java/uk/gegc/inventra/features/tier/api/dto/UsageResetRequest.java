package uk.gegc.inventra.features.tier.api.dto;

import jakarta.validation.constraints.NotNull;
import uk.gegc.inventra.features.tier.domain.model.UsageResetType;

public record UsageResetRequest(
        @NotNull(message = "Reset type is required")
        UsageResetType resetType
) {}
