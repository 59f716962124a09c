package uk.gegc.inventra.features.tier.api.dto;

import uk.gegc.inventra.features.tier.domain.model.UsageResetType;

import java.time.LocalDateTime;

public record UsageResetResultDto(
        UsageResetType resetType,
        int recordsReset,
        LocalDateTime resetAt
) {}
