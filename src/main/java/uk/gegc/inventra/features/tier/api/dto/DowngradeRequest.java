package uk.gegc.inventra.features.tier.api.dto;

import jakarta.validation.constraints.Size;

public record DowngradeRequest(
        @Size(max = 1000)
        String notes
) {}
