package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "TrackUsageRequest", description = "Adjust a usage counter")
public record TrackUsageRequest(
        @Schema(description = "Signed amount to add", example = "1")
        int delta,

        @Schema(description = "Take a row lock while incrementing", example = "true")
        boolean atomic
) {}
