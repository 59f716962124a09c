package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

@Schema(name = "UpgradeRequest", description = "Upgrade a user to premium")
public record UpgradeRequest(
        @Schema(description = "New expiry; omitted leaves the current expiry unchanged", nullable = true)
        LocalDateTime expiresAt,

        @Size(max = 1000)
        @Schema(nullable = true)
        String notes
) {}
