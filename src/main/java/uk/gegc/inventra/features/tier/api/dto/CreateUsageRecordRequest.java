package uk.gegc.inventra.features.tier.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "CreateUsageRecordRequest", description = "Create a usage counter for a user")
public record CreateUsageRecordRequest(
        @NotBlank(message = "Feature name is required")
        @Size(max = 100)
        @Schema(example = "product_slot")
        String featureName,

        @Min(value = 0, message = "Usage limit must be non-negative")
        @Schema(description = "Limit snapshot, null for unlimited", nullable = true, example = "50")
        Integer usageLimit,

        @Min(value = 0, message = "Initial usage must be non-negative")
        @Schema(example = "0")
        int initialUsage
) {}
