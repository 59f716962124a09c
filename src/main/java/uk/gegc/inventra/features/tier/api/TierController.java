package uk.gegc.inventra.features.tier.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.inventra.features.tier.api.dto.FeatureAccessResultDto;
import uk.gegc.inventra.features.tier.api.dto.FeatureAvailabilityDto;
import uk.gegc.inventra.features.tier.api.dto.TierHistoryDto;
import uk.gegc.inventra.features.tier.api.dto.TierStatusDto;
import uk.gegc.inventra.features.tier.api.dto.UsageThresholdDto;
import uk.gegc.inventra.features.tier.application.EntitlementService;
import uk.gegc.inventra.features.tier.application.TierHistoryService;
import uk.gegc.inventra.features.tier.application.TierProperties;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/tier")
@RequiredArgsConstructor
@Validated
@Tag(name = "Tier", description = "Subscription status, entitlements and usage of the calling user")
@SecurityRequirement(name = "bearerAuth")
public class TierController {

    private final EntitlementService entitlementService;
    private final TierHistoryService tierHistoryService;
    private final TierProperties tierProperties;

    @Operation(summary = "Get my tier status",
            description = "Plan, expiry, grace period, entitlements and usage counters of the caller")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status returned"),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "User not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/status")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<TierStatusDto> getStatus(Authentication authentication) {
        return ResponseEntity.ok(entitlementService.getTierStatus(TierSecurityUtils.currentUserId(authentication)));
    }

    @Operation(summary = "Get feature availability",
            description = "Availability of every feature of the caller's plan, or of a single feature")
    @GetMapping("/features")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Map<String, FeatureAvailabilityDto>> getFeatureAvailability(
            Authentication authentication,
            @Parameter(description = "Restrict the result to one feature")
            @RequestParam(required = false) String feature
    ) {
        return ResponseEntity.ok(entitlementService.getFeatureAvailability(
                TierSecurityUtils.currentUserId(authentication), feature));
    }

    @Operation(summary = "Check access to a feature",
            description = "Denials are returned as a result with a reason, not as an error")
    @GetMapping("/features/{feature}/access")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<FeatureAccessResultDto> validateAccess(
            Authentication authentication,
            @PathVariable String feature
    ) {
        return ResponseEntity.ok(entitlementService.validateFeatureAccess(
                TierSecurityUtils.currentUserId(authentication), feature));
    }

    @Operation(summary = "Check a usage threshold",
            description = "Reports whether usage of a feature reached the given fraction of its limit")
    @GetMapping("/features/{feature}/threshold")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UsageThresholdDto> checkThreshold(
            Authentication authentication,
            @PathVariable String feature,
            @Parameter(description = "Fraction of the limit, defaults to tier.warning-threshold")
            @RequestParam(required = false) @DecimalMin("0.0") @DecimalMax("1.0") Double threshold
    ) {
        double effective = threshold != null ? threshold : tierProperties.getWarningThreshold();
        return ResponseEntity.ok(entitlementService.checkUsageThreshold(
                TierSecurityUtils.currentUserId(authentication), feature, effective));
    }

    @Operation(summary = "List my plan changes")
    @GetMapping("/history")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Page<TierHistoryDto>> getHistory(
            Authentication authentication,
            @PageableDefault(size = 20, sort = "effectiveDate", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        return ResponseEntity.ok(tierHistoryService.listForUser(TierSecurityUtils.currentUserId(authentication), pageable));
    }
}
