package uk.gegc.inventra.features.tier.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.inventra.features.tier.api.dto.CreateUsageRecordRequest;
import uk.gegc.inventra.features.tier.api.dto.DowngradeRequest;
import uk.gegc.inventra.features.tier.api.dto.FeatureUsageRecordDto;
import uk.gegc.inventra.features.tier.api.dto.IncrementResultDto;
import uk.gegc.inventra.features.tier.api.dto.ProvisionResultDto;
import uk.gegc.inventra.features.tier.api.dto.TierChangeResultDto;
import uk.gegc.inventra.features.tier.api.dto.TierFeatureDefinitionDto;
import uk.gegc.inventra.features.tier.api.dto.TierHistoryDto;
import uk.gegc.inventra.features.tier.api.dto.TierStatusDto;
import uk.gegc.inventra.features.tier.api.dto.TrackUsageRequest;
import uk.gegc.inventra.features.tier.api.dto.UpgradeRequest;
import uk.gegc.inventra.features.tier.api.dto.UsageResetRequest;
import uk.gegc.inventra.features.tier.api.dto.UsageResetResultDto;
import uk.gegc.inventra.features.tier.application.EntitlementService;
import uk.gegc.inventra.features.tier.application.FeatureCatalogService;
import uk.gegc.inventra.features.tier.application.SubscriptionLifecycleService;
import uk.gegc.inventra.features.tier.application.SubscriptionPeriodCalculator;
import uk.gegc.inventra.features.tier.application.TierHistoryService;
import uk.gegc.inventra.features.tier.application.UsageCounterService;
import uk.gegc.inventra.features.user.domain.repository.UserRepository;
import uk.gegc.inventra.shared.exception.ResourceNotFoundException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/admin/tier")
@RequiredArgsConstructor
@PreAuthorize("hasAuthority('TIER_ADMIN')")
@Tag(name = "Tier Admin", description = "Administrative tier transitions and usage management. Requires TIER_ADMIN.")
@SecurityRequirement(name = "bearerAuth")
@ApiResponses({
        @ApiResponse(responseCode = "401", description = "Unauthorized",
                content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
        @ApiResponse(responseCode = "403", description = "Missing TIER_ADMIN permission",
                content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
})
public class TierAdminController {

    private final EntitlementService entitlementService;
    private final SubscriptionLifecycleService lifecycleService;
    private final UsageCounterService usageCounterService;
    private final TierHistoryService tierHistoryService;
    private final FeatureCatalogService featureCatalogService;
    private final SubscriptionPeriodCalculator periodCalculator;
    private final UserRepository userRepository;

    @Operation(summary = "Get a user's tier status")
    @GetMapping("/users/{userId}/status")
    public ResponseEntity<TierStatusDto> getUserStatus(@PathVariable UUID userId) {
        return ResponseEntity.ok(entitlementService.getTierStatus(userId));
    }

    @Operation(summary = "List a user's plan changes", description = "Chronological, oldest first")
    @GetMapping("/users/{userId}/history")
    public ResponseEntity<List<TierHistoryDto>> getUserHistory(@PathVariable UUID userId) {
        return ResponseEntity.ok(tierHistoryService.listForUser(userId));
    }

    @Operation(summary = "Upgrade a user to premium")
    @PostMapping("/users/{userId}/upgrade")
    public ResponseEntity<TierChangeResultDto> upgrade(
            @PathVariable UUID userId,
            @RequestBody @Valid UpgradeRequest request,
            Authentication authentication
    ) {
        UUID actor = TierSecurityUtils.currentUserId(authentication);
        log.info("Admin {} upgrading user {} to premium", actor, userId);
        return ResponseEntity.ok(lifecycleService.upgradeToPremium(userId, request.expiresAt(), actor, request.notes()));
    }

    @Operation(summary = "Downgrade a user to free", description = "No-op when the user is already free")
    @PostMapping("/users/{userId}/downgrade")
    public ResponseEntity<TierChangeResultDto> downgrade(
            @PathVariable UUID userId,
            @RequestBody(required = false) @Valid DowngradeRequest request,
            Authentication authentication
    ) {
        UUID actor = TierSecurityUtils.currentUserId(authentication);
        String notes = request != null ? request.notes() : null;
        log.info("Admin {} downgrading user {} to free", actor, userId);
        return ResponseEntity.ok(lifecycleService.downgradeToFree(userId, actor, notes));
    }

    @Operation(summary = "Run the expiration downgrade for one user",
            description = "Downgrades only when the subscription expired and the grace period is over")
    @PostMapping("/users/{userId}/auto-downgrade")
    public ResponseEntity<TierChangeResultDto> autoDowngrade(@PathVariable UUID userId) {
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User " + userId + " not found");
        }
        boolean performed = lifecycleService.performAutomaticDowngrade(userId);
        TierStatusDto status = entitlementService.getTierStatus(userId);
        return ResponseEntity.ok(new TierChangeResultDto(
                userId, performed, null, status.subscriptionPlan(), status.subscriptionExpiresAt()));
    }

    @Operation(summary = "Adjust a usage counter")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Counter updated"),
            @ApiResponse(responseCode = "500", description = "Usage record was never provisioned",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/users/{userId}/usage/{feature}")
    public ResponseEntity<IncrementResultDto> trackUsage(
            @PathVariable UUID userId,
            @PathVariable String feature,
            @RequestBody @Valid TrackUsageRequest request
    ) {
        return ResponseEntity.ok(entitlementService.trackUsage(userId, feature, request.delta(), request.atomic()));
    }

    @Operation(summary = "Create a usage record")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Record created"),
            @ApiResponse(responseCode = "409", description = "Record already exists",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/users/{userId}/usage")
    public ResponseEntity<FeatureUsageRecordDto> createUsageRecord(
            @PathVariable UUID userId,
            @RequestBody @Valid CreateUsageRecordRequest request
    ) {
        FeatureUsageRecordDto created = usageCounterService.create(
                userId, request.featureName(), request.usageLimit(), request.initialUsage());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Provision usage records for the user's current plan")
    @PostMapping("/users/{userId}/provision")
    public ResponseEntity<ProvisionResultDto> provision(@PathVariable UUID userId) {
        TierStatusDto status = entitlementService.getTierStatus(userId);
        int created = usageCounterService.provisionForPlan(userId, status.subscriptionPlan());
        return ResponseEntity.ok(new ProvisionResultDto(userId, status.subscriptionPlan(), created));
    }

    @Operation(summary = "Reset usage counters of a reset cadence")
    @PostMapping("/usage/reset")
    public ResponseEntity<UsageResetResultDto> resetUsage(@RequestBody @Valid UsageResetRequest request) {
        LocalDateTime asOf = periodCalculator.now();
        int reset = usageCounterService.resetCounters(request.resetType(), asOf);
        return ResponseEntity.ok(new UsageResetResultDto(request.resetType(), reset, asOf));
    }

    @Operation(summary = "List the feature catalog")
    @GetMapping("/definitions")
    public ResponseEntity<List<TierFeatureDefinitionDto>> listDefinitions() {
        return ResponseEntity.ok(featureCatalogService.listAll());
    }
}
