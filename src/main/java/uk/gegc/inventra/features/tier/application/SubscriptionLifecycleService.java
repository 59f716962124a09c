package uk.gegc.inventra.features.tier.application;

import uk.gegc.inventra.features.tier.api.dto.TierChangeResultDto;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Plan transitions. Each transition writes the user's plan and expiry, appends a history entry
 * and publishes a {@link uk.gegc.inventra.features.tier.domain.event.TierChangedEvent} for
 * best-effort notification after commit.
 */
public interface SubscriptionLifecycleService {

    /**
     * Always performed, also when the user is already premium.
     *
     * @param expiresAt new expiry; {@code null} keeps the current one
     * @throws uk.gegc.inventra.shared.exception.ResourceNotFoundException for an unknown user
     */
    TierChangeResultDto upgradeToPremium(UUID userId, LocalDateTime expiresAt, UUID changedBy, String notes);

    /**
     * No-op with {@code performed=false} and no history entry when the user is already free.
     *
     * @throws uk.gegc.inventra.shared.exception.ResourceNotFoundException for an unknown user
     */
    TierChangeResultDto downgradeToFree(UUID userId, UUID changedBy, String notes);

    /**
     * Downgrades a premium user whose subscription expired and whose grace period is over.
     *
     * @return {@code false} when the user is missing or the conditions do not hold
     */
    boolean performAutomaticDowngrade(UUID userId);
}
