package uk.gegc.inventra.features.tier.infra.repository;

import uk.gegc.inventra.features.tier.domain.model.UserTierFeature;

import java.util.Optional;
import java.util.UUID;

/**
 * Row-locking lookups whose lock timeout comes from configuration.
 */
public interface UserTierFeatureLockingRepository {

    /**
     * Loads the record with a pessimistic write lock held until the surrounding transaction ends.
     * Must be called inside a transaction.
     */
    Optional<UserTierFeature> findForUpdate(UUID userId, String featureName);

    /**
     * Loads the record and re-reads its state from the database, overwriting whatever the
     * persistence context held. Other managed entities are left alone.
     */
    Optional<UserTierFeature> findCurrent(UUID userId, String featureName);
}
