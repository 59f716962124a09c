package uk.gegc.inventra.features.tier.infra.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import uk.gegc.inventra.features.tier.application.TierProperties;
import uk.gegc.inventra.features.tier.domain.model.UserTierFeature;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@RequiredArgsConstructor
public class UserTierFeatureLockingRepositoryImpl implements UserTierFeatureLockingRepository {

    static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    @PersistenceContext
    private EntityManager entityManager;

    private final TierProperties tierProperties;

    @Override
    public Optional<UserTierFeature> findForUpdate(UUID userId, String featureName) {
        Map<String, Object> hints = lockHints();
        Optional<UserTierFeature> locked = entityManager.createQuery("""
                        SELECT f FROM UserTierFeature f
                        WHERE f.userId = :userId AND f.featureName = :featureName
                        """, UserTierFeature.class)
                .setParameter("userId", userId)
                .setParameter("featureName", featureName)
                .setLockMode(LockModeType.PESSIMISTIC_WRITE)
                .setHint(LOCK_TIMEOUT_HINT, hints.get(LOCK_TIMEOUT_HINT))
                .getResultStream()
                .findFirst();
        // A managed instance keeps the state it was first read with; reload it under the lock
        locked.ifPresent(record -> entityManager.refresh(record, LockModeType.PESSIMISTIC_WRITE, hints));
        return locked;
    }

    @Override
    public Optional<UserTierFeature> findCurrent(UUID userId, String featureName) {
        Optional<UserTierFeature> record = entityManager.createQuery("""
                        SELECT f FROM UserTierFeature f
                        WHERE f.userId = :userId AND f.featureName = :featureName
                        """, UserTierFeature.class)
                .setParameter("userId", userId)
                .setParameter("featureName", featureName)
                .getResultStream()
                .findFirst();
        record.ifPresent(entityManager::refresh);
        return record;
    }

    private Map<String, Object> lockHints() {
        return Map.of(LOCK_TIMEOUT_HINT, Math.toIntExact(tierProperties.getUsage().getLockTimeoutMs()));
    }
}
