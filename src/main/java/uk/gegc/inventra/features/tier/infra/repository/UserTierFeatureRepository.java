package uk.gegc.inventra.features.tier.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.inventra.features.tier.domain.model.UserTierFeature;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UserTierFeatureRepository extends JpaRepository<UserTierFeature, UUID>, UserTierFeatureLockingRepository {

    List<UserTierFeature> findByUserIdOrderByFeatureNameAsc(UUID userId);

    Optional<UserTierFeature> findByUserIdAndFeatureName(UUID userId, String featureName);

    boolean existsByUserIdAndFeatureName(UUID userId, String featureName);

    /**
     * Single-statement relative update. Concurrent calls never lose an update, but no limit is checked.
     *
     * Leaves the persistence context alone; read the result back with {@link #findCurrent}.
     *
     * @return number of rows touched (0 when the record does not exist)
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE UserTierFeature f
            SET f.currentUsage = f.currentUsage + :delta, f.updatedAt = :now
            WHERE f.userId = :userId AND f.featureName = :featureName
            """)
    int incrementUsage(@Param("userId") UUID userId,
                       @Param("featureName") String featureName,
                       @Param("delta") int delta,
                       @Param("now") LocalDateTime now);

    /**
     * Zeroes every counter of the given features not already reset at or after {@code asOf}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE UserTierFeature f
            SET f.currentUsage = 0, f.lastResetAt = :asOf, f.updatedAt = :asOf
            WHERE f.featureName IN :featureNames
              AND (f.lastResetAt IS NULL OR f.lastResetAt < :asOf)
            """)
    int resetUsage(@Param("featureNames") Collection<String> featureNames,
                   @Param("asOf") LocalDateTime asOf);
}
