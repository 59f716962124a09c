package uk.gegc.inventra.features.user.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.user.domain.model.User;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Active users on {@code plan} whose subscription expired strictly before {@code cutoff}.
     * Used by the downgrade sweep with {@code cutoff = now - grace period}.
     */
    @Query("""
            SELECT u.id FROM User u
            WHERE u.subscriptionPlan = :plan
              AND u.isActive = true
              AND u.subscriptionExpiresAt IS NOT NULL
              AND u.subscriptionExpiresAt < :cutoff
            ORDER BY u.subscriptionExpiresAt ASC, u.id ASC
            """)
    List<UUID> findExpiredIdsBefore(@Param("plan") SubscriptionPlan plan,
                                    @Param("cutoff") LocalDateTime cutoff,
                                    Pageable pageable);

    @Query("""
            SELECT u FROM User u
            WHERE u.subscriptionPlan = :plan
              AND u.isActive = true
              AND u.subscriptionExpiresAt > :from
              AND u.subscriptionExpiresAt <= :to
            ORDER BY u.subscriptionExpiresAt ASC
            """)
    List<User> findActiveWithExpiryBetween(@Param("plan") SubscriptionPlan plan,
                                           @Param("from") LocalDateTime from,
                                           @Param("to") LocalDateTime to);
}
