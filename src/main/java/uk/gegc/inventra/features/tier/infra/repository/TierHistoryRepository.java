package uk.gegc.inventra.features.tier.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.inventra.features.tier.domain.model.TierHistory;

import java.util.List;
import java.util.UUID;

public interface TierHistoryRepository extends JpaRepository<TierHistory, UUID> {

    List<TierHistory> findByUserIdOrderByEffectiveDateAscCreatedAtAsc(UUID userId);

    Page<TierHistory> findByUserId(UUID userId, Pageable pageable);
}
