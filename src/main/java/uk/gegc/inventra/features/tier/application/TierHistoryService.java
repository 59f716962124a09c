package uk.gegc.inventra.features.tier.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.inventra.features.tier.api.dto.TierHistoryDto;
import uk.gegc.inventra.features.tier.domain.model.TierHistory;

import java.util.List;
import java.util.UUID;

public interface TierHistoryService {

    /**
     * Inserts a new history entry. Entries are never updated afterwards.
     */
    TierHistoryDto append(TierHistory entry);

    /**
     * All entries of a user ordered by effective date, then creation time.
     */
    List<TierHistoryDto> listForUser(UUID userId);

    Page<TierHistoryDto> listForUser(UUID userId, Pageable pageable);
}
