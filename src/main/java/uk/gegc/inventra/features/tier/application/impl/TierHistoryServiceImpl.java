package uk.gegc.inventra.features.tier.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.inventra.features.tier.api.dto.TierHistoryDto;
import uk.gegc.inventra.features.tier.application.TierHistoryService;
import uk.gegc.inventra.features.tier.domain.model.TierHistory;
import uk.gegc.inventra.features.tier.infra.mapping.TierHistoryMapper;
import uk.gegc.inventra.features.tier.infra.repository.TierHistoryRepository;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class TierHistoryServiceImpl implements TierHistoryService {

    private final TierHistoryRepository historyRepository;
    private final TierHistoryMapper historyMapper;

    @Override
    @Transactional
    public TierHistoryDto append(TierHistory entry) {
        if (entry.getId() != null) {
            throw new IllegalArgumentException("Tier history entries are append-only");
        }
        return historyMapper.toDto(historyRepository.save(entry));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TierHistoryDto> listForUser(UUID userId) {
        return historyMapper.toDtos(historyRepository.findByUserIdOrderByEffectiveDateAscCreatedAtAsc(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<TierHistoryDto> listForUser(UUID userId, Pageable pageable) {
        return historyRepository.findByUserId(userId, pageable).map(historyMapper::toDto);
    }
}
