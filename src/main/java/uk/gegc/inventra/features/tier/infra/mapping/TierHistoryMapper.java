package uk.gegc.inventra.features.tier.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.inventra.features.tier.api.dto.TierHistoryDto;
import uk.gegc.inventra.features.tier.domain.model.TierHistory;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface TierHistoryMapper {
    TierHistoryDto toDto(TierHistory entity);
    List<TierHistoryDto> toDtos(List<TierHistory> entities);
}
