package uk.gegc.inventra.features.tier.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.inventra.features.tier.api.dto.TierFeatureDefinitionDto;
import uk.gegc.inventra.features.tier.domain.model.TierFeatureDefinition;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface TierFeatureDefinitionMapper {
    TierFeatureDefinitionDto toDto(TierFeatureDefinition entity);
    List<TierFeatureDefinitionDto> toDtos(List<TierFeatureDefinition> entities);
}
