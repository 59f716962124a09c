package uk.gegc.inventra.features.tier.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.inventra.features.tier.api.dto.FeatureUsageDto;
import uk.gegc.inventra.features.tier.api.dto.FeatureUsageRecordDto;
import uk.gegc.inventra.features.tier.domain.model.UserTierFeature;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface UserTierFeatureMapper {

    FeatureUsageRecordDto toRecordDto(UserTierFeature entity);

    @Mapping(target = "current", source = "currentUsage")
    @Mapping(target = "limit", source = "usageLimit")
    FeatureUsageDto toUsageDto(UserTierFeature entity);
}
