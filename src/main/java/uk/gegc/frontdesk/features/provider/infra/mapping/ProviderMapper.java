package uk.gegc.frontdesk.features.provider.infra.mapping;

import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;
import uk.gegc.frontdesk.features.provider.api.dto.CreateProviderRequest;
import uk.gegc.frontdesk.features.provider.api.dto.ProviderDto;
import uk.gegc.frontdesk.features.provider.api.dto.UpdateProviderRequest;
import uk.gegc.frontdesk.features.provider.domain.model.Provider;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ProviderMapper {

    ProviderDto toDto(Provider provider);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "active", constant = "true")
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    Provider toEntity(CreateProviderRequest request);

    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    void applyUpdates(UpdateProviderRequest request, @MappingTarget Provider provider);
}
