package uk.gegc.frontdesk.features.provider.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.frontdesk.features.provider.api.dto.CreateProviderRequest;
import uk.gegc.frontdesk.features.provider.api.dto.ProviderDto;
import uk.gegc.frontdesk.features.provider.api.dto.SectorCatalogDto;
import uk.gegc.frontdesk.features.provider.api.dto.UpdateProviderRequest;

public interface ProviderService {

    ProviderDto registerProvider(CreateProviderRequest request);

    ProviderDto getProvider(Long id);

    Page<ProviderDto> listProviders(String sector, Pageable pageable);

    ProviderDto updateProvider(Long id, UpdateProviderRequest request);

    /**
     * Marks the provider inactive. Preferred over deletion because existing bookings keep their reference.
     */
    ProviderDto deactivateProvider(Long id);

    void deleteProvider(Long id);

    SectorCatalogDto getSectorCatalog();
}
