package uk.gegc.frontdesk.features.provider.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.frontdesk.features.booking.domain.rules.SectorRuleRegistry;
import uk.gegc.frontdesk.features.provider.api.dto.CreateProviderRequest;
import uk.gegc.frontdesk.features.provider.api.dto.ProviderDto;
import uk.gegc.frontdesk.features.provider.api.dto.SectorCatalogDto;
import uk.gegc.frontdesk.features.provider.api.dto.UpdateProviderRequest;
import uk.gegc.frontdesk.features.provider.application.ProviderService;
import uk.gegc.frontdesk.features.provider.domain.model.Provider;
import uk.gegc.frontdesk.features.provider.domain.model.SectorVocabulary;
import uk.gegc.frontdesk.features.provider.domain.service.ProviderValidator;
import uk.gegc.frontdesk.features.provider.infra.mapping.ProviderMapper;
import uk.gegc.frontdesk.features.provider.infra.store.ProviderStore;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ProviderServiceImpl implements ProviderService {

    private final ProviderStore providerStore;
    private final ProviderValidator providerValidator;
    private final ProviderMapper providerMapper;
    private final SectorRuleRegistry sectorRuleRegistry;

    @Override
    public ProviderDto registerProvider(CreateProviderRequest request) {
        providerValidator.validateRegistration(request);

        Provider saved = providerStore.create(providerMapper.toEntity(request));
        log.info("Registered provider {} in sector '{}'", saved.getId(), saved.getSector());
        return providerMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public ProviderDto getProvider(Long id) {
        return providerMapper.toDto(providerStore.get(id));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ProviderDto> listProviders(String sector, Pageable pageable) {
        return providerStore.list(sector, pageable).map(providerMapper::toDto);
    }

    @Override
    public ProviderDto updateProvider(Long id, UpdateProviderRequest request) {
        Provider provider = providerStore.get(id);
        providerValidator.validateUpdate(request);

        providerMapper.applyUpdates(request, provider);
        Provider saved = providerStore.update(provider);
        log.info("Updated provider {}", saved.getId());
        return providerMapper.toDto(saved);
    }

    @Override
    public ProviderDto deactivateProvider(Long id) {
        Provider provider = providerStore.get(id);
        provider.setActive(false);

        Provider saved = providerStore.update(provider);
        log.info("Deactivated provider {}", saved.getId());
        return providerMapper.toDto(saved);
    }

    @Override
    public void deleteProvider(Long id) {
        providerStore.delete(id);
        log.info("Deleted provider {}", id);
    }

    @Override
    @Transactional(readOnly = true)
    public SectorCatalogDto getSectorCatalog() {
        return new SectorCatalogDto(SectorVocabulary.RECOMMENDED, sectorRuleRegistry.registeredSectors());
    }
}
