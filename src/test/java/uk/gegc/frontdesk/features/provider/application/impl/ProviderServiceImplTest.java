package uk.gegc.frontdesk.features.provider.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import uk.gegc.frontdesk.features.booking.config.BookingProperties;
import uk.gegc.frontdesk.features.booking.domain.rules.LaboratoryHoursRule;
import uk.gegc.frontdesk.features.booking.domain.rules.SectorRuleRegistry;
import uk.gegc.frontdesk.features.provider.api.dto.CreateProviderRequest;
import uk.gegc.frontdesk.features.provider.api.dto.ProviderDto;
import uk.gegc.frontdesk.features.provider.api.dto.SectorCatalogDto;
import uk.gegc.frontdesk.features.provider.api.dto.UpdateProviderRequest;
import uk.gegc.frontdesk.features.provider.domain.model.Provider;
import uk.gegc.frontdesk.features.provider.domain.service.ProviderValidator;
import uk.gegc.frontdesk.features.provider.infra.mapping.ProviderMapper;
import uk.gegc.frontdesk.features.provider.infra.store.ProviderStore;
import uk.gegc.frontdesk.shared.exception.ValidationException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderServiceImplTest {

    private static final Instant CREATED = Instant.parse("2025-01-10T12:00:00Z");

    @Mock
    private ProviderStore providerStore;

    private ProviderServiceImpl providerService;

    @BeforeEach
    void setUp() {
        SectorRuleRegistry registry = new SectorRuleRegistry(List.of(new LaboratoryHoursRule(new BookingProperties())));
        providerService = new ProviderServiceImpl(
                providerStore,
                new ProviderValidator(),
                Mappers.getMapper(ProviderMapper.class),
                registry
        );
    }

    private static Provider stored(Long id) {
        Provider provider = new Provider();
        provider.setId(id);
        provider.setName("City Diagnostic Labs");
        provider.setSector("laboratory");
        provider.setPhone("555-0100");
        provider.setActive(true);
        provider.setCreatedAt(CREATED);
        provider.setUpdatedAt(CREATED);
        return provider;
    }

    @Test
    @DisplayName("registerProvider stores an active provider with the supplied fields")
    void registerProvider_success() {
        when(providerStore.create(any(Provider.class))).thenAnswer(invocation -> {
            Provider provider = invocation.getArgument(0);
            provider.setId(1L);
            provider.setCreatedAt(CREATED);
            provider.setUpdatedAt(CREATED);
            return provider;
        });

        ProviderDto result = providerService.registerProvider(new CreateProviderRequest(
                "City Diagnostic Labs", "laboratory", "555-0100", "desk@citylabs.example", "12 Harbour Road"));

        assertThat(result.id()).isEqualTo(1L);
        assertThat(result.name()).isEqualTo("City Diagnostic Labs");
        assertThat(result.sector()).isEqualTo("laboratory");
        assertThat(result.email()).isEqualTo("desk@citylabs.example");
        assertThat(result.active()).isTrue();
        assertThat(result.createdAt()).isEqualTo(result.updatedAt());
    }

    @Test
    @DisplayName("registerProvider accepts sectors outside the recommended list")
    void registerProvider_openSector() {
        when(providerStore.create(any(Provider.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ProviderDto result = providerService.registerProvider(new CreateProviderRequest(
                "Harbour Kayaks", "water_sports", null, null, null));

        assertThat(result.sector()).isEqualTo("water_sports");
    }

    @Test
    @DisplayName("registerProvider refuses a blank sector before storing")
    void registerProvider_blankSector() {
        CreateProviderRequest request = new CreateProviderRequest("Harbour Kayaks", " ", null, null, null);

        ValidationException ex = assertThrows(ValidationException.class, () -> providerService.registerProvider(request));

        assertThat(ex.getMessage()).isEqualTo("sector must not be blank");
        verifyNoInteractions(providerStore);
    }

    @Test
    @DisplayName("updateProvider changes only the provided fields, including reactivation")
    void updateProvider_partial() {
        Provider provider = stored(1L);
        provider.setActive(false);
        when(providerStore.get(1L)).thenReturn(provider);
        when(providerStore.update(provider)).thenReturn(provider);

        ProviderDto result = providerService.updateProvider(1L,
                new UpdateProviderRequest(null, null, "555-0199", null, null, true));

        assertThat(result.phone()).isEqualTo("555-0199");
        assertThat(result.name()).isEqualTo("City Diagnostic Labs");
        assertThat(result.active()).isTrue();
    }

    @Test
    @DisplayName("updateProvider refuses a blank name")
    void updateProvider_blankName() {
        when(providerStore.get(1L)).thenReturn(stored(1L));

        assertThrows(ValidationException.class, () -> providerService.updateProvider(1L,
                new UpdateProviderRequest("", null, null, null, null, null)));

        verify(providerStore, never()).update(any());
    }

    @Test
    @DisplayName("deactivateProvider clears the active flag")
    void deactivateProvider() {
        Provider provider = stored(2L);
        when(providerStore.get(2L)).thenReturn(provider);
        when(providerStore.update(provider)).thenReturn(provider);

        ProviderDto result = providerService.deactivateProvider(2L);

        assertThat(result.active()).isFalse();
    }

    @Test
    @DisplayName("listProviders maps each stored provider")
    void listProviders() {
        PageRequest pageable = PageRequest.of(0, 10);
        when(providerStore.list("laboratory", pageable)).thenReturn(new PageImpl<>(List.of(stored(1L), stored(2L)), pageable, 2));

        assertThat(providerService.listProviders("laboratory", pageable).getContent())
                .extracting(ProviderDto::id)
                .containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("sector catalog lists suggestions and sectors with rules")
    void sectorCatalog() {
        SectorCatalogDto catalog = providerService.getSectorCatalog();

        assertThat(catalog.recommended()).contains("medical", "laboratory", "other").hasSize(18);
        assertThat(catalog.withBookingRules()).containsExactly("laboratory");
    }
}
