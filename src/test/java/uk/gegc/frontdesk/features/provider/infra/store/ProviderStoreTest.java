package uk.gegc.frontdesk.features.provider.infra.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.frontdesk.BaseUnitTest;
import uk.gegc.frontdesk.config.TestClockConfig;
import uk.gegc.frontdesk.features.provider.domain.model.Provider;
import uk.gegc.frontdesk.features.provider.domain.repository.ProviderRepository;
import uk.gegc.frontdesk.shared.exception.ResourceNotFoundException;
import uk.gegc.frontdesk.shared.exception.StorageFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

class ProviderStoreTest extends BaseUnitTest {

    @Mock
    private ProviderRepository providerRepository;

    private ProviderStore providerStore;

    @BeforeEach
    void setUp() {
        providerStore = new ProviderStore(providerRepository, TestClockConfig.fixedClock());
    }

    @Test
    @DisplayName("create stamps createdAt and updatedAt with the same instant")
    void createStamps() {
        when(providerRepository.saveAndFlush(any(Provider.class))).thenAnswer(invocation -> {
            Provider provider = invocation.getArgument(0);
            provider.setId(1L);
            return provider;
        });
        Provider provider = new Provider();
        provider.setName("City Diagnostic Labs");
        provider.setSector("laboratory");

        Provider created = providerStore.create(provider);

        assertThat(created.getId()).isEqualTo(1L);
        assertThat(created.getCreatedAt()).isEqualTo(TestClockConfig.getFixedInstant());
        assertThat(created.getUpdatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(created.isActive()).isTrue();
    }

    @Test
    @DisplayName("get of an unknown id fails not found")
    void getMissing() {
        when(providerRepository.findById(7L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class, () -> providerStore.get(7L));

        assertThat(ex.getMessage()).isEqualTo("Provider 7 not found");
    }

    @Test
    @DisplayName("deleting a provider still referenced by bookings is a constraint storage failure")
    void deleteReferenced() {
        when(providerRepository.existsById(1L)).thenReturn(true);
        doThrow(new DataIntegrityViolationException("fk_bookings_provider")).when(providerRepository).flush();

        StorageFailureException ex = assertThrows(StorageFailureException.class, () -> providerStore.delete(1L));

        assertThat(ex.isConstraintViolation()).isTrue();
    }
}
