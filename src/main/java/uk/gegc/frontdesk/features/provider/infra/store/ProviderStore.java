package uk.gegc.frontdesk.features.provider.infra.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.provider.domain.model.Provider;
import uk.gegc.frontdesk.features.provider.domain.repository.ProviderRepository;
import uk.gegc.frontdesk.features.provider.domain.repository.ProviderSpecifications;
import uk.gegc.frontdesk.shared.exception.ResourceNotFoundException;
import uk.gegc.frontdesk.shared.persistence.PageRequests;
import uk.gegc.frontdesk.shared.persistence.StorageCalls;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable storage of providers. Assigns timestamps and translates data access failures,
 * holds no business rules.
 */
@Component
@RequiredArgsConstructor
public class ProviderStore {

    private static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.ASC, "id");

    private final ProviderRepository providerRepository;
    private final Clock clock;

    public Provider create(Provider provider) {
        Instant now = clock.instant();
        provider.setId(null);
        provider.setCreatedAt(now);
        provider.setUpdatedAt(now);
        return StorageCalls.call("create provider", () -> providerRepository.saveAndFlush(provider));
    }

    public Provider get(Long id) {
        return find(id).orElseThrow(() -> new ResourceNotFoundException("Provider " + id + " not found"));
    }

    public Optional<Provider> find(Long id) {
        return StorageCalls.call("find provider", () -> providerRepository.findById(id));
    }

    public Page<Provider> list(String sector, Pageable pageable) {
        Pageable ordered = PageRequests.withStableOrder(pageable, DEFAULT_SORT);
        return StorageCalls.call("list providers",
                () -> providerRepository.findAll(ProviderSpecifications.build(sector), ordered));
    }

    public Provider update(Provider provider) {
        Long id = provider.getId();
        if (id == null || !StorageCalls.call("check provider", () -> providerRepository.existsById(id))) {
            throw new ResourceNotFoundException("Provider " + id + " not found");
        }
        Instant now = clock.instant();
        Instant previous = provider.getUpdatedAt();
        provider.setUpdatedAt(previous != null && previous.isAfter(now) ? previous : now);
        return StorageCalls.call("update provider", () -> providerRepository.saveAndFlush(provider));
    }

    public void delete(Long id) {
        if (!StorageCalls.call("check provider", () -> providerRepository.existsById(id))) {
            throw new ResourceNotFoundException("Provider " + id + " not found");
        }
        StorageCalls.run("delete provider", () -> {
            providerRepository.deleteById(id);
            providerRepository.flush();
        });
    }
}
