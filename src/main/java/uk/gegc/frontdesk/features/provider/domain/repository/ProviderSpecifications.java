package uk.gegc.frontdesk.features.provider.domain.repository;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.frontdesk.features.provider.domain.model.Provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ProviderSpecifications {

    private ProviderSpecifications() {
    }

    public static Specification<Provider> build(String sector) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            // Sector tags are compared case-insensitively, same as rule dispatch
            if (sector != null && !sector.isBlank()) {
                predicates.add(cb.equal(cb.lower(root.get("sector")), sector.trim().toLowerCase(Locale.ROOT)));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
